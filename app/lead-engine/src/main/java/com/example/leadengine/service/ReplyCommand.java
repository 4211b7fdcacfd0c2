package com.example.leadengine.service;

import java.util.UUID;

public record ReplyCommand(
    UUID leadId, String rawText, UUID outboundMessageId, String providerMessageId) {}
