package com.example.leadengine.collaborator;

import java.util.UUID;

public record DeliveryRequest(
    String campaignRef,
    String address,
    UUID leadId,
    UUID messageId,
    UUID sequenceId,
    int touchIndex,
    String subject,
    String body) {}
