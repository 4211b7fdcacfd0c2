package com.example.leadengine.model;

import java.time.Instant;
import java.util.UUID;

public record OutboundMessage(
    UUID messageId,
    UUID leadId,
    UUID sequenceId,
    int touchIndex,
    OutboundMessageKind kind,
    UUID replyId,
    String toAddress,
    String subject,
    String body,
    OutboundMessageStatus status,
    Instant scheduledAt,
    Instant sentAt,
    String error,
    String lintViolationsJson,
    String provider,
    String providerCampaignRef,
    String providerMessageId,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt) {}
