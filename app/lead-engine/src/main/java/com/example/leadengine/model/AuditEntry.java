package com.example.leadengine.model;

import java.time.Instant;
import java.util.UUID;

public record AuditEntry(
    long auditId,
    String correlationId,
    AuditEvent event,
    UUID leadId,
    UUID jobId,
    String actor,
    String payloadJson,
    Instant createdAt) {}
