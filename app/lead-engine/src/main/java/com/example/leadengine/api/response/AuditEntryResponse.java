package com.example.leadengine.api.response;

import com.example.leadengine.model.AuditEntry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEntryResponse(
    long auditId,
    String correlationId,
    String event,
    String leadId,
    String jobId,
    String actor,
    String payload,
    String createdAt) {

  public static AuditEntryResponse from(AuditEntry entry) {
    return new AuditEntryResponse(
        entry.auditId(),
        entry.correlationId(),
        entry.event().value(),
        entry.leadId() == null ? null : entry.leadId().toString(),
        entry.jobId() == null ? null : entry.jobId().toString(),
        entry.actor(),
        entry.payloadJson(),
        ApiTimes.format(entry.createdAt()));
  }
}
