package com.example.leadengine.api.response;

import com.example.leadengine.model.SuppressionEntry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SuppressionEntryResponse(
    long suppressionId,
    String address,
    String domain,
    String reason,
    String sourceLeadId,
    String createdAt) {

  public static SuppressionEntryResponse from(SuppressionEntry entry) {
    return new SuppressionEntryResponse(
        entry.suppressionId(),
        entry.address(),
        entry.domain(),
        entry.reason(),
        entry.sourceLeadId() == null ? null : entry.sourceLeadId().toString(),
        ApiTimes.format(entry.createdAt()));
  }
}
