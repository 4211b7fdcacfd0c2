package com.example.leadengine.api.response;

import com.example.leadengine.service.SuppressionResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SuppressionResponse(
    String address, String domain, boolean added, List<String> deadLeadIds, int pausedMessages) {

  public static SuppressionResponse from(SuppressionResult result) {
    return new SuppressionResponse(
        result.address(),
        result.domain(),
        result.added(),
        result.deadLeadIds().stream().map(UUID::toString).toList(),
        result.pausedMessages());
  }
}
