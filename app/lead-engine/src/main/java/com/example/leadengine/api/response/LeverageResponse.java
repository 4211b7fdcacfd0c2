package com.example.leadengine.api.response;

import com.example.leadengine.model.LeverageAssignment;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LeverageResponse(
    Long matchedRuleId,
    String primaryAngle,
    String secondaryAngle,
    String matchReason,
    boolean fallback,
    List<Long> selectedItemIds,
    List<String> selectedItemNames) {

  public static LeverageResponse from(LeverageAssignment assignment, List<String> itemNames) {
    if (assignment == null) {
      return null;
    }
    return new LeverageResponse(
        assignment.matchedRuleId(),
        assignment.primaryAngle(),
        assignment.secondaryAngle(),
        assignment.matchReason(),
        assignment.fallback(),
        assignment.selectedItemIds(),
        itemNames);
  }
}
