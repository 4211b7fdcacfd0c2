package com.example.leadengine.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** lead_leverage の 1 行。再評価時は上書きされる。 */
public record LeverageAssignment(
    UUID leadId,
    Long matchedRuleId,
    String primaryAngle,
    String secondaryAngle,
    String matchReason,
    boolean fallback,
    ItemSelectionQuery selectionQuery,
    List<Long> selectedItemIds,
    Instant assignedAt) {

  public LeverageAssignment {
    selectedItemIds = selectedItemIds == null ? List.of() : List.copyOf(selectedItemIds);
  }
}
