package com.example.leadengine.engine;

import com.example.leadengine.model.ItemSelectionQuery;

public record LeverageDecision(
    Long ruleId,
    String primaryAngle,
    String secondaryAngle,
    String matchReason,
    boolean fallback,
    ItemSelectionQuery selectionQuery) {}
