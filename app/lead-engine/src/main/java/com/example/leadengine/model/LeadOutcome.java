package com.example.leadengine.model;

import java.util.Locale;

/** 商談後の最終ラベル。BOOKED 以外の状態にも付与できる。 */
public enum LeadOutcome {
  NOT_FIT,
  FOLLOW_UP,
  DEAL_IN_PROGRESS,
  CLOSED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static LeadOutcome fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("outcome is required");
    }
    for (LeadOutcome outcome : values()) {
      if (outcome.value().equalsIgnoreCase(value.trim())) {
        return outcome;
      }
    }
    throw new IllegalArgumentException("unsupported outcome: " + value);
  }
}
