package com.example.leadengine.engine;

public record QualificationVerdict(boolean qualified, String disqualifyReason) {

  public static final String PRIVATE_LABEL_ONLY = "private_label_only";
  public static final String ARBITRAGE_NO_SCALE = "arbitrage_no_scale";

  public static QualificationVerdict pass() {
    return new QualificationVerdict(true, null);
  }

  public static QualificationVerdict disqualified(String reason) {
    return new QualificationVerdict(false, reason);
  }
}
