package com.example.leadengine.model;

import java.util.Locale;

public enum ReplyClassification {
  INTERESTED,
  OBJECTION,
  NOT_INTERESTED,
  UNSUBSCRIBE,
  OUT_OF_OFFICE,
  UNKNOWN;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** 未知の値は UNKNOWN に寄せる。 */
  public static ReplyClassification fromValue(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    for (ReplyClassification classification : values()) {
      if (classification.value().equalsIgnoreCase(value.trim())) {
        return classification;
      }
    }
    return UNKNOWN;
  }
}
