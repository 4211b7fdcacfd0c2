package com.example.leadengine.service;

import java.util.Locale;

/** 配信プロバイダ webhook を正規化したイベント種別。 */
public enum DeliveryEventType {
  SENT,
  OPENED,
  REPLIED,
  BOUNCED,
  UNSUBSCRIBED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static DeliveryEventType fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("event type is required");
    }
    for (DeliveryEventType type : values()) {
      if (type.value().equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported delivery event: " + value);
  }
}
