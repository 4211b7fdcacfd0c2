/*
 * どこで: 監査ドメインモデル
 * 何を: 監査ログに書き込めるイベント名の閉じた語彙
 * なぜ: 自由文字列のイベント名で追跡が崩れるのを防ぐため
 */
package com.example.leadengine.model;

import java.util.Locale;

public enum AuditEvent {
  LEAD_CREATED,
  LEAD_SUPPRESSED,
  LEAD_CLASSIFIED,
  LEAD_QUALIFIED,
  LEAD_DISQUALIFIED,
  LEVERAGE_ASSIGNED,
  ITEM_MATCHED,
  SCRAPE_REQUESTED,
  SCRAPE_COMPLETED,
  SCRAPE_FAILED,
  EMAIL_RENDERED,
  EMAIL_SENT,
  EMAIL_DELIVERED,
  EMAIL_BOUNCED,
  REPLY_RECEIVED,
  REPLY_CLASSIFIED,
  REPLY_RESPONSE_SENT,
  SUPPRESSION_ADDED,
  JOB_CREATED,
  JOB_STARTED,
  JOB_COMPLETED,
  JOB_FAILED;

  // 旧称。読み出し時のみ受け付ける
  private static final String LEGACY_ITEM_MATCHED = "brand_matched";

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AuditEvent fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("audit event is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (LEGACY_ITEM_MATCHED.equals(normalized)) {
      return ITEM_MATCHED;
    }
    for (AuditEvent event : values()) {
      if (event.value().equals(normalized)) {
        return event;
      }
    }
    throw new IllegalArgumentException("unknown audit event: " + value);
  }
}
