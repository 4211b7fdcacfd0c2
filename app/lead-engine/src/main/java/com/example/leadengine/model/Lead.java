/*
 * どこで: Lead ドメインモデル
 * 何を: leads テーブルの 1 行を表すスナップショット
 * なぜ: オーケストレータと API で同じ形を共有するため
 */
package com.example.leadengine.model;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

public record Lead(
    UUID leadId,
    String companyName,
    String websiteUrl,
    String contactEmail,
    String channel,
    String niche,
    String location,
    String notes,
    LeadStatus status,
    String disqualifyReason,
    LeadOutcome outcome,
    String outcomeNotes,
    Instant bookedAt,
    Instant createdAt,
    Instant updatedAt) {

  public boolean hasContactEmail() {
    return contactEmail != null && !contactEmail.isBlank();
  }

  public String channelOrEmpty() {
    return channel == null ? "" : channel.toLowerCase(Locale.ROOT);
  }
}
