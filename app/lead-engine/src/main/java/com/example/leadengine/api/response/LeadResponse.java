/*
 * どこで: Lead Engine API レスポンス DTO
 * 何を: リード 1 件の状態を返す
 * なぜ: 内部モデルと API の形を切り離すため
 */
package com.example.leadengine.api.response;

import com.example.leadengine.model.Lead;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LeadResponse(
    String leadId,
    String companyName,
    String websiteUrl,
    String contactEmail,
    String channel,
    String niche,
    String location,
    String status,
    String disqualifyReason,
    String outcome,
    String outcomeNotes,
    String bookedAt,
    String createdAt,
    String updatedAt) {

  public static LeadResponse from(Lead lead) {
    return new LeadResponse(
        lead.leadId().toString(),
        lead.companyName(),
        lead.websiteUrl(),
        lead.contactEmail(),
        lead.channel(),
        lead.niche(),
        lead.location(),
        lead.status().name(),
        lead.disqualifyReason(),
        lead.outcome() == null ? null : lead.outcome().value(),
        lead.outcomeNotes(),
        ApiTimes.format(lead.bookedAt()),
        ApiTimes.format(lead.createdAt()),
        ApiTimes.format(lead.updatedAt()));
  }
}
