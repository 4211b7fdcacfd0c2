package com.example.leadengine.api.response;

import com.example.leadengine.service.ReplyOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReplyOutcomeResponse(
    String replyId,
    String leadId,
    String classification,
    String action,
    String approval,
    boolean statusChanged,
    boolean responseQueued) {

  public static ReplyOutcomeResponse from(ReplyOutcome outcome) {
    if (outcome == null) {
      return null;
    }
    return new ReplyOutcomeResponse(
        outcome.replyId().toString(),
        outcome.leadId().toString(),
        outcome.classification().value(),
        outcome.action() == null ? null : outcome.action().value(),
        outcome.approval() == null ? null : outcome.approval().name(),
        outcome.statusChanged(),
        outcome.responseQueued());
  }
}
