package com.example.leadengine.api.response;

import com.example.leadengine.service.DeliveryEventResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryEventResponse(
    String event, boolean matched, String leadId, String messageId, ReplyOutcomeResponse reply) {

  public static DeliveryEventResponse from(DeliveryEventResult result) {
    return new DeliveryEventResponse(
        result.type().value(),
        result.matched(),
        result.leadId() == null ? null : result.leadId().toString(),
        result.messageId() == null ? null : result.messageId().toString(),
        ReplyOutcomeResponse.from(result.replyOutcome()));
  }
}
