package com.example.leadengine.api.response;

import com.example.leadengine.model.OutboundMessage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** lint_violations は DB に保存した JSON 配列をそのまま返す。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OutboundMessageResponse(
    String messageId,
    String leadId,
    String sequenceId,
    int touchIndex,
    String kind,
    String toAddress,
    String subject,
    String body,
    String status,
    String scheduledAt,
    String sentAt,
    String error,
    String lintViolations,
    String providerMessageId) {

  public static OutboundMessageResponse from(OutboundMessage message) {
    return new OutboundMessageResponse(
        message.messageId().toString(),
        message.leadId().toString(),
        message.sequenceId() == null ? null : message.sequenceId().toString(),
        message.touchIndex(),
        message.kind().name(),
        message.toAddress(),
        message.subject(),
        message.body(),
        message.status().name(),
        ApiTimes.format(message.scheduledAt()),
        ApiTimes.format(message.sentAt()),
        message.error(),
        message.lintViolationsJson(),
        message.providerMessageId());
  }
}
