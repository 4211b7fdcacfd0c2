package com.example.leadengine.api.response;

import com.example.leadengine.model.Reply;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReplyResponse(
    String replyId,
    String leadId,
    String rawText,
    String classification,
    String objectionType,
    String action,
    Integer interestLevel,
    String draftSubject,
    String draftResponse,
    String approval,
    String decidedBy,
    String decidedAt,
    boolean responseSent,
    String createdAt) {

  public static ReplyResponse from(Reply reply) {
    return new ReplyResponse(
        reply.replyId().toString(),
        reply.leadId().toString(),
        reply.rawText(),
        reply.classification() == null ? null : reply.classification().value(),
        reply.objectionType(),
        reply.action() == null ? null : reply.action().value(),
        reply.interestLevel(),
        reply.draftSubject(),
        reply.draftResponse(),
        reply.approval() == null ? null : reply.approval().name(),
        reply.decidedBy(),
        ApiTimes.format(reply.decidedAt()),
        reply.responseSent(),
        ApiTimes.format(reply.createdAt()));
  }
}
