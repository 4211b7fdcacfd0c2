/*
 * どこで: Reply ドメインモデル
 * 何を: 受信した返信と分類/下書き/承認状態
 * なぜ: 返信処理の判断を 1 行に残して運用画面から確認できるようにするため
 */
package com.example.leadengine.model;

import java.time.Instant;
import java.util.UUID;

public record Reply(
    UUID replyId,
    UUID leadId,
    UUID outboundMessageId,
    String rawText,
    String providerMessageId,
    ReplyClassification classification,
    String objectionType,
    ReplyAction action,
    Integer interestLevel,
    String draftSubject,
    String draftResponse,
    ApprovalState approval,
    String decidedBy,
    Instant decidedAt,
    boolean responseSent,
    String classifierCallId,
    Instant createdAt) {

  public boolean hasDraft() {
    return draftResponse != null && !draftResponse.isBlank();
  }
}
