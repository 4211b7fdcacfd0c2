/*
 * どこで: Lead Engine サービス層
 * 何を: 返信下書きの承認/却下と、承認済み返信の送信キュー投入を行う
 * なぜ: 初期の下書きを人手で確認してから送るため
 */
package com.example.leadengine.service;

import com.example.leadengine.engine.ContentLinter;
import com.example.leadengine.engine.LintResult;
import com.example.leadengine.model.ApprovalState;
import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.model.OutboundMessageKind;
import com.example.leadengine.model.OutboundMessageStatus;
import com.example.leadengine.model.Reply;
import com.example.leadengine.repository.JsonColumns;
import com.example.leadengine.repository.LeadRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import com.example.leadengine.repository.ReplyRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ReplyApprovalService {

  private static final Logger logger = LoggerFactory.getLogger(ReplyApprovalService.class);
  static final int REPLY_TOUCH_INDEX = 0;

  private final ReplyRepository replyRepository;
  private final LeadRepository leadRepository;
  private final OutboundMessageRepository outboundMessageRepository;
  private final ContentLinter contentLinter;
  private final AuditLedger auditLedger;
  private final JsonColumns jsonColumns;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public List<Reply> pending(int limit) {
    return replyRepository.findPending(limit);
  }

  /** PENDING の下書きを承認し、返信メッセージを送信キューへ積む。 */
  public Reply approve(UUID replyId, String decidedBy) {
    final Reply reply = findReply(replyId);
    final Lead lead =
        leadRepository.findById(reply.leadId()).orElseThrow(() -> new LeadNotFoundException(reply.leadId()));
    final String correlationId = CorrelationIds.current();
    final Instant now = Instant.now(clock);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              if (replyRepository.decide(replyId, ApprovalState.APPROVED, decidedBy, now) == 0) {
                throw new ReplyNotPendingException(replyId);
              }
              queueResponse(reply, lead, decidedBy, correlationId, now);
            });
    logger.info("reply approved replyId={} decidedBy={}", replyId, decidedBy);
    return findReply(replyId);
  }

  public Reply reject(UUID replyId, String decidedBy) {
    findReply(replyId);
    if (replyRepository.decide(replyId, ApprovalState.REJECTED, decidedBy, Instant.now(clock)) == 0) {
      throw new ReplyNotPendingException(replyId);
    }
    logger.info("reply rejected replyId={} decidedBy={}", replyId, decidedBy);
    return findReply(replyId);
  }

  /**
   * 役割: 承認済み下書きを REPLY_RESPONSE として送信キューに積む。
   * 動作: 本文を再度検査し、合格なら RENDERED で保存して response_sent と reply_response_sent を記録する。
   * 違反や宛先なしの場合は FAILED で保存し、オペレータキューに回す。
   * 前提: 呼び出し側のトランザクション内で呼ぶ。
   */
  boolean queueResponse(Reply reply, Lead lead, String actor, String correlationId, Instant now) {
    final String subject =
        reply.draftSubject() == null || reply.draftSubject().isBlank()
            ? "Re: " + lead.companyName()
            : reply.draftSubject();
    final LintResult lint = contentLinter.lint(subject, reply.draftResponse(), List.of());
    final String error;
    if (!lint.passed()) {
      error = lint.summary();
    } else if (!lead.hasContactEmail()) {
      error = "missing recipient address";
    } else {
      error = null;
    }
    final OutboundMessage message =
        new OutboundMessage(
            UUID.randomUUID(),
            lead.leadId(),
            null,
            REPLY_TOUCH_INDEX,
            OutboundMessageKind.REPLY_RESPONSE,
            reply.replyId(),
            lead.contactEmail(),
            subject,
            reply.draftResponse(),
            error == null ? OutboundMessageStatus.RENDERED : OutboundMessageStatus.FAILED,
            now,
            null,
            error,
            jsonColumns.write(lint.violations()),
            null,
            null,
            null,
            null,
            null,
            now);
    outboundMessageRepository.insert(message, now);
    if (error != null) {
      logger.warn("reply response not queued replyId={} error={}", reply.replyId(), error);
      return false;
    }
    replyRepository.markResponseSent(reply.replyId());
    auditLedger.record(
        correlationId,
        AuditEvent.REPLY_RESPONSE_SENT,
        lead.leadId(),
        null,
        actor,
        AuditLedger.payload(
            "reply_id", reply.replyId(),
            "message_id", message.messageId(),
            "classification", reply.classification() == null ? null : reply.classification().value()));
    return true;
  }

  private Reply findReply(UUID replyId) {
    return replyRepository.findById(replyId).orElseThrow(() -> new ReplyNotFoundException(replyId));
  }
}
