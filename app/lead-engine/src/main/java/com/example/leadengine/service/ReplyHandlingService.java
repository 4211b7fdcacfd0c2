/*
 * どこで: Lead Engine サービス層
 * 何を: 受信した返信を記録/分類し、状態遷移と返信下書きを作る
 * なぜ: 配信停止の意思を分類より先に確定させ、以降の送信を確実に止めるため
 */
package com.example.leadengine.service;

import com.example.leadengine.collaborator.CannedMessages;
import com.example.leadengine.collaborator.MessageDraft;
import com.example.leadengine.collaborator.ReplyClassificationOutcome;
import com.example.leadengine.collaborator.ReplyClassificationResult;
import com.example.leadengine.collaborator.ReplyClassifier;
import com.example.leadengine.config.ReplyProperties;
import com.example.leadengine.engine.ContentLinter;
import com.example.leadengine.engine.LintResult;
import com.example.leadengine.engine.OptOutDetector;
import com.example.leadengine.model.ApprovalState;
import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.Reply;
import com.example.leadengine.model.ReplyAction;
import com.example.leadengine.model.ReplyClassification;
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
public class ReplyHandlingService {

  private static final Logger logger = LoggerFactory.getLogger(ReplyHandlingService.class);
  static final String UNSUBSCRIBE_REASON = "unsubscribe";
  static final String NOT_INTERESTED_REASON = "not_interested";

  private final LeadRepository leadRepository;
  private final ReplyRepository replyRepository;
  private final OutboundMessageRepository outboundMessageRepository;
  private final ReplyClassifier replyClassifier;
  private final OptOutDetector optOutDetector;
  private final SuppressionService suppressionService;
  private final CannedMessages cannedMessages;
  private final ObjectionResponder objectionResponder;
  private final SelectedItemNames selectedItemNames;
  private final ContentLinter contentLinter;
  private final ReplyApprovalService replyApprovalService;
  private final LeadTransitions leadTransitions;
  private final AuditLedger auditLedger;
  private final LeadEngineMetrics metrics;
  private final ReplyProperties replyProperties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: 1 件の返信を処理する。
   * 動作: 返信を保存して reply_received を書いた後、配信停止の文言があれば分類せずに抑止して終える。
   * それ以外は分類結果に応じて状態を進め、興味あり/異議には下書きを作り承認ポリシーを適用する。
   * 前提: 分類器の失敗は unknown / handoff_to_human として扱う。
   */
  public ReplyOutcome handleReply(ReplyCommand command, String actor) {
    if (command.rawText() == null) {
      throw new IllegalArgumentException("reply text is required");
    }
    final Lead lead =
        leadRepository
            .findById(command.leadId())
            .orElseThrow(() -> new LeadNotFoundException(command.leadId()));
    final String correlationId = CorrelationIds.current();
    final Reply reply = recordReceived(lead, command, actor, correlationId);

    if (optOutDetector.isOptOut(command.rawText())) {
      return handleOptOut(lead, reply, actor, correlationId);
    }

    final ReplyClassificationOutcome outcome = classify(lead, command.rawText());
    final ReplyClassificationResult result = outcome.result();
    final ReplyClassification classification = result.classificationValue();
    metrics.recordReply(classification.value());

    final Instant now = Instant.now(clock);
    return switch (classification) {
      case INTERESTED -> {
        final MessageDraft draft = cannedMessages.interestedResponse(lead.companyName());
        yield applyEngaged(
            lead, reply, outcome, LeadStatus.INTERESTED, result.actionValue(), draft, actor,
            correlationId, now);
      }
      case OBJECTION -> {
        final List<String> itemNames = selectedItemNames.forLead(lead.leadId());
        final MessageDraft draft =
            objectionResponder.draft(lead.companyName(), result.objectionType(), itemNames);
        final LintResult lint = contentLinter.lint(draft.subject(), draft.body(), itemNames);
        if (lint.passed()) {
          yield applyEngaged(
              lead, reply, outcome, LeadStatus.OBJECTION, result.actionValue(), draft, actor,
              correlationId, now);
        }
        logger.warn(
            "objection draft rejected by linter; handing off replyId={} violations={}",
            reply.replyId(),
            lint.summary());
        yield applyEngaged(
            lead, reply, outcome, LeadStatus.OBJECTION, ReplyAction.HANDOFF_TO_HUMAN, null, actor,
            correlationId, now);
      }
      case NOT_INTERESTED -> applyTerminal(lead, reply, outcome, actor, correlationId, now);
      default -> applyHandoff(lead, reply, outcome, classification, actor, correlationId);
    };
  }

  private Reply recordReceived(
      Lead lead, ReplyCommand command, String actor, String correlationId) {
    final Reply reply =
        new Reply(
            UUID.randomUUID(),
            lead.leadId(),
            command.outboundMessageId(),
            command.rawText(),
            command.providerMessageId(),
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            false,
            null,
            Instant.now(clock));
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              replyRepository.insert(reply);
              auditLedger.record(
                  correlationId,
                  AuditEvent.REPLY_RECEIVED,
                  lead.leadId(),
                  null,
                  actor,
                  AuditLedger.payload(
                      "reply_id", reply.replyId(),
                      "outbound_message_id", command.outboundMessageId(),
                      "provider_message_id", command.providerMessageId(),
                      "preview", preview(command.rawText())));
            });
    return reply;
  }

  private ReplyOutcome handleOptOut(Lead lead, Reply reply, String actor, String correlationId) {
    if (lead.hasContactEmail()) {
      suppressionService.suppressAddress(
          lead.contactEmail(), UNSUBSCRIBE_REASON, lead.leadId(), actor, correlationId);
    }
    final Instant now = Instant.now(clock);
    final Boolean changed =
        new TransactionTemplate(transactionManager)
            .execute(
                status -> {
                  replyRepository.updateClassification(
                      reply.replyId(),
                      ReplyClassification.UNSUBSCRIBE,
                      null,
                      ReplyAction.SUPPRESS,
                      null,
                      null,
                      null,
                      null,
                      null);
                  // 連絡先が無いリードは抑止側で DEAD にならないためここで落とす
                  final boolean moved =
                      leadTransitions.apply(
                          lead.leadId(),
                          LeadStatus.DEAD,
                          SuppressionService.DEAD_REASON_PREFIX + UNSUBSCRIBE_REASON,
                          now);
                  outboundMessageRepository.pauseActiveSequence(List.of(lead.leadId()), now);
                  auditLedger.record(
                      correlationId,
                      AuditEvent.REPLY_CLASSIFIED,
                      lead.leadId(),
                      null,
                      actor,
                      AuditLedger.payload(
                          "reply_id", reply.replyId(),
                          "classification", ReplyClassification.UNSUBSCRIBE.value(),
                          "action", ReplyAction.SUPPRESS.value(),
                          "opt_out", true));
                  return moved;
                });
    metrics.recordReply(ReplyClassification.UNSUBSCRIBE.value());
    logger.info("reply opt-out handled leadId={} replyId={}", lead.leadId(), reply.replyId());
    return new ReplyOutcome(
        reply.replyId(),
        lead.leadId(),
        ReplyClassification.UNSUBSCRIBE,
        ReplyAction.SUPPRESS,
        null,
        Boolean.TRUE.equals(changed),
        false);
  }

  /**
   * 興味あり/異議。下書きがあれば承認カウンタを進め、しきい値以下なら PENDING、超えれば APPROVED とする。
   */
  private ReplyOutcome applyEngaged(
      Lead lead,
      Reply reply,
      ReplyClassificationOutcome outcome,
      LeadStatus target,
      ReplyAction action,
      MessageDraft draft,
      String actor,
      String correlationId,
      Instant now) {
    final ReplyClassificationResult result = outcome.result();
    final ReplyClassification classification = result.classificationValue();
    final EngagedWrite written =
        new TransactionTemplate(transactionManager)
            .execute(
                status -> {
                  ApprovalState approval = null;
                  if (draft != null) {
                    final long drafted = replyRepository.incrementDraftCounter();
                    approval =
                        drafted <= replyProperties.humanApprovalThreshold()
                            ? ApprovalState.PENDING
                            : ApprovalState.APPROVED;
                  }
                  outboundMessageRepository.pauseActiveSequence(List.of(lead.leadId()), now);
                  replyRepository.updateClassification(
                      reply.replyId(),
                      classification,
                      result.objectionType(),
                      action,
                      result.interestLevel(),
                      draft == null ? null : draft.subject(),
                      draft == null ? null : draft.body(),
                      approval,
                      outcome.callId());
                  final boolean moved = leadTransitions.apply(lead.leadId(), target, null, now);
                  auditLedger.record(
                      correlationId,
                      AuditEvent.REPLY_CLASSIFIED,
                      lead.leadId(),
                      null,
                      actor,
                      AuditLedger.payload(
                          "reply_id", reply.replyId(),
                          "classification", classification.value(),
                          "objection_type", result.objectionType(),
                          "action", action.value(),
                          "interest_level", result.interestLevel(),
                          "approval", approval == null ? null : approval.name(),
                          "call_id", outcome.callId()));
                  boolean queued = false;
                  if (approval == ApprovalState.APPROVED) {
                    final Reply approved = replyRepository.findById(reply.replyId()).orElseThrow();
                    queued =
                        replyApprovalService.queueResponse(approved, lead, actor, correlationId, now);
                  }
                  return new EngagedWrite(approval, moved, queued);
                });
    logger.info(
        "reply classified leadId={} replyId={} classification={} approval={}",
        lead.leadId(),
        reply.replyId(),
        classification.value(),
        written.approval());
    return new ReplyOutcome(
        reply.replyId(),
        lead.leadId(),
        classification,
        action,
        written.approval(),
        written.statusChanged(),
        written.responseQueued());
  }

  private ReplyOutcome applyTerminal(
      Lead lead,
      Reply reply,
      ReplyClassificationOutcome outcome,
      String actor,
      String correlationId,
      Instant now) {
    final ReplyClassificationResult result = outcome.result();
    final Boolean changed =
        new TransactionTemplate(transactionManager)
            .execute(
                status -> {
                  replyRepository.updateClassification(
                      reply.replyId(),
                      ReplyClassification.NOT_INTERESTED,
                      null,
                      result.actionValue(),
                      result.interestLevel(),
                      null,
                      null,
                      null,
                      outcome.callId());
                  final boolean moved =
                      leadTransitions.apply(lead.leadId(), LeadStatus.DEAD, NOT_INTERESTED_REASON, now);
                  outboundMessageRepository.pauseActiveSequence(List.of(lead.leadId()), now);
                  auditLedger.record(
                      correlationId,
                      AuditEvent.REPLY_CLASSIFIED,
                      lead.leadId(),
                      null,
                      actor,
                      AuditLedger.payload(
                          "reply_id", reply.replyId(),
                          "classification", ReplyClassification.NOT_INTERESTED.value(),
                          "action", result.actionValue().value(),
                          "call_id", outcome.callId()));
                  return moved;
                });
    return new ReplyOutcome(
        reply.replyId(),
        lead.leadId(),
        ReplyClassification.NOT_INTERESTED,
        result.actionValue(),
        null,
        Boolean.TRUE.equals(changed),
        false);
  }

  // 状態は動かさず人手に回す
  private ReplyOutcome applyHandoff(
      Lead lead,
      Reply reply,
      ReplyClassificationOutcome outcome,
      ReplyClassification classification,
      String actor,
      String correlationId) {
    final ReplyClassificationResult result = outcome.result();
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              replyRepository.updateClassification(
                  reply.replyId(),
                  classification,
                  result.objectionType(),
                  ReplyAction.HANDOFF_TO_HUMAN,
                  result.interestLevel(),
                  null,
                  null,
                  null,
                  outcome.callId());
              auditLedger.record(
                  correlationId,
                  AuditEvent.REPLY_CLASSIFIED,
                  lead.leadId(),
                  null,
                  actor,
                  AuditLedger.payload(
                      "reply_id", reply.replyId(),
                      "classification", classification.value(),
                      "action", ReplyAction.HANDOFF_TO_HUMAN.value(),
                      "call_id", outcome.callId()));
            });
    return new ReplyOutcome(
        reply.replyId(),
        lead.leadId(),
        classification,
        ReplyAction.HANDOFF_TO_HUMAN,
        null,
        false,
        false);
  }

  private ReplyClassificationOutcome classify(Lead lead, String text) {
    final String context =
        "company=" + lead.companyName() + ", niche=" + lead.niche() + ", status=" + lead.status();
    try {
      final ReplyClassificationOutcome outcome = replyClassifier.classify(text, context);
      if (outcome != null && outcome.result() != null && outcome.result().isValid()) {
        return outcome;
      }
      logger.warn("reply classifier returned invalid output; handing off leadId={}", lead.leadId());
    } catch (RuntimeException ex) {
      logger.warn("reply classifier failed; handing off leadId={}", lead.leadId(), ex);
    }
    return new ReplyClassificationOutcome(ReplyClassificationResult.DEFAULT, null);
  }

  private String preview(String text) {
    final int limit = replyProperties.previewLength();
    return text.length() <= limit ? text : text.substring(0, limit);
  }

  private record EngagedWrite(ApprovalState approval, boolean statusChanged, boolean responseQueued) {}
}
