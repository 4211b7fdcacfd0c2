/*
 * どこで: Lead Engine サービス層
 * 何を: 5 タッチの送信シーケンスを生成/検査して保存する
 * なぜ: すべての文面をリンタに通し、送信順と送信時刻を作成時に確定させるため
 */
package com.example.leadengine.service;

import com.example.leadengine.collaborator.CannedMessages;
import com.example.leadengine.collaborator.MessageDraft;
import com.example.leadengine.collaborator.MessageGenerator;
import com.example.leadengine.collaborator.MessageRequest;
import com.example.leadengine.engine.ContentLinter;
import com.example.leadengine.engine.LintResult;
import com.example.leadengine.engine.MessageVariables;
import com.example.leadengine.engine.SequenceTiming;
import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.LeverageAssignment;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.model.OutboundMessageKind;
import com.example.leadengine.model.OutboundMessageStatus;
import com.example.leadengine.model.SignalSet;
import com.example.leadengine.repository.JsonColumns;
import com.example.leadengine.repository.LeverageAssignmentRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import com.example.leadengine.repository.SignalSetRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class OutboundSequenceService {

  private static final Logger logger = LoggerFactory.getLogger(OutboundSequenceService.class);
  static final String ACTOR = "sequence_builder";

  private final MessageGenerator messageGenerator;
  private final CannedMessages cannedMessages;
  private final ContentLinter contentLinter;
  private final SequenceTiming sequenceTiming;
  private final LeverageAssignmentRepository leverageAssignmentRepository;
  private final SelectedItemNames selectedItemNames;
  private final SignalSetRepository signalSetRepository;
  private final OutboundMessageRepository outboundMessageRepository;
  private final LeadTransitions leadTransitions;
  private final AuditLedger auditLedger;
  private final JsonColumns jsonColumns;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public SequenceResult createSequence(Lead lead, String correlationId) {
    return createSequence(lead, Map.of(), correlationId);
  }

  /**
   * 役割: リードの送信シーケンスを作る。
   * 動作: 変数セットを先に検査し、違反があれば何も保存しない。各タッチは生成後に検査し、
   * 合格なら RENDERED、違反なら違反内容付きの FAILED として全件と CONTACTED 遷移を 1 トランザクションで保存する。
   * 前提: extraVariables は生成に渡す追加変数で、禁止キーの検査対象になる。
   */
  public SequenceResult createSequence(
      Lead lead, Map<String, String> extraVariables, String correlationId) {
    final LeverageAssignment assignment =
        leverageAssignmentRepository
            .findByLeadId(lead.leadId())
            .orElseThrow(
                () -> new IllegalStateException("leverage missing for lead " + lead.leadId()));
    final List<String> itemNames = selectedItemNames.names(assignment.selectedItemIds());

    final Map<String, String> extras = new LinkedHashMap<>(extraVariables);
    extras.putIfAbsent("angle", assignment.primaryAngle());
    extras.putIfAbsent("booking_link", cannedMessages.bookingLink());
    final LintResult variableLint =
        contentLinter.lintVariables(new MessageVariables(lead.companyName(), itemNames, extras));
    if (!variableLint.passed()) {
      logger.warn(
          "sequence variables rejected leadId={} violations={}",
          lead.leadId(),
          variableLint.summary());
      return SequenceResult.lintFailed(variableLint.violations());
    }

    final SignalSet signals = signalSetRepository.findByLeadId(lead.leadId()).orElse(null);
    final UUID sequenceId = UUID.randomUUID();
    final Instant start = Instant.now(clock);
    final List<OutboundMessage> messages = new ArrayList<>();
    for (int touch = 1; touch <= sequenceTiming.touchCount(); touch++) {
      final MessageRequest request =
          new MessageRequest(
              lead.companyName(),
              lead.niche(),
              assignment.primaryAngle(),
              touch,
              itemNames,
              signals == null ? null : signals.siteExcerpt(),
              signals == null ? List.of() : signals.categories());
      final MessageDraft draft = generate(lead, request);
      final LintResult lint = contentLinter.lint(draft.subject(), draft.body(), itemNames);
      messages.add(
          new OutboundMessage(
              UUID.randomUUID(),
              lead.leadId(),
              sequenceId,
              touch,
              OutboundMessageKind.SEQUENCE,
              null,
              lead.contactEmail(),
              draft.subject(),
              draft.body(),
              lint.passed() ? OutboundMessageStatus.RENDERED : OutboundMessageStatus.FAILED,
              sequenceTiming.scheduledAt(start, touch),
              null,
              lint.passed() ? null : lint.summary(),
              jsonColumns.write(lint.violations()),
              null,
              null,
              null,
              null,
              null,
              start));
    }

    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              for (OutboundMessage message : messages) {
                outboundMessageRepository.insert(message, start);
                auditLedger.record(
                    correlationId,
                    AuditEvent.EMAIL_RENDERED,
                    lead.leadId(),
                    null,
                    ACTOR,
                    AuditLedger.payload(
                        "message_id", message.messageId(),
                        "sequence_id", sequenceId,
                        "touch_index", message.touchIndex(),
                        "status", message.status().name(),
                        "scheduled_at", message.scheduledAt().toString(),
                        "violations", message.error()));
              }
              leadTransitions.require(lead.leadId(), LeadStatus.CONTACTED, null, start);
            });

    final int failed =
        (int)
            messages.stream()
                .filter(message -> message.status() == OutboundMessageStatus.FAILED)
                .count();
    logger.info(
        "sequence created leadId={} sequenceId={} rendered={} failed={}",
        lead.leadId(),
        sequenceId,
        messages.size() - failed,
        failed);
    return new SequenceResult(
        true,
        sequenceId,
        messages.stream().map(OutboundMessage::messageId).toList(),
        messages.size() - failed,
        failed,
        List.of());
  }

  private MessageDraft generate(Lead lead, MessageRequest request) {
    try {
      final MessageDraft draft = messageGenerator.generate(request);
      if (draft != null && draft.isValid()) {
        return draft;
      }
      logger.warn(
          "message generator returned empty draft; using canned leadId={} touch={}",
          lead.leadId(),
          request.touchIndex());
    } catch (RuntimeException ex) {
      logger.warn(
          "message generator failed; using canned leadId={} touch={}",
          lead.leadId(),
          request.touchIndex(),
          ex);
    }
    return cannedMessages.coldOutreach(lead.companyName(), lead.niche());
  }
}
