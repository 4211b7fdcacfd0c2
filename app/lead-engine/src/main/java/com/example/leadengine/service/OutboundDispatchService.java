/*
 * どこで: Lead Engine 送信ワーカー
 * 何を: 送信予定時刻を過ぎたメッセージを claim し、配信プロバイダへ渡す
 * なぜ: 送信直前に抑止を再確認し、lease 付きで二重送信を防ぐため
 */
package com.example.leadengine.service;

import com.example.leadengine.collaborator.DeliveryProvider;
import com.example.leadengine.collaborator.DeliveryRequest;
import com.example.leadengine.config.OutboundDispatchProperties;
import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.model.OutboundMessageKind;
import com.example.leadengine.model.OutboundMessageStatus;
import com.example.leadengine.repository.LeadRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class OutboundDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(OutboundDispatchService.class);
  static final String ACTOR = "dispatch_worker";
  static final String MISSING_RECIPIENT = "missing recipient address";
  static final String SUPPRESSED = "suppressed";
  static final String LEAD_NOT_CONTACTED = "lead not contacted";

  private final OutboundMessageRepository outboundMessageRepository;
  private final LeadRepository leadRepository;
  private final SuppressionService suppressionService;
  private final DeliveryProvider deliveryProvider;
  private final AuditLedger auditLedger;
  private final WorkerIdentity workerIdentity;
  private final LeadEngineMetrics metrics;
  private final OutboundDispatchProperties properties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: 送信期限の来たメッセージを 1 バッチ分配信する。
   * 動作: 宛先なしは FAILED、抑止済みと CONTACTED でなくなったリードのシーケンスは PAUSED、
   *       それ以外は配信して SENT と email_sent を書く。
   * 前提: 配信失敗はメッセージ単位で FAILED にし、バッチは止めない。
   */
  public DispatchResult dispatchDue() {
    final Instant now = Instant.now(clock);
    final String lockedBy = workerIdentity.lockedBy();
    final List<OutboundMessage> claimed =
        outboundMessageRepository.claimDue(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    int sent = 0;
    int paused = 0;
    int failed = 0;
    for (OutboundMessage message : claimed) {
      switch (dispatchOne(message, lockedBy)) {
        case SENT -> sent++;
        case PAUSED -> paused++;
        default -> failed++;
      }
    }
    if (!claimed.isEmpty()) {
      logger.info(
          "dispatch finished claimed={} sent={} paused={} failed={}",
          claimed.size(),
          sent,
          paused,
          failed);
    }
    return new DispatchResult(claimed.size(), sent, paused, failed);
  }

  private OutboundMessageStatus dispatchOne(OutboundMessage message, String lockedBy) {
    final String correlationId = CorrelationIds.current();
    if (message.toAddress() == null || message.toAddress().isBlank()) {
      outboundMessageRepository.release(
          message.messageId(), OutboundMessageStatus.FAILED, MISSING_RECIPIENT, Instant.now(clock),
          lockedBy);
      metrics.recordDispatch("failed");
      logger.warn("message has no recipient messageId={}", message.messageId());
      return OutboundMessageStatus.FAILED;
    }
    if (suppressionService.isSuppressed(message.toAddress())) {
      outboundMessageRepository.release(
          message.messageId(), OutboundMessageStatus.PAUSED, SUPPRESSED, Instant.now(clock),
          lockedBy);
      metrics.recordDispatch("suppressed");
      logger.info("message paused by suppression messageId={}", message.messageId());
      return OutboundMessageStatus.PAUSED;
    }
    // claim 後に返信やステータス変更が入った場合もシーケンスは送らない
    if (message.kind() == OutboundMessageKind.SEQUENCE && !leadStillContacted(message)) {
      outboundMessageRepository.release(
          message.messageId(), OutboundMessageStatus.PAUSED, LEAD_NOT_CONTACTED, Instant.now(clock),
          lockedBy);
      metrics.recordDispatch("halted");
      logger.info(
          "sequence message paused, lead left contacted messageId={} leadId={}",
          message.messageId(),
          message.leadId());
      return OutboundMessageStatus.PAUSED;
    }
    try {
      final String providerMessageId =
          deliveryProvider.deliver(
              new DeliveryRequest(
                  properties.campaignRef(),
                  message.toAddress(),
                  message.leadId(),
                  message.messageId(),
                  message.sequenceId(),
                  message.touchIndex(),
                  message.subject(),
                  message.body()));
      final Instant sentAt = Instant.now(clock);
      new TransactionTemplate(transactionManager)
          .executeWithoutResult(
              status -> {
                final int updated =
                    outboundMessageRepository.markSent(
                        message.messageId(),
                        deliveryProvider.name(),
                        properties.campaignRef(),
                        providerMessageId,
                        sentAt,
                        lockedBy);
                if (updated == 0) {
                  logger.warn("lease lost before markSent messageId={}", message.messageId());
                  return;
                }
                auditLedger.record(
                    correlationId,
                    AuditEvent.EMAIL_SENT,
                    message.leadId(),
                    null,
                    ACTOR,
                    AuditLedger.payload(
                        "message_id", message.messageId().toString(),
                        "touch_index", message.touchIndex(),
                        "kind", message.kind().name(),
                        "provider", deliveryProvider.name(),
                        "provider_message_id", providerMessageId));
              });
      metrics.recordDispatch("sent");
      return OutboundMessageStatus.SENT;
    } catch (RuntimeException ex) {
      logger.warn("delivery failed messageId={}", message.messageId(), ex);
      outboundMessageRepository.release(
          message.messageId(),
          OutboundMessageStatus.FAILED,
          truncateError(ex.getMessage()),
          Instant.now(clock),
          lockedBy);
      metrics.recordDispatch("failed");
      return OutboundMessageStatus.FAILED;
    }
  }

  private boolean leadStillContacted(OutboundMessage message) {
    return leadRepository
        .findById(message.leadId())
        .map(lead -> lead.status() == LeadStatus.CONTACTED)
        .orElse(false);
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }
}
