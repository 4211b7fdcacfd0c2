/*
 * どこで: Lead Engine サービス層
 * 何を: 配信プロバイダからのイベントを送信メッセージとリードへ反映する
 * なぜ: バウンスと配信停止を即座に抑止へつなげ、返信を返信処理へ流すため
 */
package com.example.leadengine.service;

import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.repository.LeadRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class DeliveryEventService {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryEventService.class);
  static final String ACTOR = "delivery_webhook";
  static final String REASON_BOUNCE = "bounce";
  static final String REASON_UNSUBSCRIBE = "unsubscribe";

  private final OutboundMessageRepository outboundMessageRepository;
  private final LeadRepository leadRepository;
  private final SuppressionService suppressionService;
  private final ReplyHandlingService replyHandlingService;
  private final AuditLedger auditLedger;
  private final LeadEngineMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: 正規化済みの配信イベントを 1 件反映する。
   * 動作: provider_message_id、無ければ宛先アドレスで直近の送信メッセージを突き合わせる。
   * 前提: 突き合わせできない sent/opened は記録のみで成功扱いにする。
   */
  public DeliveryEventResult handle(DeliveryEvent event) {
    if (event.type() == null) {
      throw new IllegalArgumentException("event type is required");
    }
    metrics.recordDeliveryEvent(event.type().value());
    final Optional<OutboundMessage> message = resolveMessage(event);
    final String correlationId = CorrelationIds.current();
    return switch (event.type()) {
      case SENT -> handleDelivered(event, message, correlationId);
      case OPENED -> {
        logger.debug("message opened messageId={}", message.map(OutboundMessage::messageId).orElse(null));
        yield message
            .map(m -> new DeliveryEventResult(event.type(), true, m.leadId(), m.messageId(), null))
            .orElseGet(() -> DeliveryEventResult.unmatched(event.type()));
      }
      case BOUNCED -> handleBounced(event, message, correlationId);
      case UNSUBSCRIBED -> handleUnsubscribed(event, message, correlationId);
      case REPLIED -> handleReplied(event, message);
    };
  }

  private DeliveryEventResult handleDelivered(
      DeliveryEvent event, Optional<OutboundMessage> message, String correlationId) {
    if (message.isEmpty()) {
      logger.info("delivery event without matching message type={}", event.type().value());
      return DeliveryEventResult.unmatched(event.type());
    }
    final OutboundMessage sent = message.get();
    final Instant now = Instant.now(clock);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              if (outboundMessageRepository.markDelivered(sent.messageId(), now) == 0) {
                return;
              }
              auditLedger.record(
                  correlationId,
                  AuditEvent.EMAIL_DELIVERED,
                  sent.leadId(),
                  null,
                  ACTOR,
                  AuditLedger.payload("message_id", sent.messageId().toString()));
            });
    return new DeliveryEventResult(event.type(), true, sent.leadId(), sent.messageId(), null);
  }

  private DeliveryEventResult handleBounced(
      DeliveryEvent event, Optional<OutboundMessage> message, String correlationId) {
    final String address = resolveAddress(event, message);
    if (address == null) {
      logger.warn("bounce without address or matching message");
      return DeliveryEventResult.unmatched(event.type());
    }
    final UUID leadId = message.map(OutboundMessage::leadId).orElse(null);
    if (message.isPresent()) {
      final OutboundMessage bounced = message.get();
      final Instant now = Instant.now(clock);
      new TransactionTemplate(transactionManager)
          .executeWithoutResult(
              status -> {
                if (outboundMessageRepository.markBounced(bounced.messageId(), REASON_BOUNCE, now)
                    == 0) {
                  return;
                }
                auditLedger.record(
                    correlationId,
                    AuditEvent.EMAIL_BOUNCED,
                    bounced.leadId(),
                    null,
                    ACTOR,
                    AuditLedger.payload("message_id", bounced.messageId().toString()));
              });
    }
    suppressionService.suppressAddress(address, REASON_BOUNCE, leadId, ACTOR, correlationId);
    return new DeliveryEventResult(
        event.type(), true, leadId, message.map(OutboundMessage::messageId).orElse(null), null);
  }

  private DeliveryEventResult handleUnsubscribed(
      DeliveryEvent event, Optional<OutboundMessage> message, String correlationId) {
    final String address = resolveAddress(event, message);
    if (address == null) {
      logger.warn("unsubscribe without address or matching message");
      return DeliveryEventResult.unmatched(event.type());
    }
    final UUID leadId = message.map(OutboundMessage::leadId).orElse(null);
    suppressionService.suppressAddress(address, REASON_UNSUBSCRIBE, leadId, ACTOR, correlationId);
    return new DeliveryEventResult(
        event.type(), true, leadId, message.map(OutboundMessage::messageId).orElse(null), null);
  }

  private DeliveryEventResult handleReplied(
      DeliveryEvent event, Optional<OutboundMessage> message) {
    if (event.replyText() == null || event.replyText().isBlank()) {
      throw new IllegalArgumentException("reply text is required for replied events");
    }
    final Optional<UUID> leadId =
        message.map(OutboundMessage::leadId).or(() -> leadForAddress(event.address()));
    if (leadId.isEmpty()) {
      logger.warn("reply without matching lead");
      return DeliveryEventResult.unmatched(event.type());
    }
    final ReplyOutcome outcome =
        replyHandlingService.handleReply(
            new ReplyCommand(
                leadId.get(),
                event.replyText(),
                message.map(OutboundMessage::messageId).orElse(null),
                event.providerMessageId()),
            ACTOR);
    return new DeliveryEventResult(
        event.type(),
        true,
        leadId.get(),
        message.map(OutboundMessage::messageId).orElse(null),
        outcome);
  }

  private Optional<OutboundMessage> resolveMessage(DeliveryEvent event) {
    if (event.providerMessageId() != null && !event.providerMessageId().isBlank()) {
      final Optional<OutboundMessage> byProviderId =
          outboundMessageRepository.findByProviderMessageId(event.providerMessageId());
      if (byProviderId.isPresent()) {
        return byProviderId;
      }
    }
    if (event.address() == null || event.address().isBlank()) {
      return Optional.empty();
    }
    return outboundMessageRepository.findLatestSentToAddress(
        SuppressionService.normalizeAddress(event.address()));
  }

  private String resolveAddress(DeliveryEvent event, Optional<OutboundMessage> message) {
    if (event.address() != null && !event.address().isBlank()) {
      return event.address();
    }
    return message.map(OutboundMessage::toAddress).orElse(null);
  }

  private Optional<UUID> leadForAddress(String address) {
    if (address == null || address.isBlank()) {
      return Optional.empty();
    }
    final List<Lead> leads =
        leadRepository.findByContactEmail(SuppressionService.normalizeAddress(address));
    return leads.stream().map(Lead::leadId).findFirst();
  }
}
