package com.example.leadengine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.leadengine.Fixtures;
import com.example.leadengine.collaborator.DeliveryException;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class OutboundDispatchServiceTest {

  private static final Duration LEASE = Duration.ofMinutes(2);

  @Mock private OutboundMessageRepository outboundMessageRepository;
  @Mock private LeadRepository leadRepository;
  @Mock private SuppressionService suppressionService;
  @Mock private DeliveryProvider deliveryProvider;
  @Mock private AuditLedger auditLedger;
  @Mock private WorkerIdentity workerIdentity;
  @Mock private PlatformTransactionManager transactionManager;

  private SimpleMeterRegistry meterRegistry;
  private OutboundDispatchService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    when(workerIdentity.lockedBy()).thenReturn("worker-1");
    lenient()
        .when(leadRepository.findById(any()))
        .thenAnswer(
            invocation ->
                Optional.of(
                    Fixtures.lead(
                        invocation.getArgument(0), "buyer@shop.com", "retail", LeadStatus.CONTACTED)));
    service =
        new OutboundDispatchService(
            outboundMessageRepository,
            leadRepository,
            suppressionService,
            deliveryProvider,
            auditLedger,
            workerIdentity,
            new LeadEngineMetrics(meterRegistry),
            new OutboundDispatchProperties(true, Duration.ofSeconds(30), 5, LEASE, "campaign-1", 12),
            Clock.fixed(Fixtures.NOW, ZoneOffset.UTC),
            transactionManager);
  }

  @Test
  void deliversDueMessageAndRecordsSend() {
    final OutboundMessage message = message("buyer@shop.com");
    claimReturns(message);
    when(suppressionService.isSuppressed("buyer@shop.com")).thenReturn(false);
    when(deliveryProvider.deliver(any())).thenReturn("prov-1");
    when(deliveryProvider.name()).thenReturn("local");
    when(outboundMessageRepository.markSent(
            message.messageId(), "local", "campaign-1", "prov-1", Fixtures.NOW, "worker-1"))
        .thenReturn(1);

    final DispatchResult result = service.dispatchDue();

    assertThat(result).isEqualTo(new DispatchResult(1, 1, 0, 0));
    final ArgumentCaptor<DeliveryRequest> request = ArgumentCaptor.forClass(DeliveryRequest.class);
    verify(deliveryProvider).deliver(request.capture());
    assertThat(request.getValue().campaignRef()).isEqualTo("campaign-1");
    assertThat(request.getValue().touchIndex()).isEqualTo(2);
    verify(auditLedger)
        .record(anyString(), eq(AuditEvent.EMAIL_SENT), eq(message.leadId()), isNull(),
            eq(OutboundDispatchService.ACTOR), anyMap());
  }

  @Test
  void suppressedRecipientIsPausedWithoutDelivery() {
    final OutboundMessage message = message("buyer@shop.com");
    claimReturns(message);
    when(suppressionService.isSuppressed("buyer@shop.com")).thenReturn(true);

    final DispatchResult result = service.dispatchDue();

    assertThat(result.paused()).isEqualTo(1);
    verify(outboundMessageRepository)
        .release(message.messageId(), OutboundMessageStatus.PAUSED, "suppressed", Fixtures.NOW,
            "worker-1");
    verifyNoInteractions(deliveryProvider, auditLedger);
  }

  @Test
  void missingRecipientFailsMessage() {
    final OutboundMessage message = message(null);
    claimReturns(message);

    final DispatchResult result = service.dispatchDue();

    assertThat(result.failed()).isEqualTo(1);
    verify(outboundMessageRepository)
        .release(message.messageId(), OutboundMessageStatus.FAILED,
            OutboundDispatchService.MISSING_RECIPIENT, Fixtures.NOW, "worker-1");
    verifyNoInteractions(suppressionService, deliveryProvider);
  }

  @Test
  void deliveryErrorFailsOnlyThatMessage() {
    final OutboundMessage broken = message("broken@shop.com");
    final OutboundMessage healthy = message("buyer@shop.com");
    claimReturns(broken, healthy);
    when(suppressionService.isSuppressed(anyString())).thenReturn(false);
    when(deliveryProvider.deliver(any()))
        .thenThrow(new DeliveryException("delivery rejected status=503"))
        .thenReturn("prov-2");
    when(deliveryProvider.name()).thenReturn("local");
    when(outboundMessageRepository.markSent(any(), anyString(), anyString(), anyString(), any(),
            anyString()))
        .thenReturn(1);

    final DispatchResult result = service.dispatchDue();

    assertThat(result).isEqualTo(new DispatchResult(2, 1, 0, 1));
    verify(outboundMessageRepository)
        .release(broken.messageId(), OutboundMessageStatus.FAILED, "delivery rej", Fixtures.NOW,
            "worker-1");
    assertThat(meterRegistry.get("leadengine.dispatch.total").tag("result", "failed").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void lostLeaseSkipsAuditEntry() {
    final OutboundMessage message = message("buyer@shop.com");
    claimReturns(message);
    when(suppressionService.isSuppressed("buyer@shop.com")).thenReturn(false);
    when(deliveryProvider.deliver(any())).thenReturn("prov-1");
    when(deliveryProvider.name()).thenReturn("local");
    when(outboundMessageRepository.markSent(any(), anyString(), anyString(), anyString(), any(),
            anyString()))
        .thenReturn(0);

    service.dispatchDue();

    verify(auditLedger, never()).record(any(), any(), any(), any(), any(), any());
  }

  @Test
  void reclaimedSequenceMessageIsPausedAfterLeadReplied() {
    final OutboundMessage message = message("buyer@shop.com");
    claimReturns(message);
    when(suppressionService.isSuppressed("buyer@shop.com")).thenReturn(false);
    when(leadRepository.findById(message.leadId()))
        .thenReturn(
            Optional.of(
                Fixtures.lead(message.leadId(), "buyer@shop.com", "retail", LeadStatus.INTERESTED)));

    final DispatchResult result = service.dispatchDue();

    assertThat(result).isEqualTo(new DispatchResult(1, 0, 1, 0));
    verify(outboundMessageRepository)
        .release(message.messageId(), OutboundMessageStatus.PAUSED,
            OutboundDispatchService.LEAD_NOT_CONTACTED, Fixtures.NOW, "worker-1");
    verifyNoInteractions(deliveryProvider, auditLedger);
    assertThat(meterRegistry.get("leadengine.dispatch.total").tag("result", "halted").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void sequenceMessageForMissingLeadIsPaused() {
    final OutboundMessage message = message("buyer@shop.com");
    claimReturns(message);
    when(suppressionService.isSuppressed("buyer@shop.com")).thenReturn(false);
    when(leadRepository.findById(message.leadId())).thenReturn(Optional.empty());

    final DispatchResult result = service.dispatchDue();

    assertThat(result.paused()).isEqualTo(1);
    verifyNoInteractions(deliveryProvider);
  }

  @Test
  void replyResponseIsDeliveredWithoutLeadStatusCheck() {
    final OutboundMessage reply = replyMessage("buyer@shop.com");
    claimReturns(reply);
    when(suppressionService.isSuppressed("buyer@shop.com")).thenReturn(false);
    when(deliveryProvider.deliver(any())).thenReturn("prov-3");
    when(deliveryProvider.name()).thenReturn("local");
    when(outboundMessageRepository.markSent(
            reply.messageId(), "local", "campaign-1", "prov-3", Fixtures.NOW, "worker-1"))
        .thenReturn(1);

    final DispatchResult result = service.dispatchDue();

    assertThat(result.sent()).isEqualTo(1);
    verify(leadRepository, never()).findById(any());
  }

  private void claimReturns(OutboundMessage... messages) {
    when(outboundMessageRepository.claimDue(5, Fixtures.NOW, Fixtures.NOW.plus(LEASE), "worker-1"))
        .thenReturn(List.of(messages));
  }

  private static OutboundMessage message(String toAddress) {
    return message(toAddress, OutboundMessageKind.SEQUENCE, UUID.randomUUID(), 2);
  }

  private static OutboundMessage replyMessage(String toAddress) {
    return message(toAddress, OutboundMessageKind.REPLY_RESPONSE, null, 0);
  }

  private static OutboundMessage message(
      String toAddress, OutboundMessageKind kind, UUID sequenceId, int touchIndex) {
    return new OutboundMessage(
        UUID.randomUUID(),
        UUID.randomUUID(),
        sequenceId,
        touchIndex,
        kind,
        null,
        toAddress,
        "Acme Shop: a quick idea",
        "Hello",
        OutboundMessageStatus.SENDING,
        Fixtures.NOW,
        null,
        null,
        null,
        null,
        null,
        null,
        "worker-1",
        Fixtures.NOW.plus(LEASE),
        Fixtures.NOW);
  }
}
