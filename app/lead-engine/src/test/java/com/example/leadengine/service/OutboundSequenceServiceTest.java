package com.example.leadengine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.leadengine.Fixtures;
import com.example.leadengine.collaborator.CannedMessages;
import com.example.leadengine.collaborator.MessageDraft;
import com.example.leadengine.collaborator.MessageGenerator;
import com.example.leadengine.collaborator.MessageRequest;
import com.example.leadengine.config.ReplyProperties;
import com.example.leadengine.engine.ContentLinter;
import com.example.leadengine.engine.ContentPolicy;
import com.example.leadengine.engine.LintViolation;
import com.example.leadengine.engine.SequenceTiming;
import com.example.leadengine.model.ItemSelectionQuery;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.LeverageAssignment;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.model.OutboundMessageKind;
import com.example.leadengine.model.OutboundMessageStatus;
import com.example.leadengine.repository.JsonColumns;
import com.example.leadengine.repository.LeverageAssignmentRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import com.example.leadengine.repository.SignalSetRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
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
class OutboundSequenceServiceTest {

  private static final List<String> ITEM_NAMES =
      List.of("Northwind Kitchen", "Alder Home Textiles", "Juniper Skin");

  @Mock private MessageGenerator messageGenerator;
  @Mock private LeverageAssignmentRepository leverageAssignmentRepository;
  @Mock private SelectedItemNames selectedItemNames;
  @Mock private SignalSetRepository signalSetRepository;
  @Mock private OutboundMessageRepository outboundMessageRepository;
  @Mock private LeadTransitions leadTransitions;
  @Mock private AuditLedger auditLedger;
  @Mock private PlatformTransactionManager transactionManager;

  private OutboundSequenceService service;
  private Lead lead;

  @BeforeEach
  void setUp() {
    service =
        new OutboundSequenceService(
            messageGenerator,
            new CannedMessages(
                new ReplyProperties(200, "https://book.example/slot", null, null, null, null, null, null)),
            new ContentLinter(new ContentPolicy(3, List.of("wholesale price"), List.of("catalog_url"))),
            new SequenceTiming(
                List.of(
                    Duration.ZERO,
                    Duration.ofHours(24),
                    Duration.ofHours(96),
                    Duration.ofHours(168),
                    Duration.ofHours(720))),
            leverageAssignmentRepository,
            selectedItemNames,
            signalSetRepository,
            outboundMessageRepository,
            leadTransitions,
            auditLedger,
            new JsonColumns(new ObjectMapper()),
            Clock.fixed(Fixtures.NOW, ZoneOffset.UTC),
            transactionManager);
    lead = Fixtures.lead(UUID.randomUUID(), "buyer@shop.com", "retail", LeadStatus.QUALIFIED);
  }

  @Test
  void createsFiveRenderedTouchesOnFixedSchedule() {
    stubAssignment();
    when(signalSetRepository.findByLeadId(lead.leadId()))
        .thenReturn(Optional.of(Fixtures.signals(lead.leadId(), 0.1, 120, 60)));
    when(messageGenerator.generate(any()))
        .thenAnswer(
            invocation -> {
              final MessageRequest request = invocation.getArgument(0);
              return new MessageDraft("Touch " + request.touchIndex(), "Short note on new lines.");
            });

    final SequenceResult result = service.createSequence(lead, "req-1");

    assertThat(result.created()).isTrue();
    assertThat(result.renderedCount()).isEqualTo(5);
    assertThat(result.failedCount()).isZero();
    final ArgumentCaptor<OutboundMessage> inserted = ArgumentCaptor.forClass(OutboundMessage.class);
    verify(outboundMessageRepository, times(5)).insert(inserted.capture(), eq(Fixtures.NOW));
    final List<OutboundMessage> messages = inserted.getAllValues();
    assertThat(messages).extracting(OutboundMessage::touchIndex).containsExactly(1, 2, 3, 4, 5);
    assertThat(messages).allMatch(message -> message.status() == OutboundMessageStatus.RENDERED);
    assertThat(messages).allMatch(message -> message.kind() == OutboundMessageKind.SEQUENCE);
    assertThat(messages).extracting(OutboundMessage::sequenceId).containsOnly(result.sequenceId());
    assertThat(messages.get(0).scheduledAt()).isEqualTo(Fixtures.NOW);
    assertThat(messages.get(4).scheduledAt()).isEqualTo(Fixtures.NOW.plus(Duration.ofDays(30)));
    verify(leadTransitions).require(lead.leadId(), LeadStatus.CONTACTED, null, Fixtures.NOW);
  }

  @Test
  void generatorFailureUsesCannedDraftAndForbiddenPhraseFailsTouch() {
    stubAssignment();
    when(signalSetRepository.findByLeadId(lead.leadId())).thenReturn(Optional.empty());
    when(messageGenerator.generate(any()))
        .thenAnswer(
            invocation -> {
              final MessageRequest request = invocation.getArgument(0);
              if (request.touchIndex() == 2) {
                throw new IllegalStateException("generator down");
              }
              if (request.touchIndex() == 3) {
                return new MessageDraft("Pricing", "Ask us for the Wholesale Price sheet.");
              }
              return new MessageDraft("Touch " + request.touchIndex(), "Short note.");
            });

    final SequenceResult result = service.createSequence(lead, "req-1");

    assertThat(result.renderedCount()).isEqualTo(4);
    assertThat(result.failedCount()).isEqualTo(1);
    final ArgumentCaptor<OutboundMessage> inserted = ArgumentCaptor.forClass(OutboundMessage.class);
    verify(outboundMessageRepository, times(5)).insert(inserted.capture(), eq(Fixtures.NOW));
    final OutboundMessage canned = inserted.getAllValues().get(1);
    assertThat(canned.subject()).isEqualTo("Acme Shop: quick brand sourcing idea");
    assertThat(canned.body()).contains("https://book.example/slot");
    final OutboundMessage failed = inserted.getAllValues().get(2);
    assertThat(failed.status()).isEqualTo(OutboundMessageStatus.FAILED);
    assertThat(failed.error()).contains("wholesale price");
    verify(leadTransitions).require(lead.leadId(), LeadStatus.CONTACTED, null, Fixtures.NOW);
  }

  @Test
  void forbiddenVariableRejectsWholeSequence() {
    stubAssignment();

    final SequenceResult result =
        service.createSequence(lead, Map.of("Catalog_URL", "https://example.com/all"), "req-1");

    assertThat(result.created()).isFalse();
    assertThat(result.violations())
        .extracting(LintViolation::rule)
        .containsExactly(LintViolation.FORBIDDEN_VARIABLE);
    verifyNoInteractions(messageGenerator, outboundMessageRepository, auditLedger);
    verify(leadTransitions, never()).require(any(), any(), any(), any());
  }

  @Test
  void missingLeverageIsAnError() {
    when(leverageAssignmentRepository.findByLeadId(lead.leadId())).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.createSequence(lead, "req-1"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("leverage missing");
  }

  private void stubAssignment() {
    final List<Long> ids = List.of(1L, 6L, 3L);
    when(leverageAssignmentRepository.findByLeadId(lead.leadId()))
        .thenReturn(
            Optional.of(
                new LeverageAssignment(
                    lead.leadId(),
                    1L,
                    "expansion",
                    "margin",
                    "retail_store_expansion",
                    false,
                    new ItemSelectionQuery(true, 3),
                    ids,
                    Fixtures.NOW)));
    when(selectedItemNames.names(ids)).thenReturn(ITEM_NAMES);
  }
}
