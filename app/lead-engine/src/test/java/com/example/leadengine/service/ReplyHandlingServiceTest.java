package com.example.leadengine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.leadengine.Fixtures;
import com.example.leadengine.collaborator.CannedMessages;
import com.example.leadengine.collaborator.MessageDraft;
import com.example.leadengine.collaborator.ReplyClassificationOutcome;
import com.example.leadengine.collaborator.ReplyClassificationResult;
import com.example.leadengine.collaborator.ReplyClassifier;
import com.example.leadengine.config.ReplyProperties;
import com.example.leadengine.engine.ContentLinter;
import com.example.leadengine.engine.ContentPolicy;
import com.example.leadengine.engine.OptOutDetector;
import com.example.leadengine.model.ApprovalState;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.Reply;
import com.example.leadengine.model.ReplyAction;
import com.example.leadengine.model.ReplyClassification;
import com.example.leadengine.repository.LeadRepository;
import com.example.leadengine.repository.OutboundMessageRepository;
import com.example.leadengine.repository.ReplyRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
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
class ReplyHandlingServiceTest {

  private static final String EMAIL = "buyer@shop.com";

  @Mock private LeadRepository leadRepository;
  @Mock private ReplyRepository replyRepository;
  @Mock private OutboundMessageRepository outboundMessageRepository;
  @Mock private ReplyClassifier replyClassifier;
  @Mock private SuppressionService suppressionService;
  @Mock private ObjectionResponder objectionResponder;
  @Mock private SelectedItemNames selectedItemNames;
  @Mock private ReplyApprovalService replyApprovalService;
  @Mock private LeadTransitions leadTransitions;
  @Mock private AuditLedger auditLedger;
  @Mock private PlatformTransactionManager transactionManager;

  private final UUID leadId = UUID.randomUUID();
  private Lead lead;
  private ReplyHandlingService service;

  @BeforeEach
  void setUp() {
    final ReplyProperties replyProperties =
        new ReplyProperties(2, "https://book.example/slot", null, null, null, null, null, null);
    lead = Fixtures.lead(leadId, EMAIL, "retail", LeadStatus.CONTACTED);
    service =
        new ReplyHandlingService(
            leadRepository,
            replyRepository,
            outboundMessageRepository,
            replyClassifier,
            new OptOutDetector(replyProperties.optOutPhrases()),
            suppressionService,
            new CannedMessages(replyProperties),
            objectionResponder,
            selectedItemNames,
            new ContentLinter(new ContentPolicy(3, List.of("wholesale price"), List.of())),
            replyApprovalService,
            leadTransitions,
            auditLedger,
            new LeadEngineMetrics(new SimpleMeterRegistry()),
            replyProperties,
            Clock.fixed(Fixtures.NOW, ZoneOffset.UTC),
            transactionManager);
    when(leadRepository.findById(leadId)).thenReturn(Optional.of(lead));
  }

  @Test
  void optOutSuppressesWithoutClassifyingOrDrafting() {
    when(leadTransitions.apply(eq(leadId), eq(LeadStatus.DEAD), anyString(), any())).thenReturn(true);

    final ReplyOutcome outcome =
        service.handleReply(
            new ReplyCommand(leadId, "please remove me from this list", null, null), "tester");

    assertThat(outcome.classification()).isEqualTo(ReplyClassification.UNSUBSCRIBE);
    assertThat(outcome.action()).isEqualTo(ReplyAction.SUPPRESS);
    assertThat(outcome.approval()).isNull();
    assertThat(outcome.responseQueued()).isFalse();
    verify(suppressionService)
        .suppressAddress(eq(EMAIL), eq("unsubscribe"), eq(leadId), eq("tester"), anyString());
    verifyNoInteractions(replyClassifier, objectionResponder);
    verify(replyRepository, never()).incrementDraftCounter();
    verify(replyRepository)
        .updateClassification(
            eq(outcome.replyId()),
            eq(ReplyClassification.UNSUBSCRIBE),
            isNull(),
            eq(ReplyAction.SUPPRESS),
            isNull(),
            isNull(),
            isNull(),
            isNull(),
            isNull());
  }

  @Test
  void interestedReplyWithinThresholdIsPendingApproval() {
    classifierReturns("interested", null, "send_calendar");
    when(replyRepository.incrementDraftCounter()).thenReturn(1L);
    when(leadTransitions.apply(leadId, LeadStatus.INTERESTED, null, Fixtures.NOW)).thenReturn(true);

    final ReplyOutcome outcome =
        service.handleReply(new ReplyCommand(leadId, "Sounds good, let's talk", null, null), "tester");

    assertThat(outcome.classification()).isEqualTo(ReplyClassification.INTERESTED);
    assertThat(outcome.action()).isEqualTo(ReplyAction.SEND_CALENDAR);
    assertThat(outcome.approval()).isEqualTo(ApprovalState.PENDING);
    assertThat(outcome.statusChanged()).isTrue();
    final ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
    verify(replyRepository)
        .updateClassification(
            eq(outcome.replyId()),
            eq(ReplyClassification.INTERESTED),
            isNull(),
            eq(ReplyAction.SEND_CALENDAR),
            eq(7),
            eq("Re: Acme Shop"),
            body.capture(),
            eq(ApprovalState.PENDING),
            eq("call-1"));
    assertThat(body.getValue()).contains("https://book.example/slot");
    verify(outboundMessageRepository).pauseActiveSequence(List.of(leadId), Fixtures.NOW);
    verify(replyApprovalService, never()).queueResponse(any(), any(), anyString(), anyString(), any());
  }

  @Test
  void draftsBeyondThresholdAreAutoApprovedAndQueued() {
    classifierReturns("interested", null, "send_calendar");
    when(replyRepository.incrementDraftCounter()).thenReturn(3L);
    final Reply stored = storedReply(ApprovalState.APPROVED);
    when(replyRepository.findById(any())).thenReturn(Optional.of(stored));
    when(replyApprovalService.queueResponse(eq(stored), eq(lead), eq("tester"), anyString(), eq(Fixtures.NOW)))
        .thenReturn(true);

    final ReplyOutcome outcome =
        service.handleReply(new ReplyCommand(leadId, "Yes please", null, null), "tester");

    assertThat(outcome.approval()).isEqualTo(ApprovalState.APPROVED);
    assertThat(outcome.responseQueued()).isTrue();
  }

  @Test
  void objectionDraftFailingLintIsHandedOffWithoutDraft() {
    classifierReturns("objection", "pricing", "send_curated_catalog");
    when(selectedItemNames.forLead(leadId)).thenReturn(List.of("Northwind"));
    when(objectionResponder.draft("Acme Shop", "pricing", List.of("Northwind")))
        .thenReturn(
            new MessageDraft("Re: Acme Shop", "Our wholesale price is great"));

    final ReplyOutcome outcome =
        service.handleReply(new ReplyCommand(leadId, "Too expensive", null, null), "tester");

    assertThat(outcome.classification()).isEqualTo(ReplyClassification.OBJECTION);
    assertThat(outcome.action()).isEqualTo(ReplyAction.HANDOFF_TO_HUMAN);
    assertThat(outcome.approval()).isNull();
    verify(replyRepository, never()).incrementDraftCounter();
  }

  @Test
  void objectionDraftForMoreItemsThanCapIsHandedOff() {
    final List<String> names = List.of("Northwind", "Alder", "Juniper", "Copperline");
    classifierReturns("objection", "pricing", "send_curated_catalog");
    when(selectedItemNames.forLead(leadId)).thenReturn(names);
    when(objectionResponder.draft("Acme Shop", "pricing", names))
        .thenReturn(new MessageDraft("Re: Acme Shop", "A few brands that fit your shelves."));

    final ReplyOutcome outcome =
        service.handleReply(new ReplyCommand(leadId, "Too expensive", null, null), "tester");

    assertThat(outcome.action()).isEqualTo(ReplyAction.HANDOFF_TO_HUMAN);
    assertThat(outcome.approval()).isNull();
    verify(replyRepository, never()).incrementDraftCounter();
  }

  @Test
  void notInterestedMovesLeadToDead() {
    classifierReturns("not_interested", null, "handoff_to_human");
    when(leadTransitions.apply(leadId, LeadStatus.DEAD, "not_interested", Fixtures.NOW))
        .thenReturn(true);

    final ReplyOutcome outcome =
        service.handleReply(new ReplyCommand(leadId, "No thanks", null, null), "tester");

    assertThat(outcome.classification()).isEqualTo(ReplyClassification.NOT_INTERESTED);
    assertThat(outcome.statusChanged()).isTrue();
    verify(outboundMessageRepository).pauseActiveSequence(List.of(leadId), Fixtures.NOW);
  }

  @Test
  void classifierUnsubscribeWithoutPhraseIsHandedOff() {
    classifierReturns("unsubscribe", null, "suppress");

    final ReplyOutcome outcome =
        service.handleReply(new ReplyCommand(leadId, "hmm, maybe later", null, null), "tester");

    assertThat(outcome.action()).isEqualTo(ReplyAction.HANDOFF_TO_HUMAN);
    assertThat(outcome.statusChanged()).isFalse();
    verifyNoInteractions(suppressionService, leadTransitions);
  }

  @Test
  void classifierFailureFallsBackToHandoff() {
    when(replyClassifier.classify(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

    final ReplyOutcome outcome =
        service.handleReply(new ReplyCommand(leadId, "What is this?", null, null), "tester");

    assertThat(outcome.classification()).isEqualTo(ReplyClassification.UNKNOWN);
    assertThat(outcome.action()).isEqualTo(ReplyAction.HANDOFF_TO_HUMAN);
  }

  private void classifierReturns(String classification, String objectionType, String action) {
    when(replyClassifier.classify(anyString(), anyString()))
        .thenReturn(
            new ReplyClassificationOutcome(
                new ReplyClassificationResult(classification, objectionType, action, 7), "call-1"));
  }

  private Reply storedReply(ApprovalState approval) {
    return new Reply(
        UUID.randomUUID(),
        leadId,
        null,
        "Yes please",
        null,
        ReplyClassification.INTERESTED,
        null,
        ReplyAction.SEND_CALENDAR,
        7,
        "Re: Acme Shop",
        "body https://book.example/slot",
        approval,
        null,
        null,
        false,
        "call-1",
        Fixtures.NOW);
  }
}
