package com.example.leadengine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.leadengine.collaborator.ClassificationOutcome;
import com.example.leadengine.collaborator.ClassificationResult;
import com.example.leadengine.collaborator.LeadClassifier;
import com.example.leadengine.collaborator.MessageDraft;
import com.example.leadengine.collaborator.MessageGenerator;
import com.example.leadengine.collaborator.MessageRequest;
import com.example.leadengine.collaborator.ReplyClassifier;
import com.example.leadengine.collaborator.ResearchResult;
import com.example.leadengine.collaborator.StorefrontResearcher;
import com.example.leadengine.model.CatalogItem;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.model.OutboundMessageStatus;
import com.example.leadengine.model.ReplyAction;
import com.example.leadengine.model.ReplyClassification;
import com.example.leadengine.repository.CatalogItemRepository;
import com.example.leadengine.service.DrainResult;
import com.example.leadengine.service.IntakeResult;
import com.example.leadengine.service.LeadDetail;
import com.example.leadengine.service.LeadIntakeCommand;
import com.example.leadengine.service.LeadIntakeService;
import com.example.leadengine.service.LeadQueryService;
import com.example.leadengine.service.LeadQueueDrainService;
import com.example.leadengine.service.ReferenceDataSeeder;
import com.example.leadengine.service.ReplyCommand;
import com.example.leadengine.service.ReplyHandlingService;
import com.example.leadengine.service.ReplyOutcome;
import com.example.leadengine.service.SuppressionService;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest(properties = "leadengine.seed.enabled=true")
@ActiveProfiles("test")
class LeadLifecycleEndToEndTest extends AbstractPostgresContainerTest {

  @MockitoBean private StorefrontResearcher storefrontResearcher;
  @MockitoBean private LeadClassifier leadClassifier;
  @MockitoBean private MessageGenerator messageGenerator;
  @MockitoBean private ReplyClassifier replyClassifier;

  @Autowired private LeadIntakeService intakeService;
  @Autowired private LeadQueueDrainService drainService;
  @Autowired private LeadQueryService queryService;
  @Autowired private ReplyHandlingService replyHandlingService;
  @Autowired private SuppressionService suppressionService;
  @Autowired private ReferenceDataSeeder seeder;
  @Autowired private CatalogItemRepository catalogItemRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    truncateAll(jdbcTemplate);
    seeder.seed();

    when(storefrontResearcher.research(any()))
        .thenReturn(
            new ResearchResult(
                true,
                "shopify",
                List.of("home", "kitchen"),
                List.of("Cast iron skillet"),
                List.of(),
                120,
                12.0,
                180.0,
                false,
                null,
                0.1,
                "Kitchen and home goods for everyday cooks.",
                null,
                null,
                null));
    when(leadClassifier.classify(any(), anyString(), anyString()))
        .thenReturn(
            new ClassificationOutcome(
                new ClassificationResult(List.of(), "mid", 60, 50, 1, true, null), "call-1", false));
    when(messageGenerator.generate(any()))
        .thenAnswer(
            invocation -> {
              final MessageRequest request = invocation.getArgument(0);
              return new MessageDraft(
                  "Note " + request.touchIndex() + " for " + request.companyName(),
                  "Hi team, a short note about lines that could sit next to your range.");
            });
  }

  @Test
  void intakeAndDrainProduceContactedLeadWithScheduledSequence() {
    final IntakeResult intake = intakeService.intake(retailLead(), "test");
    assertThat(intake.outcome()).isEqualTo(IntakeResult.Outcome.CREATED);

    final DrainResult drained = drainService.drain();
    assertThat(drained.processed()).isEqualTo(1);
    assertThat(drained.failed()).isZero();

    final LeadDetail detail = queryService.detail(intake.leadId());
    assertThat(detail.lead().status()).isEqualTo(LeadStatus.CONTACTED);
    assertThat(detail.leverage().primaryAngle()).isEqualTo("expansion");
    assertThat(detail.selectedItemNames())
        .containsExactlyInAnyOrder("Northwind Kitchen", "Alder Home Textiles", "Juniper Skin");

    final Set<String> primaryCategories =
        catalogItemRepository.findByIds(detail.leverage().selectedItemIds()).stream()
            .map(CatalogItem::primaryCategory)
            .collect(Collectors.toSet());
    assertThat(primaryCategories).hasSizeGreaterThanOrEqualTo(2);

    final List<OutboundMessage> messages = detail.messages();
    assertThat(messages).hasSize(5);
    assertThat(messages).allMatch(message -> message.status() == OutboundMessageStatus.RENDERED);
    assertThat(messages.stream().map(OutboundMessage::scheduledAt).sorted().toList())
        .doesNotHaveDuplicates()
        .isEqualTo(
            messages.stream()
                .sorted((a, b) -> Integer.compare(a.touchIndex(), b.touchIndex()))
                .map(OutboundMessage::scheduledAt)
                .toList());
  }

  @Test
  void optOutReplySuppressesAndStopsSequence() {
    final IntakeResult intake = intakeService.intake(retailLead(), "test");
    drainService.drain();

    final ReplyOutcome outcome =
        replyHandlingService.handleReply(
            new ReplyCommand(intake.leadId(), "please remove me from this list", null, null),
            "test");

    assertThat(outcome.classification()).isEqualTo(ReplyClassification.UNSUBSCRIBE);
    assertThat(outcome.action()).isEqualTo(ReplyAction.SUPPRESS);
    assertThat(outcome.approval()).isNull();
    assertThat(outcome.responseQueued()).isFalse();
    verify(replyClassifier, never()).classify(anyString(), any());

    final LeadDetail detail = queryService.detail(intake.leadId());
    assertThat(detail.lead().status()).isEqualTo(LeadStatus.DEAD);
    assertThat(suppressionService.isSuppressed("Buyer@Shop.com")).isTrue();
    assertThat(detail.messages()).allMatch(message -> message.status() == OutboundMessageStatus.PAUSED);

    final IntakeResult again = intakeService.intake(retailLead(), "test");
    assertThat(again.outcome()).isEqualTo(IntakeResult.Outcome.SUPPRESSED);
  }

  private static LeadIntakeCommand retailLead() {
    return new LeadIntakeCommand(
        "Acme Shop", "https://acme.example", "buyer@shop.com", "retail", "home goods", "Austin", null);
  }
}
