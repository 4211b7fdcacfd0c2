/*
 * どこで: Lead Engine サービス層
 * 何を: 調査/分類と判定/レバレッジ割り当ての各段を実行する
 * なぜ: 外部呼び出しをトランザクション外に置き、状態変更と監査だけを原子的に書くため
 */
package com.example.leadengine.service;

import com.example.leadengine.collaborator.ClassificationInput;
import com.example.leadengine.collaborator.ClassificationOutcome;
import com.example.leadengine.collaborator.ClassificationResult;
import com.example.leadengine.collaborator.LeadClassifier;
import com.example.leadengine.collaborator.ResearchRequest;
import com.example.leadengine.collaborator.ResearchResult;
import com.example.leadengine.collaborator.StorefrontResearcher;
import com.example.leadengine.config.QualificationProperties;
import com.example.leadengine.config.ResearchProperties;
import com.example.leadengine.engine.CatalogMatcher;
import com.example.leadengine.engine.ItemSelection;
import com.example.leadengine.engine.LeadProfile;
import com.example.leadengine.engine.LeverageDecision;
import com.example.leadengine.engine.LeverageRuleEngine;
import com.example.leadengine.engine.QualificationGate;
import com.example.leadengine.engine.QualificationVerdict;
import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.Job;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.LeverageAssignment;
import com.example.leadengine.model.QualificationRecord;
import com.example.leadengine.model.SignalSet;
import com.example.leadengine.repository.CatalogItemRepository;
import com.example.leadengine.repository.LeverageAssignmentRepository;
import com.example.leadengine.repository.LeverageRuleRepository;
import com.example.leadengine.repository.QualificationRepository;
import com.example.leadengine.repository.SignalSetRepository;
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
public class LeadPipelineService {

  private static final Logger logger = LoggerFactory.getLogger(LeadPipelineService.class);
  static final String ACTOR = "lead_pipeline";
  static final String SUPPRESSED_REASON = "suppressed";

  private final StorefrontResearcher storefrontResearcher;
  private final LeadClassifier leadClassifier;
  private final SuppressionService suppressionService;
  private final SignalSetRepository signalSetRepository;
  private final QualificationRepository qualificationRepository;
  private final LeverageRuleRepository leverageRuleRepository;
  private final LeverageAssignmentRepository leverageAssignmentRepository;
  private final CatalogItemRepository catalogItemRepository;
  private final QualificationGate qualificationGate;
  private final LeverageRuleEngine leverageRuleEngine;
  private final CatalogMatcher catalogMatcher;
  private final LeadTransitions leadTransitions;
  private final AuditLedger auditLedger;
  private final ResearchProperties researchProperties;
  private final QualificationProperties qualificationProperties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: 抑止の再確認とサイト調査を行い、リードを RESEARCHED に進める。
   * 動作: 抑止済みなら DEAD にして STOPPED を返す。調査失敗は scrape_failed を記録し既定シグナルで続行する。
   * 前提: 調査コラボレータはトランザクション外で呼ぶ。
   */
  public StageOutcome research(Lead lead, Job job, String correlationId) {
    if (lead.hasContactEmail() && suppressionService.isSuppressed(lead.contactEmail())) {
      final Instant now = Instant.now(clock);
      new TransactionTemplate(transactionManager)
          .executeWithoutResult(
              status -> {
                leadTransitions.apply(lead.leadId(), LeadStatus.DEAD, SUPPRESSED_REASON, now);
                auditLedger.record(
                    correlationId,
                    AuditEvent.LEAD_SUPPRESSED,
                    lead.leadId(),
                    job.jobId(),
                    ACTOR,
                    AuditLedger.payload("reason", SUPPRESSED_REASON, "stage", "research"));
              });
      logger.info("research skipped for suppressed lead leadId={}", lead.leadId());
      return StageOutcome.STOPPED;
    }

    auditLedger.record(
        correlationId,
        AuditEvent.SCRAPE_REQUESTED,
        lead.leadId(),
        job.jobId(),
        ACTOR,
        AuditLedger.payload(
            "website_url", lead.websiteUrl(),
            "budget_seconds", researchProperties.budget().toSeconds(),
            "max_pages", researchProperties.maxPages()));
    final ResearchResult result = callResearcher(lead);
    final SignalSet signals = toSignals(lead.leadId(), result);
    final Instant now = Instant.now(clock);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              signalSetRepository.upsert(signals, now);
              if (result.success()) {
                auditLedger.record(
                    correlationId,
                    AuditEvent.SCRAPE_COMPLETED,
                    lead.leadId(),
                    job.jobId(),
                    ACTOR,
                    AuditLedger.payload(
                        "platform", result.platform(),
                        "sku_estimate", result.skuEstimate(),
                        "category_count", result.categories().size(),
                        "artifact_path", result.artifactPath(),
                        "artifact_hash", result.artifactHash()));
              } else {
                auditLedger.record(
                    correlationId,
                    AuditEvent.SCRAPE_FAILED,
                    lead.leadId(),
                    job.jobId(),
                    ACTOR,
                    AuditLedger.payload("error", result.error()));
              }
              leadTransitions.require(lead.leadId(), LeadStatus.RESEARCHED, null, now);
            });
    return StageOutcome.CONTINUE;
  }

  /**
   * 役割: シグナルを分類し、判定ゲートを適用する。
   * 動作: 分類結果をシグナルへ反映して判定記録を保存し、不適格なら DISQUALIFIED にして STOPPED を返す。
   * 前提: 分類器自身の qualifies 判定は使わない。
   */
  public StageOutcome classifyAndQualify(Lead lead, Job job, String correlationId) {
    final SignalSet signals = loadSignals(lead.leadId());
    final ClassificationOutcome outcome = callClassifier(lead, signals);
    final ClassificationResult result = outcome.result();
    final Instant now = Instant.now(clock);
    final SignalSet classified =
        signals.withClassification(
            result.brandList(),
            result.priceTier(),
            result.scaleScore(),
            result.mapBehaviorScore(),
            result.storeCount(),
            now);
    final QualificationVerdict verdict = qualificationGate.evaluate(classified);
    final QualificationRecord record =
        new QualificationRecord(
            lead.leadId(),
            verdict.qualified(),
            verdict.disqualifyReason(),
            outcome.callId(),
            qualificationProperties.schemaVersion(),
            now);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              signalSetRepository.upsert(classified, now);
              qualificationRepository.upsert(record);
              auditLedger.record(
                  correlationId,
                  AuditEvent.LEAD_CLASSIFIED,
                  lead.leadId(),
                  job.jobId(),
                  ACTOR,
                  AuditLedger.payload(
                      "call_id", outcome.callId(),
                      "used_default", outcome.usedDefault(),
                      "price_tier", classified.priceTier(),
                      "scale_score", classified.scaleScore(),
                      "map_behavior_score", classified.mapBehaviorScore(),
                      "store_count", classified.storeCount(),
                      "brand_count", classified.brandList().size(),
                      "schema_version", record.schemaVersion()));
              if (!verdict.qualified()) {
                leadTransitions.require(
                    lead.leadId(), LeadStatus.DISQUALIFIED, verdict.disqualifyReason(), now);
                auditLedger.record(
                    correlationId,
                    AuditEvent.LEAD_DISQUALIFIED,
                    lead.leadId(),
                    job.jobId(),
                    ACTOR,
                    AuditLedger.payload("reason", verdict.disqualifyReason()));
              }
            });
    if (!verdict.qualified()) {
      logger.info(
          "lead disqualified leadId={} reason={}", lead.leadId(), verdict.disqualifyReason());
      return StageOutcome.STOPPED;
    }
    return StageOutcome.CONTINUE;
  }

  /**
   * 役割: 戦略 angle と紹介商品を決め、リードを QUALIFIED に進める。
   * 動作: ルールエンジンとカタログマッチャの結果を upsert し、
   * leverage_assigned / item_matched / lead_qualified を同じトランザクションで書く。
   */
  public LeverageAssignment assignLeverage(Lead lead, Job job, String correlationId) {
    final SignalSet signals = loadSignals(lead.leadId());
    final LeverageDecision decision =
        leverageRuleEngine.decide(
            leverageRuleRepository.findActiveOrdered(), LeadProfile.of(lead, signals));
    final ItemSelection selection =
        catalogMatcher.select(
            catalogItemRepository.findActive(),
            lead.channel(),
            signals.categories(),
            decision.selectionQuery());
    final Instant now = Instant.now(clock);
    final LeverageAssignment assignment =
        new LeverageAssignment(
            lead.leadId(),
            decision.ruleId(),
            decision.primaryAngle(),
            decision.secondaryAngle(),
            decision.matchReason(),
            decision.fallback(),
            decision.selectionQuery(),
            selection.selectedIds(),
            now);
    final UUID jobId = job == null ? null : job.jobId();
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              leverageAssignmentRepository.upsert(assignment);
              auditLedger.record(
                  correlationId,
                  AuditEvent.LEVERAGE_ASSIGNED,
                  lead.leadId(),
                  jobId,
                  ACTOR,
                  AuditLedger.payload(
                      "rule_id", decision.ruleId(),
                      "primary_angle", decision.primaryAngle(),
                      "secondary_angle", decision.secondaryAngle(),
                      "match_reason", decision.matchReason(),
                      "fallback", decision.fallback()));
              auditLedger.record(
                  correlationId,
                  AuditEvent.ITEM_MATCHED,
                  lead.leadId(),
                  jobId,
                  ACTOR,
                  AuditLedger.payload(
                      "selected_item_ids", selection.selectedIds(),
                      "candidates_found", selection.candidatesFound(),
                      "cap", selection.cap()));
              leadTransitions.require(lead.leadId(), LeadStatus.QUALIFIED, null, now);
              auditLedger.record(
                  correlationId,
                  AuditEvent.LEAD_QUALIFIED,
                  lead.leadId(),
                  jobId,
                  ACTOR,
                  AuditLedger.payload("primary_angle", decision.primaryAngle()));
            });
    logger.info(
        "leverage assigned leadId={} ruleId={} angle={} items={} fallback={}",
        lead.leadId(),
        decision.ruleId(),
        decision.primaryAngle(),
        selection.selectedIds().size(),
        decision.fallback());
    return assignment;
  }

  private ResearchResult callResearcher(Lead lead) {
    final ResearchRequest request =
        new ResearchRequest(
            lead.websiteUrl(),
            lead.leadId(),
            researchProperties.budget(),
            researchProperties.maxPages());
    try {
      final ResearchResult result = storefrontResearcher.research(request);
      return result == null ? ResearchResult.failed("researcher returned no result") : result;
    } catch (RuntimeException ex) {
      logger.warn("research collaborator failed leadId={}", lead.leadId(), ex);
      final String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
      return ResearchResult.failed(message);
    }
  }

  private ClassificationOutcome callClassifier(Lead lead, SignalSet signals) {
    try {
      final ClassificationOutcome outcome =
          leadClassifier.classify(ClassificationInput.of(signals), lead.companyName(), lead.niche());
      if (outcome != null && outcome.result() != null && outcome.result().isValid()) {
        return outcome;
      }
      logger.warn("classifier returned invalid output; using default leadId={}", lead.leadId());
      return new ClassificationOutcome(
          ClassificationResult.DEFAULT, outcome == null ? null : outcome.callId(), true);
    } catch (RuntimeException ex) {
      logger.warn("classifier collaborator failed; using default leadId={}", lead.leadId(), ex);
      return new ClassificationOutcome(ClassificationResult.DEFAULT, null, true);
    }
  }

  private SignalSet loadSignals(UUID leadId) {
    return signalSetRepository
        .findByLeadId(leadId)
        .orElseThrow(() -> new IllegalStateException("signals missing for lead " + leadId));
  }

  static SignalSet toSignals(UUID leadId, ResearchResult result) {
    return new SignalSet(
        leadId,
        result.platform(),
        result.categories(),
        result.sampleItems(),
        result.brandMentions(),
        result.skuEstimate(),
        result.priceMin(),
        result.priceMax(),
        result.policyTextFound(),
        result.policyExcerpt(),
        result.privateLabelRatio(),
        result.siteExcerpt(),
        List.of(),
        null,
        0,
        0,
        0,
        result.artifactPath(),
        result.artifactHash(),
        result.success(),
        result.error(),
        null);
  }
}
