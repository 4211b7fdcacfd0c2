/*
 * どこで: Lead Engine サービス層
 * 何を: リードを取り込み、調査ジョブを積む
 * なぜ: 抑止済みの相手を入口で止め、同じサイトの重複登録を既存リードへ寄せるため
 */
package com.example.leadengine.service;

import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.Job;
import com.example.leadengine.model.JobStatus;
import com.example.leadengine.model.JobType;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.repository.JobRepository;
import com.example.leadengine.repository.LeadRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class LeadIntakeService {

  private static final Logger logger = LoggerFactory.getLogger(LeadIntakeService.class);

  private final LeadRepository leadRepository;
  private final JobRepository jobRepository;
  private final SuppressionService suppressionService;
  private final AuditLedger auditLedger;
  private final LeadEngineMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: 1 件のリードを取り込む。
   * 動作: 抑止済みなら何も作らず SUPPRESSED、同じ website があれば既存 ID を返し、
   * それ以外は NEW のリードと QUEUED の調査ジョブを監査と同じトランザクションで登録する。
   * 前提: website の一意制約に当たった並行登録は重複扱いに寄せる。
   */
  public IntakeResult intake(LeadIntakeCommand command, String actor) {
    if (command.companyName() == null || command.companyName().isBlank()) {
      throw new IllegalArgumentException("company_name is required");
    }
    final String address =
        command.contactEmail() == null || command.contactEmail().isBlank()
            ? null
            : SuppressionService.normalizeAddress(command.contactEmail());
    if (address != null && suppressionService.isSuppressed(address)) {
      logger.info("intake rejected by suppression domain={}", SuppressionService.domainOf(address));
      metrics.recordIntake("suppressed");
      return IntakeResult.suppressed();
    }
    final String website = normalizeWebsite(command.websiteUrl());
    final Optional<Lead> existing = leadRepository.findByWebsite(website);
    if (existing.isPresent()) {
      metrics.recordIntake("deduplicated");
      return IntakeResult.deduplicated(existing.get().leadId());
    }

    final Instant now = Instant.now(clock);
    final String correlationId = CorrelationIds.current();
    final Lead lead =
        new Lead(
            UUID.randomUUID(),
            command.companyName().trim(),
            website,
            address,
            blankToNull(command.channel()),
            blankToNull(command.niche()),
            blankToNull(command.location()),
            blankToNull(command.notes()),
            LeadStatus.NEW,
            null,
            null,
            null,
            null,
            now,
            now);
    final Job job =
        new Job(
            UUID.randomUUID(),
            JobType.RESEARCH,
            lead.leadId(),
            JobStatus.QUEUED,
            0,
            null,
            null,
            now,
            null,
            null);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Boolean created;
    try {
      created =
          transactionTemplate.execute(
              status -> {
                if (leadRepository.insertIfAbsent(lead) == 0) {
                  return false;
                }
                jobRepository.insert(job);
                auditLedger.record(
                    correlationId,
                    AuditEvent.LEAD_CREATED,
                    lead.leadId(),
                    null,
                    actor,
                    AuditLedger.payload(
                        "company_name", lead.companyName(),
                        "website_url", website,
                        "channel", lead.channel()));
                auditLedger.record(
                    correlationId,
                    AuditEvent.JOB_CREATED,
                    lead.leadId(),
                    job.jobId(),
                    actor,
                    AuditLedger.payload("job_type", job.jobType().name()));
                return true;
              });
    } catch (DuplicateKeyException ex) {
      logger.info("intake lost insert race; resolving to existing lead website={}", website);
      return resolveDuplicate(website);
    }
    if (!Boolean.TRUE.equals(created)) {
      return resolveDuplicate(website);
    }
    logger.info("lead created leadId={} jobId={} actor={}", lead.leadId(), job.jobId(), actor);
    metrics.recordIntake("created");
    return IntakeResult.created(lead.leadId(), job.jobId());
  }

  private IntakeResult resolveDuplicate(String website) {
    final Lead existing =
        leadRepository
            .findByWebsite(website)
            .orElseThrow(
                () -> new IllegalStateException("website conflict without a row: " + website));
    metrics.recordIntake("deduplicated");
    return IntakeResult.deduplicated(existing.leadId());
  }

  static String normalizeWebsite(String websiteUrl) {
    if (websiteUrl == null || websiteUrl.isBlank()) {
      throw new IllegalArgumentException("website_url is required");
    }
    String normalized = websiteUrl.trim().toLowerCase(Locale.ROOT);
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
