/*
 * どこで: Lead Engine サービス層
 * 何を: QUEUED の調査ジョブを claim し、リードを送信シーケンス作成まで進める
 * なぜ: ジョブ単位で失敗を閉じ込め、1 件の失敗で他のリードを止めないため
 */
package com.example.leadengine.service;

import com.example.common.TraceIds;
import com.example.leadengine.config.LeadQueueProperties;
import com.example.leadengine.config.RequestMdcInterceptor;
import com.example.leadengine.model.AuditEvent;
import com.example.leadengine.model.Job;
import com.example.leadengine.model.JobType;
import com.example.leadengine.model.Lead;
import com.example.leadengine.repository.JobRepository;
import com.example.leadengine.repository.LeadRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class LeadQueueDrainService {

  private static final Logger logger = LoggerFactory.getLogger(LeadQueueDrainService.class);
  static final String ACTOR = "queue_worker";
  private static final String MDC_LEAD_ID = "lead_id";
  private static final String MDC_JOB_ID = "job_id";

  private final JobRepository jobRepository;
  private final LeadRepository leadRepository;
  private final LeadPipelineService leadPipelineService;
  private final OutboundSequenceService outboundSequenceService;
  private final AuditLedger auditLedger;
  private final WorkerIdentity workerIdentity;
  private final WorkerShutdownFlag shutdownFlag;
  private final LeadEngineMetrics metrics;
  private final LeadQueueProperties properties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 役割: キューに積まれた調査ジョブを順に処理する。
   * 動作: 各ジョブの前に停止フラグを確認し、claim できたジョブだけをパイプラインに流す。
   * 例外は該当ジョブを FAILED にして次のジョブへ進む。
   */
  public DrainResult drain() {
    final List<Job> queued = jobRepository.findQueued(JobType.RESEARCH, properties.batchSize());
    metrics.updateQueueBacklog(queued.size());
    int processed = 0;
    int skipped = 0;
    int failed = 0;
    for (Job job : queued) {
      if (shutdownFlag.isStopping()) {
        logger.info("drain interrupted by shutdown remaining={}", queued.size() - processed - skipped - failed);
        break;
      }
      final String correlationId = TraceIds.newCorrelationId();
      MDC.put(RequestMdcInterceptor.MDC_CORRELATION_ID, correlationId);
      MDC.put(MDC_LEAD_ID, job.leadId().toString());
      MDC.put(MDC_JOB_ID, job.jobId().toString());
      try {
        if (!claim(job, correlationId)) {
          skipped++;
          metrics.recordJob("skipped");
          continue;
        }
        final Instant started = Instant.now(clock);
        try {
          runPipeline(job, correlationId);
          complete(job, correlationId);
          processed++;
          metrics.recordJob("success");
        } catch (RuntimeException ex) {
          logger.warn("research job failed jobId={} leadId={}", job.jobId(), job.leadId(), ex);
          fail(job, ex, correlationId);
          failed++;
          metrics.recordJob("failed");
        } finally {
          metrics.recordPipelineDuration(Duration.between(started, Instant.now(clock)));
        }
      } finally {
        MDC.remove(RequestMdcInterceptor.MDC_CORRELATION_ID);
        MDC.remove(MDC_LEAD_ID);
        MDC.remove(MDC_JOB_ID);
      }
    }
    if (!queued.isEmpty()) {
      logger.info("drain finished processed={} skipped={} failed={}", processed, skipped, failed);
    }
    return new DrainResult(processed, skipped, failed);
  }

  @VisibleForTesting
  void runPipeline(Job job, String correlationId) {
    final Lead lead =
        leadRepository.findById(job.leadId()).orElseThrow(() -> new LeadNotFoundException(job.leadId()));
    if (leadPipelineService.research(lead, job, correlationId) == StageOutcome.STOPPED) {
      return;
    }
    if (leadPipelineService.classifyAndQualify(lead, job, correlationId) == StageOutcome.STOPPED) {
      return;
    }
    leadPipelineService.assignLeverage(lead, job, correlationId);
    final SequenceResult sequence = outboundSequenceService.createSequence(lead, correlationId);
    if (!sequence.created()) {
      final String summary =
          String.join(
              "; ", sequence.violations().stream().map(violation -> violation.describe()).toList());
      throw new SequenceLintException("lint_failed: " + summary);
    }
  }

  private boolean claim(Job job, String correlationId) {
    final Instant now = Instant.now(clock);
    final Boolean claimed =
        new TransactionTemplate(transactionManager)
            .execute(
                status -> {
                  if (jobRepository.claim(job.jobId(), workerIdentity.lockedBy(), now) == 0) {
                    return false;
                  }
                  auditLedger.record(
                      correlationId,
                      AuditEvent.JOB_STARTED,
                      job.leadId(),
                      job.jobId(),
                      ACTOR,
                      AuditLedger.payload("locked_by", workerIdentity.lockedBy()));
                  return true;
                });
    if (!Boolean.TRUE.equals(claimed)) {
      logger.debug("job already claimed by another worker jobId={}", job.jobId());
      return false;
    }
    return true;
  }

  private void complete(Job job, String correlationId) {
    final Instant now = Instant.now(clock);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              jobRepository.markSuccess(job.jobId(), now);
              auditLedger.record(
                  correlationId,
                  AuditEvent.JOB_COMPLETED,
                  job.leadId(),
                  job.jobId(),
                  ACTOR,
                  AuditLedger.payload());
            });
  }

  private void fail(Job job, RuntimeException ex, String correlationId) {
    final String error = truncateError(ex.getMessage());
    final Instant now = Instant.now(clock);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              jobRepository.markFailed(job.jobId(), error, now);
              auditLedger.record(
                  correlationId,
                  AuditEvent.JOB_FAILED,
                  job.leadId(),
                  job.jobId(),
                  ACTOR,
                  AuditLedger.payload("error", error));
            });
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
