/*
 * どこで: Lead Engine サービス層
 * 何を: 取り込み/ジョブ/送信/配信イベント/抑止の件数とキュー滞留を記録する
 * なぜ: パイプラインの進み具合を Prometheus から直接観測できるようにするため
 */
package com.example.leadengine.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class LeadEngineMetrics {

  static final String METRIC_INTAKE_TOTAL = "leadengine.intake.total";
  static final String METRIC_JOB_TOTAL = "leadengine.jobs.total";
  static final String METRIC_DISPATCH_TOTAL = "leadengine.dispatch.total";
  static final String METRIC_DELIVERY_EVENT_TOTAL = "leadengine.delivery.events.total";
  static final String METRIC_SUPPRESSION_TOTAL = "leadengine.suppressions.total";
  static final String METRIC_REPLY_TOTAL = "leadengine.replies.total";
  static final String METRIC_QUEUE_BACKLOG = "leadengine.queue.backlog";
  static final String METRIC_PIPELINE_DURATION = "leadengine.pipeline.duration";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger queueBacklog = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer pipelineDuration;

  public LeadEngineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_BACKLOG, queueBacklog, AtomicInteger::get)
        .description("Queued research jobs seen by the last drain")
        .register(meterRegistry);
    this.pipelineDuration =
        Timer.builder(METRIC_PIPELINE_DURATION)
            .description("Time to run one lead through the pipeline")
            .register(meterRegistry);
  }

  public void recordIntake(String result) {
    increment(METRIC_INTAKE_TOTAL, "Lead intake outcomes", "result", result);
  }

  public void recordJob(String result) {
    increment(METRIC_JOB_TOTAL, "Research job outcomes", "result", result);
  }

  public void recordDispatch(String result) {
    increment(METRIC_DISPATCH_TOTAL, "Outbound dispatch outcomes", "result", result);
  }

  public void recordDeliveryEvent(String event) {
    increment(METRIC_DELIVERY_EVENT_TOTAL, "Normalized delivery events", "event", event);
  }

  public void recordSuppression(String reason) {
    increment(METRIC_SUPPRESSION_TOTAL, "Suppression entries added", "reason", reason);
  }

  public void recordReply(String classification) {
    increment(METRIC_REPLY_TOTAL, "Replies by classification", "classification", classification);
  }

  public void recordPipelineDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    pipelineDuration.record(duration);
  }

  public void updateQueueBacklog(int backlog) {
    queueBacklog.set(Math.max(backlog, 0));
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + "|" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
