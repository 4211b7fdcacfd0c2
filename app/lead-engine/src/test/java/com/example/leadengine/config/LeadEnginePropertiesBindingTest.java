/*
 * どこで: Lead Engine 設定バインドのテスト
 * 何を: Duration/リスト値のバインドと未指定時の既定値を検証する
 * なぜ: 送信間隔やしきい値の取り違えが起動時に気付かれないまま運用に出るのを防ぐため
 */
package com.example.leadengine.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class LeadEnginePropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsDurationsAndTouchDelays() {
    contextRunner
        .withPropertyValues(
            "leadengine.queue.enabled=true",
            "leadengine.queue.poll-interval=5s",
            "leadengine.queue.batch-size=7",
            "leadengine.dispatch.enabled=true",
            "leadengine.dispatch.poll-interval=30s",
            "leadengine.dispatch.batch-size=25",
            "leadengine.dispatch.lease=2m",
            "leadengine.dispatch.campaign-ref=campaign-1",
            "leadengine.dispatch.error-message-max-length=500",
            "leadengine.sequence.touch-delays=0h,24h,96h")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final LeadQueueProperties queue = context.getBean(LeadQueueProperties.class);
              final OutboundDispatchProperties dispatch =
                  context.getBean(OutboundDispatchProperties.class);
              final SequenceProperties sequence = context.getBean(SequenceProperties.class);

              assertThat(queue.pollInterval()).isEqualTo(Duration.ofSeconds(5));
              assertThat(queue.batchSize()).isEqualTo(7);
              assertThat(queue.errorMessageMaxLength()).isEqualTo(500);
              assertThat(dispatch.lease()).isEqualTo(Duration.ofMinutes(2));
              assertThat(sequence.touchDelays())
                  .containsExactly(Duration.ZERO, Duration.ofHours(24), Duration.ofHours(96));
            });
  }

  @Test
  void fallsBackToDefaultsWhenUnset() {
    contextRunner
        .withPropertyValues(
            "leadengine.dispatch.batch-size=25",
            "leadengine.dispatch.lease=2m",
            "leadengine.dispatch.campaign-ref=campaign-1",
            "leadengine.dispatch.error-message-max-length=500")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final QualificationProperties qualification =
                  context.getBean(QualificationProperties.class);
              final CatalogProperties catalog = context.getBean(CatalogProperties.class);
              final SequenceProperties sequence = context.getBean(SequenceProperties.class);
              final SeedProperties seed = context.getBean(SeedProperties.class);

              assertThat(qualification.maxPrivateLabelRatio()).isEqualTo(0.95);
              assertThat(qualification.minSkuEstimate()).isEqualTo(10);
              assertThat(qualification.minScaleScore()).isEqualTo(20);
              assertThat(catalog.priorityDiscountThreshold()).isEqualTo(45.0);
              assertThat(catalog.maxPerPrimaryCategory()).isEqualTo(2);
              assertThat(sequence.touchDelays()).hasSize(5).endsWith(Duration.ofHours(720));
              assertThat(seed.enabled()).isFalse();
              assertThat(seed.location()).isEqualTo("classpath:seed/");
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    LeadQueueProperties.class,
    OutboundDispatchProperties.class,
    SequenceProperties.class,
    QualificationProperties.class,
    CatalogProperties.class,
    SeedProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
