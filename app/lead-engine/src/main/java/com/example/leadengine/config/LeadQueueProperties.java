/*
 * どこで: Lead Engine の設定バインド
 * 何を: 調査ジョブキューのポーリング設定を保持する
 * なぜ: ワーカーの起動有無と間隔を環境ごとに切り替えるため
 */
package com.example.leadengine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadengine.queue")
public record LeadQueueProperties(
    boolean enabled, Duration pollInterval, Integer batchSize, Integer errorMessageMaxLength) {

  public LeadQueueProperties {
    if (pollInterval == null) {
      pollInterval = Duration.ofSeconds(10);
    }
    if (batchSize == null) {
      batchSize = 50;
    }
    if (errorMessageMaxLength == null) {
      errorMessageMaxLength = 500;
    }
  }
}
