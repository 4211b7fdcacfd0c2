/*
 * どこで: Lead Engine の設定バインド
 * 何を: 送信ディスパッチのポーリング/claim 設定を保持する
 * なぜ: 配信ワーカーのバッチサイズと lease を外部化するため
 */
package com.example.leadengine.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "leadengine.dispatch")
@Validated
public record OutboundDispatchProperties(
    boolean enabled,
    Duration pollInterval,
    @Positive int batchSize,
    Duration lease,
    @NotBlank String campaignRef,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "leadengine.dispatch.lease must be positive")
  public boolean isLeasePositive() {
    return lease != null && !lease.isZero() && !lease.isNegative();
  }
}
