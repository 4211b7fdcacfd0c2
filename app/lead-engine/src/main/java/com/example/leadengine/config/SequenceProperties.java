package com.example.leadengine.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** 各タッチのタッチ 1 からの遅延。既定は 0h/24h/96h/168h/720h。 */
@ConfigurationProperties(prefix = "leadengine.sequence")
public record SequenceProperties(List<Duration> touchDelays) {

  public SequenceProperties {
    if (touchDelays == null || touchDelays.isEmpty()) {
      touchDelays =
          List.of(
              Duration.ZERO,
              Duration.ofHours(24),
              Duration.ofHours(96),
              Duration.ofHours(168),
              Duration.ofHours(720));
    }
  }
}
