package com.example.leadengine.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SequenceTimingTest {

  @Test
  void touchesAreScheduledFromStart() {
    final SequenceTiming timing =
        new SequenceTiming(List.of(Duration.ZERO, Duration.ofHours(24), Duration.ofHours(96)));
    final Instant start = Instant.parse("2026-03-01T00:00:00Z");

    assertThat(timing.touchCount()).isEqualTo(3);
    assertThat(timing.scheduledAt(start, 1)).isEqualTo(start);
    assertThat(timing.scheduledAt(start, 3)).isEqualTo(Instant.parse("2026-03-05T00:00:00Z"));
  }

  @Test
  void emptyDelaysAreRejected() {
    assertThatThrownBy(() -> new SequenceTiming(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
