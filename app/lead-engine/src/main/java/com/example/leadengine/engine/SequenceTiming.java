package com.example.leadengine.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** タッチ 1 を起点とした各タッチの送信オフセット。 */
public record SequenceTiming(List<Duration> touchDelays) {

  public SequenceTiming {
    if (touchDelays == null || touchDelays.isEmpty()) {
      throw new IllegalArgumentException("touchDelays must not be empty");
    }
    touchDelays = List.copyOf(touchDelays);
  }

  public int touchCount() {
    return touchDelays.size();
  }

  /** touchIndex は 1 始まり。 */
  public Instant scheduledAt(Instant start, int touchIndex) {
    return start.plus(touchDelays.get(touchIndex - 1));
  }
}
