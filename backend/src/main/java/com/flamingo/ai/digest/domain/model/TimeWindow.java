package com.flamingo.ai.digest.domain.model;

import java.time.Instant;
import java.util.Objects;

/** Half-open interval {@code [start, end)} in source time. */
public record TimeWindow(Instant start, Instant end) {

  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException("Window start must be before end: " + start + " / " + end);
    }
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  /**
   * Advisory lock key for this window. Stable across processes, so every instance serializes on the
   * same key.
   */
  public long lockKey() {
    long h = 1125899906842597L;
    h = 31 * h + start.getEpochSecond();
    h = 31 * h + start.getNano();
    h = 31 * h + end.getEpochSecond();
    h = 31 * h + end.getNano();
    return h;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
