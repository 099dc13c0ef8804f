package com.flamingo.ai.digest.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TimeWindow Tests")
class TimeWindowTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
  private static final Instant END = Instant.parse("2024-05-01T11:00:00Z");

  @Test
  @DisplayName("Should include start and exclude end")
  void shouldBeHalfOpen() {
    TimeWindow window = new TimeWindow(START, END);

    assertThat(window.contains(START)).isTrue();
    assertThat(window.contains(END.minusNanos(1))).isTrue();
    assertThat(window.contains(END)).isFalse();
    assertThat(window.contains(START.minusSeconds(1))).isFalse();
  }

  @Test
  @DisplayName("Should reject empty and inverted windows")
  void shouldRejectInvalidWindows() {
    assertThatThrownBy(() -> new TimeWindow(START, START))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TimeWindow(END, START))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TimeWindow(null, END)).isInstanceOf(NullPointerException.class);
  }

  @Test
  @DisplayName("Should derive the same lock key for equal windows")
  void shouldDeriveStableLockKey() {
    TimeWindow a = new TimeWindow(START, END);
    TimeWindow b = new TimeWindow(Instant.parse("2024-05-01T10:00:00Z"), END);
    TimeWindow next = new TimeWindow(END, END.plusSeconds(3600));

    assertThat(a.lockKey()).isEqualTo(b.lockKey());
    assertThat(a.lockKey()).isNotEqualTo(next.lockKey());
  }
}
