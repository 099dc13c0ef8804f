package com.flamingo.ai.digest.service.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.digest.exception.EnrichmentErrorKind;
import com.flamingo.ai.digest.exception.EnrichmentException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProviderFailurePredicate Tests")
class ProviderFailurePredicateTest {

  private final ProviderFailurePredicate predicate = new ProviderFailurePredicate();

  @Test
  @DisplayName("Should record retryable enrichment errors and unexpected exceptions")
  void shouldRecordRetryableErrors() {
    assertThat(predicate.test(new EnrichmentException(EnrichmentErrorKind.TRANSIENT, "timeout")))
        .isTrue();
    assertThat(predicate.test(new EnrichmentException(EnrichmentErrorKind.RATE_LIMITED, "429")))
        .isTrue();
    assertThat(predicate.test(new IllegalStateException("boom"))).isTrue();
  }

  @Test
  @DisplayName("Should not record permanent enrichment errors")
  void shouldIgnorePermanentErrors() {
    assertThat(predicate.test(new EnrichmentException(EnrichmentErrorKind.PERMANENT, "bad")))
        .isFalse();
  }

  @Test
  @DisplayName("Should keep the breaker closed through a run of malformed responses")
  void shouldKeepBreakerClosedOnPermanentErrors() {
    CircuitBreaker breaker = breaker();

    for (int i = 0; i < 20; i++) {
      assertThatThrownBy(
              () ->
                  breaker.executeRunnable(
                      () -> {
                        throw new EnrichmentException(
                            EnrichmentErrorKind.PERMANENT, "Provider returned no summary");
                      }))
          .isInstanceOf(EnrichmentException.class);
    }

    assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isZero();
  }

  @Test
  @DisplayName("Should open the breaker on a run of transient errors")
  void shouldOpenBreakerOnTransientErrors() {
    CircuitBreaker breaker = breaker();

    for (int i = 0; i < 10; i++) {
      assertThatThrownBy(
              () ->
                  breaker.executeRunnable(
                      () -> {
                        throw new EnrichmentException(EnrichmentErrorKind.TRANSIENT, "timeout");
                      }))
          .isInstanceOf(RuntimeException.class);
    }

    assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
  }

  private CircuitBreaker breaker() {
    CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .recordException(predicate)
            .build();
    return CircuitBreaker.of("enrichment", config);
  }
}
