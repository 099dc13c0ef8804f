package com.flamingo.ai.digest.service.enrichment;

import com.flamingo.ai.digest.exception.EnrichmentException;
import java.util.function.Predicate;

/**
 * Decides which enrichment errors count against the {@code enrichment} circuit breaker.
 *
 * <p>A permanent error describes one bad message or one unusable answer, not an unhealthy
 * provider, so it is not recorded as a failure. Everything else is.
 */
public class ProviderFailurePredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    if (throwable instanceof EnrichmentException enrichment) {
      return enrichment.isRetryable();
    }
    return true;
  }
}
