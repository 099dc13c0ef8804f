package com.flamingo.ai.digest.service.enrichment;

import com.flamingo.ai.digest.exception.EnrichmentException;

/** Turns message text plus channel context into topic, summary, language and scores. */
public interface EnrichmentProvider {

  /**
   * @throws EnrichmentException classified as transient, rate limited or permanent
   */
  EnrichmentResult enrich(EnrichmentRequest request);
}
