package com.flamingo.ai.digest.service.enrichment;

/** Validated enrichment output; scores are within [0, 1]. */
public record EnrichmentResult(
    String topic, String summary, String language, double relevance, double importance) {}
