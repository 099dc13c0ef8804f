package com.flamingo.ai.digest.storage.model;

/** Enrichment outputs reusable across messages with the same canonical text. */
public record CachedEnrichment(
    String canonicalHash,
    String digestLanguage,
    String topic,
    String summary,
    String language,
    double relevanceScore,
    double importanceScore) {}
