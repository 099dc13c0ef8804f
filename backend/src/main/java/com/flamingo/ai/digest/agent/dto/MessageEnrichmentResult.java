package com.flamingo.ai.digest.agent.dto;

/** Structured output from MessageEnrichmentAgent. */
public record MessageEnrichmentResult(
    String topic,
    String summary,
    String language, // ISO 639-1 code of the source text
    Double relevance,
    Double importance) {}
