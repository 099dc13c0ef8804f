package com.flamingo.ai.digest.service.enrichment;

/** Input of one enrichment call. */
public record EnrichmentRequest(
    String channel, String channelContext, String languageHint, String text) {}
