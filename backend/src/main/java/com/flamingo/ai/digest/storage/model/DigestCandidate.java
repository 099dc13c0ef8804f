package com.flamingo.ai.digest.storage.model;

import java.time.Instant;
import java.util.UUID;

/** An item considered for a digest, joined with its source reference. */
public record DigestCandidate(
    UUID itemId,
    String channel,
    long sourceMessageId,
    String topic,
    String summary,
    double importanceScore,
    Instant firstSeenAt,
    boolean hasEmbedding,
    UUID duplicateOfItemId) {}
