package com.flamingo.ai.digest.storage.model;

import java.time.Instant;
import java.util.UUID;

/** A failed item as shown to operators. */
public record ItemErrorView(
    UUID itemId,
    UUID rawMessageId,
    String channel,
    long sourceMessageId,
    int retryCount,
    Instant nextRetryAt,
    String errorMessage,
    Instant updatedAt) {}
