package com.flamingo.ai.digest.storage.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A message handed over by the ingestor. {@code canonicalHash} may be null, in which case it is
 * derived from {@code text}.
 */
public record NewRawMessage(
    UUID channelId,
    long sourceMessageId,
    Instant sourceTimestamp,
    String text,
    String entitiesJson,
    String mediaJson,
    String canonicalHash,
    boolean forwarded) {}
