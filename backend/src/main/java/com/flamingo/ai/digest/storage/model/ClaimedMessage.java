package com.flamingo.ai.digest.storage.model;

import java.time.Instant;
import java.util.UUID;

/** A raw message claimed by a worker, with the channel data enrichment needs. */
public record ClaimedMessage(
    UUID rawMessageId,
    UUID channelId,
    String channelUsername,
    String channelContext,
    long sourceMessageId,
    Instant sourceTimestamp,
    String text,
    String canonicalHash,
    boolean forwarded,
    double channelImportanceWeight) {}
