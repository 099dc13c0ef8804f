package com.flamingo.ai.digest.storage.model;

import java.time.Instant;
import java.util.UUID;

/** A ready item with its embedding, as loaded for clustering. */
public record ClusterCandidate(
    UUID itemId, String topic, double importanceScore, Instant firstSeenAt, float[] vector) {}
