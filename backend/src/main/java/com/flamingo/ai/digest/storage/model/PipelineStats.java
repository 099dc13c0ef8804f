package com.flamingo.ai.digest.storage.model;

import com.flamingo.ai.digest.domain.enums.ItemStatus;
import java.util.Map;

/** Backlog counters for operators. */
public record PipelineStats(
    long unprocessedMessages,
    long claimedMessages,
    Map<ItemStatus, Long> itemsByStatus,
    long postedDigests,
    long failedDigests) {}
