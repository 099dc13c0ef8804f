package com.flamingo.ai.digest.storage.model;

import com.flamingo.ai.digest.domain.enums.ItemStatus;
import java.time.Instant;
import java.util.UUID;

/** The parts of a stored item that decide which of two duplicates is canonical. */
public record ItemRef(UUID itemId, ItemStatus status, Instant firstSeenAt, boolean digested) {}
