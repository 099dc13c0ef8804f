package com.flamingo.ai.digest.service.dedup;

import java.util.UUID;

/**
 * Result of a duplicate check; {@code reason} is the drop-log code when a match was found.
 *
 * <p>A match that was first seen after the checked message does not make it a duplicate. The
 * checked message then takes over as canonical and {@code supersededItemId} names the match.
 */
public record DuplicateDecision(
    boolean duplicate, UUID canonicalItemId, String reason, UUID supersededItemId) {

  public static final String REASON_STRICT = "dedup_strict_global";
  public static final String REASON_SEMANTIC_GLOBAL = "dedup_semantic_global";
  public static final String REASON_SEMANTIC_CHANNEL = "dedup_semantic_same_channel";

  private static final DuplicateDecision UNIQUE = new DuplicateDecision(false, null, "", null);

  public static DuplicateDecision unique() {
    return UNIQUE;
  }

  public static DuplicateDecision of(UUID canonicalItemId, String reason) {
    return new DuplicateDecision(true, canonicalItemId, reason, null);
  }

  public static DuplicateDecision supersede(UUID laterItemId, String reason) {
    return new DuplicateDecision(false, null, reason, laterItemId);
  }

  public boolean supersedes() {
    return supersededItemId != null;
  }
}
