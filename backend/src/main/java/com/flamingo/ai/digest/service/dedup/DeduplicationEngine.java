package com.flamingo.ai.digest.service.dedup;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.enums.ItemStatus;
import com.flamingo.ai.digest.service.similarity.SimilarityIndex;
import com.flamingo.ai.digest.storage.StorageGateway;
import com.flamingo.ai.digest.storage.model.ClaimedMessage;
import com.flamingo.ai.digest.storage.model.ItemRef;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Detects duplicates of an enriched message, in order: the same canonical text, a semantically
 * close item in any channel within the global window, then one in the same channel within the
 * shorter burst window.
 *
 * <p>The item first seen earliest is canonical. Retries and parallel workers can store a later
 * message before an earlier one; when the earlier one arrives it supersedes the ready match
 * instead of becoming its duplicate. A match that was already digested stays canonical.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeduplicationEngine {

  private final StorageGateway storageGateway;
  private final SimilarityIndex similarityIndex;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /** Same canonical hash as a message that was already processed to a non-error item. */
  public DuplicateDecision checkStrict(ClaimedMessage message) {
    String hash = message.canonicalHash();
    if (hash == null || hash.isEmpty()) {
      return DuplicateDecision.unique();
    }
    if (!storageGateway.isStrictDuplicate(hash, message.rawMessageId())) {
      return DuplicateDecision.unique();
    }
    Optional<UUID> canonical = storageGateway.findCanonicalItem(hash, message.rawMessageId());
    if (canonical.isEmpty()) {
      return DuplicateDecision.unique();
    }
    return found(message, canonical.get(), DuplicateDecision.REASON_STRICT);
  }

  /** Similarity checks; an empty vector never matches. */
  public DuplicateDecision checkSemantic(ClaimedMessage message, float[] vector) {
    if (vector == null || vector.length == 0) {
      return DuplicateDecision.unique();
    }
    PipelineConfig.Dedup dedup = pipelineConfig.getDedup();
    Instant now = clock.instant();

    Optional<UUID> global =
        similarityIndex.findNearest(
            vector, dedup.getGlobalSimilarity(), now.minus(dedup.getGlobalWindow()));
    if (global.isPresent()) {
      return found(message, global.get(), DuplicateDecision.REASON_SEMANTIC_GLOBAL);
    }

    Optional<UUID> sameChannel =
        similarityIndex.findNearestInChannel(
            vector,
            message.channelId(),
            dedup.getIntraSimilarity(),
            now.minus(dedup.getIntraWindow()));
    if (sameChannel.isPresent()) {
      return found(message, sameChannel.get(), DuplicateDecision.REASON_SEMANTIC_CHANNEL);
    }
    return DuplicateDecision.unique();
  }

  /** Full policy: strict first, then similarity. */
  public DuplicateDecision check(ClaimedMessage message, float[] vector) {
    DuplicateDecision strict = checkStrict(message);
    if (strict.duplicate() || strict.supersedes()) {
      return strict;
    }
    return checkSemantic(message, vector);
  }

  private DuplicateDecision found(ClaimedMessage message, UUID canonicalItemId, String reason) {
    Optional<ItemRef> match = storageGateway.findItemRef(canonicalItemId);
    if (match.isPresent() && seenAfter(match.get(), message)) {
      log.debug(
          "Message {} predates its match {} and supersedes it ({})",
          message.rawMessageId(),
          canonicalItemId,
          reason);
      meterRegistry.counter("dedup.superseded", "reason", reason).increment();
      return DuplicateDecision.supersede(canonicalItemId, reason);
    }
    log.debug(
        "Message {} is a duplicate of item {} ({})",
        message.rawMessageId(),
        canonicalItemId,
        reason);
    meterRegistry.counter("dedup.matches", "reason", reason).increment();
    return DuplicateDecision.of(canonicalItemId, reason);
  }

  private static boolean seenAfter(ItemRef match, ClaimedMessage message) {
    return match.status() == ItemStatus.READY
        && !match.digested()
        && match.firstSeenAt() != null
        && match.firstSeenAt().isAfter(message.sourceTimestamp());
  }
}
