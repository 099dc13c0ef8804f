package com.flamingo.ai.digest.service.similarity;

import com.flamingo.ai.digest.storage.StorageGateway;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Nearest-neighbour lookups over stored item embeddings.
 *
 * <p>A match is only returned when its cosine similarity to the query is strictly above the
 * threshold. Callers pass the time floor; the cross-channel search is expected to use the longer
 * one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimilarityIndex {

  private final StorageGateway storageGateway;

  public Optional<UUID> findNearest(float[] vector, double threshold, Instant since) {
    requireThreshold(threshold);
    if (vector == null || vector.length == 0) {
      return Optional.empty();
    }
    Optional<UUID> match = storageGateway.findSimilarItem(vector, threshold, since);
    match.ifPresent(id -> log.debug("Global similarity match {} (threshold {})", id, threshold));
    return match;
  }

  public Optional<UUID> findNearestInChannel(
      float[] vector, UUID channelId, double threshold, Instant since) {
    requireThreshold(threshold);
    if (vector == null || vector.length == 0) {
      return Optional.empty();
    }
    Optional<UUID> match =
        storageGateway.findSimilarItemInChannel(vector, channelId, threshold, since);
    match.ifPresent(
        id -> log.debug("Channel {} similarity match {} (threshold {})", channelId, id, threshold));
    return match;
  }

  /** Cosine similarity of two equally sized vectors; 0 when either has zero norm. */
  public static double cosine(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private static void requireThreshold(double threshold) {
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException(
          "Similarity threshold must be within [0, 1]: " + threshold);
    }
  }
}
