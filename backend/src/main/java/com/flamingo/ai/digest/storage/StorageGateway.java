package com.flamingo.ai.digest.storage;

import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.storage.model.CachedEnrichment;
import com.flamingo.ai.digest.storage.model.ClaimedMessage;
import com.flamingo.ai.digest.storage.model.ClusterCandidate;
import com.flamingo.ai.digest.storage.model.DigestCandidate;
import com.flamingo.ai.digest.storage.model.DigestEntryDraft;
import com.flamingo.ai.digest.storage.model.ItemDraft;
import com.flamingo.ai.digest.storage.model.ItemErrorView;
import com.flamingo.ai.digest.storage.model.ItemRef;
import com.flamingo.ai.digest.storage.model.NewRawMessage;
import com.flamingo.ai.digest.storage.model.PipelineStats;
import com.flamingo.ai.digest.storage.model.WindowCluster;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed access to the durable store. Every operation is atomic at the granularity of its logical
 * effect; failures surface as {@link com.flamingo.ai.digest.exception.StorageException}.
 */
public interface StorageGateway {

  // Ingestion

  /** Inserts or refreshes a channel by username. */
  UUID upsertChannel(String username, String title, String context);

  /**
   * Sets the importance weight of a channel's future items.
   *
   * @return false when no channel has that username
   */
  boolean updateChannelImportanceWeight(String username, double weight);

  /**
   * Stores a message unless {@code (channel, sourceMessageId)} already exists.
   *
   * @return the new raw message id, or empty for a repeat delivery
   */
  Optional<UUID> saveRawMessage(NewRawMessage message);

  // Claims

  /**
   * Claims up to {@code limit} eligible messages, ordered by source timestamp. Concurrent callers
   * receive disjoint sets. An empty list is not an error.
   */
  List<ClaimedMessage> claimPendingBatch(int limit);

  /** Makes a claimed message claimable again. Idempotent. */
  void releaseClaim(UUID rawMessageId);

  /** Completes a message and drops its claim. Idempotent. */
  void markProcessed(UUID rawMessageId);

  /** Clears claims older than {@code staleAfter}; returns how many were cleared. */
  int recoverStuckClaims(Duration staleAfter);

  // Items

  /** True iff another message with this hash was processed to a non-error item. */
  boolean isStrictDuplicate(String canonicalHash, UUID excludeRawMessageId);

  /** The canonical item of another processed message with this hash, when there is one. */
  Optional<UUID> findCanonicalItem(String canonicalHash, UUID excludeRawMessageId);

  Optional<ItemRef> findItemRef(UUID itemId);

  /**
   * Makes {@code canonicalItemId} the canonical item in place of {@code itemId}: the item becomes
   * its duplicate, drops its embedding and logs {@code reason}, and the item's own duplicates are
   * moved over.
   *
   * @return false, changing nothing, when the item is no longer ready or was already digested
   */
  boolean supersedeItem(UUID itemId, UUID canonicalItemId, String reason);

  /** Upserts the item of {@code draft.rawMessageId()}; returns its id. */
  UUID saveItem(ItemDraft draft);

  /**
   * Records a failed attempt: increments {@code retry_count} and schedules the next attempt with
   * exponential backoff. A permanent failure exhausts the retry budget at once.
   *
   * @return the retry count after this failure
   */
  int saveItemError(UUID rawMessageId, Instant firstSeenAt, String error, boolean permanent);

  void saveEmbedding(UUID itemId, float[] vector);

  /**
   * Nearest digest-eligible item whose cosine distance to {@code vector} is strictly below {@code
   * 1 - threshold} and whose embedding was created after {@code since}. A threshold of 1.0 only
   * matches identical directions.
   */
  Optional<UUID> findSimilarItem(float[] vector, double threshold, Instant since);

  /** {@link #findSimilarItem} restricted to one channel. */
  Optional<UUID> findSimilarItemInChannel(
      float[] vector, UUID channelId, double threshold, Instant since);

  /** Explains why a message produced no digest-eligible item. Last reason wins. */
  void recordDrop(UUID rawMessageId, String reason, String detail);

  // Summary cache

  Optional<CachedEnrichment> findCachedEnrichment(String canonicalHash, String digestLanguage);

  void upsertCachedEnrichment(CachedEnrichment entry);

  // Clusters

  /** Ready, undigested items of the window with embeddings, most important first. */
  List<ClusterCandidate> loadClusterCandidates(TimeWindow window, double minImportance, int limit);

  int deleteClustersForWindow(TimeWindow window);

  UUID createCluster(TimeWindow window, String topic);

  /** Idempotent on {@code (clusterId, itemId)}. */
  void addToCluster(UUID clusterId, UUID itemId);

  List<WindowCluster> loadClusters(TimeWindow window);

  // Digests

  /** Ready, undigested items of the window at or above {@code minImportance}. */
  List<DigestCandidate> loadDigestCandidates(TimeWindow window, double minImportance);

  /** Undigested duplicates pointing at any of {@code canonicalItemIds}. */
  List<DigestCandidate> loadDuplicatesOf(Collection<UUID> canonicalItemIds);

  /** True iff the window is posted, or failed less than {@code retryGrace} ago. */
  boolean digestExists(TimeWindow window, Duration retryGrace);

  UUID saveDigest(TimeWindow window, String chatId, String messageId);

  /** Replaces the entries of a digest, preserving list order as position. */
  void saveDigestEntries(UUID digestId, List<DigestEntryDraft> entries);

  void saveDigestError(TimeWindow window, String chatId, String error);

  int clearDigestErrors();

  int markItemsDigested(Collection<UUID> itemIds);

  // Advisory locks

  /** Non-blocking; the lock is held by this process until {@link #releaseLock}. */
  boolean tryAcquireLock(long lockId);

  void releaseLock(long lockId);

  // Operator queries

  List<ItemErrorView> findRecentErrors(int limit);

  /** Puts one failed item back in the claim queue with a fresh retry budget. */
  void retryItem(UUID itemId);

  int retryFailedItems();

  PipelineStats loadStats();
}
