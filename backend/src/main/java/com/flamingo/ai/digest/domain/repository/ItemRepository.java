package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.Item;
import com.flamingo.ai.digest.domain.enums.ItemStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Item entities. */
@Repository
public interface ItemRepository extends JpaRepository<Item, UUID> {

  @Query("SELECT i FROM Item i WHERE i.rawMessage.id = :rawMessageId")
  Optional<Item> findByRawMessageId(@Param("rawMessageId") UUID rawMessageId);

  /**
   * Records a failed enrichment attempt and returns the resulting retry count. The k-th failure
   * schedules the next attempt {@code base * 2^(k-1)} seconds out, capped at {@code maxSeconds}.
   * {@code retryFloor} lifts the count straight to the retry budget for permanent failures.
   */
  @Query(
      value =
          "INSERT INTO items (id, raw_message_id, relevance_score, importance_score, status,"
              + " retry_count, next_retry_at, first_seen_at, error_message, created_at,"
              + " updated_at) "
              + "VALUES (gen_random_uuid(), :rawMessageId, 0, 0, 'ERROR', GREATEST(1, :retryFloor),"
              + " CAST(:now AS timestamptz) + make_interval(secs => CAST("
              + "   LEAST(:baseSeconds, :maxSeconds) AS double precision)),"
              + " :firstSeenAt, :error, :now, :now) "
              + "ON CONFLICT (raw_message_id) DO UPDATE SET"
              + " status = 'ERROR',"
              + " retry_count = GREATEST(items.retry_count + 1, :retryFloor),"
              + " next_retry_at = EXCLUDED.updated_at + make_interval(secs => CAST("
              + "   LEAST(:baseSeconds * power(2, items.retry_count), :maxSeconds)"
              + "   AS double precision)),"
              + " error_message = EXCLUDED.error_message,"
              + " updated_at = EXCLUDED.updated_at "
              + "RETURNING retry_count",
      nativeQuery = true)
  int upsertError(
      @Param("rawMessageId") UUID rawMessageId,
      @Param("error") String error,
      @Param("firstSeenAt") Instant firstSeenAt,
      @Param("now") Instant now,
      @Param("baseSeconds") long baseSeconds,
      @Param("maxSeconds") long maxSeconds,
      @Param("retryFloor") int retryFloor);

  /** Nearest digest-eligible item whose cosine distance is below {@code maxDistance}. */
  @Query(
      value =
          "SELECT i.id FROM embeddings e"
              + " JOIN items i ON i.id = e.item_id"
              + " WHERE i.status IN ('READY', 'DIGESTED')"
              + "   AND e.created_at > :since"
              + "   AND (e.embedding <=> CAST(:vector AS vector)) < :maxDistance"
              + " ORDER BY e.embedding <=> CAST(:vector AS vector) ASC, i.first_seen_at ASC"
              + " LIMIT 1",
      nativeQuery = true)
  Optional<UUID> findNearest(
      @Param("vector") String vector,
      @Param("maxDistance") double maxDistance,
      @Param("since") Instant since);

  /** Same as {@link #findNearest} restricted to items from one channel. */
  @Query(
      value =
          "SELECT i.id FROM embeddings e"
              + " JOIN items i ON i.id = e.item_id"
              + " JOIN raw_messages rm ON rm.id = i.raw_message_id"
              + " WHERE rm.channel_id = :channelId"
              + "   AND i.status IN ('READY', 'DIGESTED')"
              + "   AND e.created_at > :since"
              + "   AND (e.embedding <=> CAST(:vector AS vector)) < :maxDistance"
              + " ORDER BY e.embedding <=> CAST(:vector AS vector) ASC, i.first_seen_at ASC"
              + " LIMIT 1",
      nativeQuery = true)
  Optional<UUID> findNearestInChannel(
      @Param("vector") String vector,
      @Param("channelId") UUID channelId,
      @Param("maxDistance") double maxDistance,
      @Param("since") Instant since);

  /** Ready, undigested items of a window that carry an embedding, most important first. */
  @Query(
      value =
          "SELECT i.id FROM items i"
              + " JOIN embeddings e ON e.item_id = i.id"
              + " WHERE i.status = 'READY' AND i.digested_at IS NULL"
              + "   AND i.first_seen_at >= :start AND i.first_seen_at < :end"
              + "   AND i.importance_score >= :minImportance"
              + " ORDER BY i.importance_score DESC, i.first_seen_at ASC, i.id ASC"
              + " LIMIT :limit",
      nativeQuery = true)
  List<UUID> findClusterCandidateIds(
      @Param("start") Instant start,
      @Param("end") Instant end,
      @Param("minImportance") double minImportance,
      @Param("limit") int limit);

  @Query(
      "SELECT i FROM Item i JOIN FETCH i.rawMessage rm JOIN FETCH rm.channel "
          + "WHERE i.status = :status AND i.digestedAt IS NULL "
          + "AND i.firstSeenAt >= :start AND i.firstSeenAt < :end "
          + "AND i.importanceScore >= :minImportance")
  List<Item> findUndigestedInWindow(
      @Param("status") ItemStatus status,
      @Param("start") Instant start,
      @Param("end") Instant end,
      @Param("minImportance") double minImportance);

  @Query(
      "SELECT i FROM Item i JOIN FETCH i.rawMessage rm JOIN FETCH rm.channel "
          + "WHERE i.duplicateOfItemId IN :canonicalIds AND i.status = :status "
          + "AND i.digestedAt IS NULL ORDER BY i.firstSeenAt ASC, i.id ASC")
  List<Item> findUndigestedDuplicatesOf(
      @Param("canonicalIds") Collection<UUID> canonicalIds, @Param("status") ItemStatus status);

  /** Duplicates keep their status; everything else becomes DIGESTED. */
  @Modifying
  @Query(
      value =
          "UPDATE items SET"
              + " status = CASE WHEN status = 'DUPLICATE' THEN status ELSE 'DIGESTED' END,"
              + " digested_at = :now, updated_at = :now"
              + " WHERE id IN (:ids) AND digested_at IS NULL",
      nativeQuery = true)
  int markDigested(@Param("ids") Collection<UUID> ids, @Param("now") Instant now);

  /**
   * Turns a ready, undigested item into a duplicate of {@code canonicalId} and returns its raw
   * message id; empty when the item is no longer eligible.
   */
  @Query(
      value =
          "UPDATE items SET status = 'DUPLICATE', duplicate_of_item_id = :canonicalId,"
              + " updated_at = :now"
              + " WHERE id = :id AND status = 'READY' AND digested_at IS NULL"
              + " RETURNING raw_message_id",
      nativeQuery = true)
  Optional<UUID> demoteToDuplicate(
      @Param("id") UUID id, @Param("canonicalId") UUID canonicalId, @Param("now") Instant now);

  @Modifying
  @Query(
      value =
          "UPDATE items SET duplicate_of_item_id = :canonicalId, updated_at = :now"
              + " WHERE duplicate_of_item_id = :previousId",
      nativeQuery = true)
  int repointDuplicates(
      @Param("previousId") UUID previousId,
      @Param("canonicalId") UUID canonicalId,
      @Param("now") Instant now);

  @Query(
      "SELECT i FROM Item i JOIN FETCH i.rawMessage rm JOIN FETCH rm.channel "
          + "WHERE i.status = :status ORDER BY i.updatedAt DESC")
  List<Item> findRecentByStatus(@Param("status") ItemStatus status, Pageable pageable);

  @Modifying
  @Query(
      "UPDATE Item i SET i.status = :retry, i.retryCount = 0, i.nextRetryAt = :now, "
          + "i.updatedAt = :now WHERE i.status = :error")
  int requeueAll(
      @Param("error") ItemStatus error,
      @Param("retry") ItemStatus retry,
      @Param("now") Instant now);

  long countByStatus(ItemStatus status);
}
