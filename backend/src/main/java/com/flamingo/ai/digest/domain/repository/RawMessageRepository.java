package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.RawMessage;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for RawMessage entities, including the claim protocol used by workers. */
@Repository
public interface RawMessageRepository extends JpaRepository<RawMessage, UUID> {

  /**
   * Claims up to {@code limit} messages in one statement. Eligible rows are unclaimed and either
   * not processed yet (and not waiting for a retry slot) or attached to an errored item whose
   * retry is due. Rows locked by a concurrent claim are skipped.
   */
  @Query(
      value =
          "WITH eligible AS ("
              + "  SELECT rm.id FROM raw_messages rm"
              + "  LEFT JOIN items i ON i.raw_message_id = rm.id"
              + "  WHERE rm.processing_started_at IS NULL"
              + "    AND ((rm.processed_at IS NULL"
              + "          AND (i.id IS NULL"
              + "            OR (i.retry_count < :maxRetries"
              + "                AND (i.next_retry_at IS NULL OR i.next_retry_at <= :now))))"
              + "      OR (i.status IN ('ERROR', 'RETRY')"
              + "          AND i.retry_count < :maxRetries"
              + "          AND i.next_retry_at <= :now))"
              + "  ORDER BY rm.source_timestamp, rm.id"
              + "  LIMIT :limit"
              + "  FOR UPDATE OF rm SKIP LOCKED"
              + "), claimed AS ("
              + "  UPDATE raw_messages rm SET processing_started_at = :now"
              + "  FROM eligible e WHERE rm.id = e.id"
              + "  RETURNING rm.id, rm.source_timestamp"
              + ") "
              + "SELECT id FROM claimed ORDER BY source_timestamp, id",
      nativeQuery = true)
  List<UUID> claimPending(
      @Param("limit") int limit, @Param("now") Instant now, @Param("maxRetries") int maxRetries);

  @Query(
      "SELECT rm FROM RawMessage rm JOIN FETCH rm.channel "
          + "WHERE rm.id IN :ids ORDER BY rm.sourceTimestamp ASC, rm.id ASC")
  List<RawMessage> findWithChannelByIdIn(@Param("ids") Collection<UUID> ids);

  @Modifying
  @Query("UPDATE RawMessage rm SET rm.processingStartedAt = NULL WHERE rm.id = :id")
  int releaseClaim(@Param("id") UUID id);

  @Modifying
  @Query(
      "UPDATE RawMessage rm SET rm.processedAt = :now, rm.processingStartedAt = NULL "
          + "WHERE rm.id = :id AND (rm.processedAt IS NULL OR rm.processingStartedAt IS NOT NULL)")
  int markProcessed(@Param("id") UUID id, @Param("now") Instant now);

  /** Clears claims older than {@code cutoff} that never reached processed state. */
  @Modifying
  @Query(
      "UPDATE RawMessage rm SET rm.processingStartedAt = NULL "
          + "WHERE rm.processingStartedAt < :cutoff "
          + "AND (rm.processedAt IS NULL OR rm.processedAt < rm.processingStartedAt)")
  int recoverStuckClaims(@Param("cutoff") Instant cutoff);

  /** Ingestion upsert; returns the new id, or empty when the message was already stored. */
  @Query(
      value =
          "INSERT INTO raw_messages (id, channel_id, source_message_id, source_timestamp, text,"
              + " entities_json, media_json, canonical_hash, forwarded, discoveries_extracted,"
              + " created_at) "
              + "VALUES (gen_random_uuid(), :channelId, :sourceMessageId, :sourceTimestamp, :text,"
              + " CAST(NULLIF(:entitiesJson, '') AS jsonb), CAST(NULLIF(:mediaJson, '') AS jsonb),"
              + " :canonicalHash, :forwarded, FALSE, :now) "
              + "ON CONFLICT (channel_id, source_message_id) DO NOTHING "
              + "RETURNING id",
      nativeQuery = true)
  Optional<UUID> insertIfAbsent(
      @Param("channelId") UUID channelId,
      @Param("sourceMessageId") long sourceMessageId,
      @Param("sourceTimestamp") Instant sourceTimestamp,
      @Param("text") String text,
      @Param("entitiesJson") String entitiesJson,
      @Param("mediaJson") String mediaJson,
      @Param("canonicalHash") String canonicalHash,
      @Param("forwarded") boolean forwarded,
      @Param("now") Instant now);

  /**
   * True when another message with the same canonical hash was processed into a non-error item.
   */
  @Query(
      value =
          "SELECT EXISTS ("
              + "  SELECT 1 FROM raw_messages rm"
              + "  JOIN items i ON i.raw_message_id = rm.id"
              + "  WHERE rm.canonical_hash = :hash AND rm.id <> :excludeId"
              + "    AND rm.processed_at IS NOT NULL"
              + "    AND i.status NOT IN ('ERROR', 'RETRY'))",
      nativeQuery = true)
  boolean existsProcessedWithHash(
      @Param("hash") String hash, @Param("excludeId") UUID excludeRawMessageId);

  /**
   * Earliest processed item carrying the same canonical hash. Duplicates resolve to their own
   * canonical so chains never form.
   */
  @Query(
      value =
          "SELECT COALESCE(i.duplicate_of_item_id, i.id) FROM raw_messages rm"
              + " JOIN items i ON i.raw_message_id = rm.id"
              + " WHERE rm.canonical_hash = :hash AND rm.id <> :excludeId"
              + "   AND rm.processed_at IS NOT NULL"
              + "   AND i.status NOT IN ('ERROR', 'RETRY')"
              + " ORDER BY i.first_seen_at ASC, i.id ASC"
              + " LIMIT 1",
      nativeQuery = true)
  Optional<UUID> findCanonicalItemIdByHash(
      @Param("hash") String hash, @Param("excludeId") UUID excludeRawMessageId);

  long countByProcessedAtIsNull();

  long countByProcessingStartedAtIsNotNull();
}
