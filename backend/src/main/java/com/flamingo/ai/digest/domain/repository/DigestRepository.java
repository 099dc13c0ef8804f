package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.Digest;
import com.flamingo.ai.digest.domain.enums.DigestStatus;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Digest entities. One row per window. */
@Repository
public interface DigestRepository extends JpaRepository<Digest, UUID> {

  Optional<Digest> findByWindowStartAndWindowEnd(Instant windowStart, Instant windowEnd);

  long countByStatus(DigestStatus status);

  /** A window is settled once posted, and blocked while a recent failure is within grace. */
  @Query(
      value =
          "SELECT EXISTS ("
              + "  SELECT 1 FROM digests"
              + "  WHERE window_start = :start AND window_end = :end"
              + "    AND (status = 'POSTED' OR (status = 'ERROR' AND updated_at > :graceCutoff)))",
      nativeQuery = true)
  boolean existsSettled(
      @Param("start") Instant start,
      @Param("end") Instant end,
      @Param("graceCutoff") Instant graceCutoff);

  @Query(
      value =
          "INSERT INTO digests (id, window_start, window_end, chat_id, message_id, status,"
              + " posted_at, error_message, created_at, updated_at) "
              + "VALUES (gen_random_uuid(), :start, :end, :chatId, :messageId, 'POSTED', :now,"
              + " NULL, :now, :now) "
              + "ON CONFLICT (window_start, window_end) DO UPDATE SET"
              + " chat_id = EXCLUDED.chat_id,"
              + " message_id = EXCLUDED.message_id,"
              + " status = 'POSTED',"
              + " posted_at = COALESCE(digests.posted_at, EXCLUDED.posted_at),"
              + " error_message = NULL,"
              + " updated_at = EXCLUDED.updated_at "
              + "RETURNING id",
      nativeQuery = true)
  UUID upsertPosted(
      @Param("start") Instant start,
      @Param("end") Instant end,
      @Param("chatId") String chatId,
      @Param("messageId") String messageId,
      @Param("now") Instant now);

  /** Records a failed publication unless the window is already posted. */
  @Modifying
  @Query(
      value =
          "INSERT INTO digests (id, window_start, window_end, chat_id, message_id, status,"
              + " posted_at, error_message, created_at, updated_at) "
              + "VALUES (gen_random_uuid(), :start, :end, :chatId, NULL, 'ERROR', NULL, :error,"
              + " :now, :now) "
              + "ON CONFLICT (window_start, window_end) DO UPDATE SET"
              + " chat_id = EXCLUDED.chat_id,"
              + " status = 'ERROR',"
              + " error_message = EXCLUDED.error_message,"
              + " updated_at = EXCLUDED.updated_at "
              + "WHERE digests.status <> 'POSTED'",
      nativeQuery = true)
  int upsertError(
      @Param("start") Instant start,
      @Param("end") Instant end,
      @Param("chatId") String chatId,
      @Param("error") String error,
      @Param("now") Instant now);

  @Modifying
  @Query(value = "DELETE FROM digests WHERE status = 'ERROR'", nativeQuery = true)
  int deleteErrors();
}
