package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.DropLogEntry;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for the raw message drop log. */
@Repository
public interface DropLogRepository extends JpaRepository<DropLogEntry, UUID> {

  @Modifying
  @Query(
      value =
          "INSERT INTO raw_message_drop_log (raw_message_id, reason, detail, created_at) "
              + "VALUES (:rawMessageId, :reason, :detail, :now) "
              + "ON CONFLICT (raw_message_id) DO UPDATE SET"
              + " reason = EXCLUDED.reason, detail = EXCLUDED.detail,"
              + " created_at = EXCLUDED.created_at",
      nativeQuery = true)
  int upsert(
      @Param("rawMessageId") UUID rawMessageId,
      @Param("reason") String reason,
      @Param("detail") String detail,
      @Param("now") Instant now);

  long countByReason(String reason);
}
