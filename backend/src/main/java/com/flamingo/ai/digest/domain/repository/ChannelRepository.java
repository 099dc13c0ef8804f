package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.Channel;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Channel entities. */
@Repository
public interface ChannelRepository extends JpaRepository<Channel, UUID> {

  Optional<Channel> findByUsername(String username);

  /** Inserts or refreshes a channel by username and returns its id. */
  @Query(
      value =
          "INSERT INTO channels (id, username, title, context, active, created_at) "
              + "VALUES (gen_random_uuid(), :username, :title, :context, TRUE, :now) "
              + "ON CONFLICT (username) DO UPDATE "
              + "SET title = EXCLUDED.title, context = EXCLUDED.context "
              + "RETURNING id",
      nativeQuery = true)
  UUID upsert(
      @Param("username") String username,
      @Param("title") String title,
      @Param("context") String context,
      @Param("now") Instant now);

  @Modifying
  @Query("UPDATE Channel c SET c.importanceWeight = :weight WHERE c.username = :username")
  int updateImportanceWeight(@Param("username") String username, @Param("weight") double weight);
}
