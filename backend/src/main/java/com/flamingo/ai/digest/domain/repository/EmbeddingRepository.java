package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.ItemEmbedding;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for item embeddings. */
@Repository
public interface EmbeddingRepository extends JpaRepository<ItemEmbedding, UUID> {

  @Modifying
  @Query(
      value =
          "INSERT INTO embeddings (item_id, embedding, created_at) "
              + "VALUES (:itemId, CAST(:vector AS vector), :now) "
              + "ON CONFLICT (item_id) DO UPDATE "
              + "SET embedding = EXCLUDED.embedding, created_at = EXCLUDED.created_at",
      nativeQuery = true)
  int upsert(
      @Param("itemId") UUID itemId, @Param("vector") String vector, @Param("now") Instant now);

  @Modifying
  @Query(value = "DELETE FROM embeddings WHERE item_id = :itemId", nativeQuery = true)
  int deleteByItemId(@Param("itemId") UUID itemId);

  @Query("SELECT e.itemId FROM ItemEmbedding e WHERE e.itemId IN :ids")
  List<UUID> findItemIdsWithEmbedding(@Param("ids") Collection<UUID> ids);
}
