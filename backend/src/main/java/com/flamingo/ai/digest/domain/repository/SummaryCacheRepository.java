package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.SummaryCacheEntry;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for the enrichment summary cache. */
@Repository
public interface SummaryCacheRepository
    extends JpaRepository<SummaryCacheEntry, SummaryCacheEntry.Key> {

  /** Last write wins. */
  @Modifying
  @Query(
      value =
          "INSERT INTO summary_cache (canonical_hash, digest_language, topic, summary, language,"
              + " relevance_score, importance_score, updated_at) "
              + "VALUES (:hash, :digestLanguage, :topic, :summary, :language, :relevance,"
              + " :importance, :now) "
              + "ON CONFLICT (canonical_hash, digest_language) DO UPDATE SET"
              + " topic = EXCLUDED.topic,"
              + " summary = EXCLUDED.summary,"
              + " language = EXCLUDED.language,"
              + " relevance_score = EXCLUDED.relevance_score,"
              + " importance_score = EXCLUDED.importance_score,"
              + " updated_at = EXCLUDED.updated_at",
      nativeQuery = true)
  int upsert(
      @Param("hash") String hash,
      @Param("digestLanguage") String digestLanguage,
      @Param("topic") String topic,
      @Param("summary") String summary,
      @Param("language") String language,
      @Param("relevance") double relevance,
      @Param("importance") double importance,
      @Param("now") Instant now);
}
