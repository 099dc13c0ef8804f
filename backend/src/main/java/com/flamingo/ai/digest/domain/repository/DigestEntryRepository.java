package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.DigestEntry;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for DigestEntry entities. */
@Repository
public interface DigestEntryRepository extends JpaRepository<DigestEntry, UUID> {

  List<DigestEntry> findByDigestIdOrderByPositionAsc(UUID digestId);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM DigestEntry e WHERE e.digestId = :digestId")
  int deleteByDigestId(@Param("digestId") UUID digestId);
}
