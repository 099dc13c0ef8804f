package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.Cluster;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Cluster entities. */
@Repository
public interface ClusterRepository extends JpaRepository<Cluster, UUID> {

  List<Cluster> findByWindowStartAndWindowEndOrderByCreatedAtAscIdAsc(
      Instant windowStart, Instant windowEnd);

  /** Members go with their cluster through the foreign key cascade. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      value = "DELETE FROM clusters WHERE window_start = :start AND window_end = :end",
      nativeQuery = true)
  int deleteByWindow(@Param("start") Instant start, @Param("end") Instant end);
}
