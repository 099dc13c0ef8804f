package com.flamingo.ai.digest.domain.repository;

import com.flamingo.ai.digest.domain.entity.ClusterMember;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for cluster membership rows. */
@Repository
public interface ClusterMemberRepository extends JpaRepository<ClusterMember, ClusterMember.Key> {

  @Modifying
  @Query(
      value =
          "INSERT INTO cluster_members (cluster_id, item_id) VALUES (:clusterId, :itemId) "
              + "ON CONFLICT (cluster_id, item_id) DO NOTHING",
      nativeQuery = true)
  int insertIfAbsent(@Param("clusterId") UUID clusterId, @Param("itemId") UUID itemId);

  List<ClusterMember> findByClusterIdIn(Collection<UUID> clusterIds);

  long countByClusterId(UUID clusterId);
}
