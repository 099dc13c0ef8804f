package com.flamingo.ai.digest.domain.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Membership of an item in a cluster, unique per pair. */
@Entity
@Table(name = "cluster_members")
@IdClass(ClusterMember.Key.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ClusterMember {

  @Id private UUID clusterId;

  @Id private UUID itemId;

  /** Composite primary key. */
  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  @EqualsAndHashCode
  public static class Key implements Serializable {
    private UUID clusterId;
    private UUID itemId;
  }
}
