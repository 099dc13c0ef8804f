package com.flamingo.ai.digest.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Reusable enrichment output keyed by canonical hash and digest language. */
@Entity
@Table(name = "summary_cache")
@IdClass(SummaryCacheEntry.Key.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SummaryCacheEntry {

  @Id
  @Column(length = 64)
  private String canonicalHash;

  @Id
  @Column(length = 16)
  private String digestLanguage;

  private String topic;

  @Column(columnDefinition = "TEXT")
  private String summary;

  /** Language of the source text as reported by the model. */
  private String language;

  @Column(nullable = false)
  private double relevanceScore;

  @Column(nullable = false)
  private double importanceScore;

  @Column(nullable = false)
  private Instant updatedAt;

  /** Composite primary key. */
  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  @EqualsAndHashCode
  public static class Key implements Serializable {
    private String canonicalHash;
    private String digestLanguage;
  }
}
