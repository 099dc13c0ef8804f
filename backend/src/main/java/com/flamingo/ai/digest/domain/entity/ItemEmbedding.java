package com.flamingo.ai.digest.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Embedding vector bound 1:1 to an item. The pgvector column is read through its text form
 * ({@code [0.1,0.2,...]}) and parsed with {@code PGvector}; writes go through the native upsert in
 * {@code EmbeddingRepository}.
 */
@Entity
@Table(name = "embeddings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ItemEmbedding {

  @Id private UUID itemId;

  @Column(
      name = "embedding",
      nullable = false,
      columnDefinition = "vector",
      insertable = false,
      updatable = false)
  private String vectorText;

  @Column(nullable = false)
  private Instant createdAt;
}
