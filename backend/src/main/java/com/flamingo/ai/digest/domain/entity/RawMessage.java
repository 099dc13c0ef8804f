package com.flamingo.ai.digest.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.ColumnTransformer;

/**
 * A message as ingested from its channel. Claimed by a worker while {@code processingStartedAt}
 * is set and {@code processedAt} is not.
 */
@Entity
@Table(
    name = "raw_messages",
    uniqueConstraints = @UniqueConstraint(columnNames = {"channel_id", "source_message_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RawMessage {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "channel_id", nullable = false)
  private Channel channel;

  @Column(nullable = false)
  private long sourceMessageId;

  @Column(nullable = false)
  private Instant sourceTimestamp;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String text;

  @Column(columnDefinition = "jsonb")
  @ColumnTransformer(write = "?::jsonb")
  private String entitiesJson;

  @Column(columnDefinition = "jsonb")
  @ColumnTransformer(write = "?::jsonb")
  private String mediaJson;

  /** SHA-256 of the normalized text, empty when the text normalizes to nothing. */
  @Column(nullable = false, length = 64)
  private String canonicalHash;

  @Column(nullable = false)
  private boolean forwarded;

  private Instant processedAt;

  private Instant processingStartedAt;

  @Column(nullable = false)
  private boolean discoveriesExtracted;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;
}
