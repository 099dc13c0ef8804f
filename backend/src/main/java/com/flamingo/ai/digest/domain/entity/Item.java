package com.flamingo.ai.digest.domain.entity;

import com.flamingo.ai.digest.domain.enums.ItemStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Enrichment result for exactly one raw message. */
@Entity
@Table(name = "items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Item {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @OneToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "raw_message_id", nullable = false, unique = true)
  private RawMessage rawMessage;

  @Column(nullable = false)
  private double relevanceScore;

  @Column(nullable = false)
  private double importanceScore;

  private String topic;

  @Column(columnDefinition = "TEXT")
  private String summary;

  private String language;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ItemStatus status;

  @Column(nullable = false)
  private int retryCount;

  private Instant nextRetryAt;

  /** Source timestamp of the underlying message; windows are cut on this column. */
  @Column(nullable = false, updatable = false)
  private Instant firstSeenAt;

  private Instant digestedAt;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  /** Canonical item this one duplicates. Points from the later item to the earlier one. */
  private UUID duplicateOfItemId;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  /** Queues the item for another enrichment attempt with a fresh retry budget. */
  public void requeue(Instant now) {
    this.status = ItemStatus.RETRY;
    this.retryCount = 0;
    this.nextRetryAt = now;
    this.updatedAt = now;
  }
}
