package com.flamingo.ai.digest.domain.entity;

import com.flamingo.ai.digest.domain.enums.DigestStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** The authoritative record of one window's digest publication. */
@Entity
@Table(
    name = "digests",
    uniqueConstraints = @UniqueConstraint(columnNames = {"window_start", "window_end"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Digest {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private Instant windowStart;

  @Column(nullable = false)
  private Instant windowEnd;

  private String chatId;

  private String messageId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private DigestStatus status;

  private Instant postedAt;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;
}
