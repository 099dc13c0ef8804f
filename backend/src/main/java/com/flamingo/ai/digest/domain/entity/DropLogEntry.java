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

/** Why a raw message produced no digest-eligible item. One row per message, last reason wins. */
@Entity
@Table(name = "raw_message_drop_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DropLogEntry {

  @Id private UUID rawMessageId;

  @Column(nullable = false)
  private String reason;

  @Column(columnDefinition = "TEXT")
  private String detail;

  @Column(nullable = false)
  private Instant createdAt;
}
