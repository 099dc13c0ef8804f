package com.flamingo.ai.digest.domain.entity;

import com.flamingo.ai.digest.domain.converter.DigestSourceListConverter;
import com.flamingo.ai.digest.domain.model.DigestSource;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.ColumnTransformer;

/** One body paragraph of a digest with its ordered source references. */
@Entity
@Table(name = "digest_entries")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DigestEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID digestId;

  @Column(nullable = false)
  private int position;

  private String title;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String body;

  @Convert(converter = DigestSourceListConverter.class)
  @Column(columnDefinition = "jsonb", nullable = false)
  @ColumnTransformer(write = "?::jsonb")
  @Builder.Default
  private List<DigestSource> sources = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private Instant createdAt;
}
