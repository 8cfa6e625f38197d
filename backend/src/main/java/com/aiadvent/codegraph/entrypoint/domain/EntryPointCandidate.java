package com.aiadvent.codegraph.entrypoint.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Rule match awaiting confirmation. Rows of every detection run are kept. */
@Entity
@Table(name = "entry_point_candidate")
public class EntryPointCandidate {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "repository_id", nullable = false)
  private UUID repositoryId;

  @Column(name = "symbol_id", nullable = false)
  private Long symbolId;

  @Column(name = "file_id", nullable = false)
  private Long fileId;

  @Column(name = "detection_run_id", nullable = false)
  private UUID detectionRunId;

  @Enumerated(EnumType.STRING)
  @Column(name = "entry_point_type", nullable = false, length = 16)
  private EntryPointType type;

  @Column(name = "framework", nullable = false, length = 64)
  private String framework;

  @Column(name = "detection_pattern", nullable = false, length = 64)
  private String detectionPattern;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb")
  private Map<String, String> metadata = new LinkedHashMap<>();

  @Column(name = "confidence", nullable = false)
  private double confidence;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EntryPointCandidate() {}

  public EntryPointCandidate(
      UUID repositoryId,
      Long symbolId,
      Long fileId,
      UUID detectionRunId,
      EntryPointType type,
      String framework,
      String detectionPattern,
      Map<String, String> metadata,
      double confidence) {
    this.repositoryId = repositoryId;
    this.symbolId = symbolId;
    this.fileId = fileId;
    this.detectionRunId = detectionRunId;
    this.type = type;
    this.framework = framework;
    this.detectionPattern = detectionPattern;
    this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    this.confidence = Math.max(0d, Math.min(1d, confidence));
  }

  @PrePersist
  void onPersist() {
    createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public UUID getRepositoryId() {
    return repositoryId;
  }

  public Long getSymbolId() {
    return symbolId;
  }

  public Long getFileId() {
    return fileId;
  }

  public UUID getDetectionRunId() {
    return detectionRunId;
  }

  public EntryPointType getType() {
    return type;
  }

  public String getFramework() {
    return framework;
  }

  public String getDetectionPattern() {
    return detectionPattern;
  }

  public Map<String, String> getMetadata() {
    return metadata != null ? metadata : Map.of();
  }

  public double getConfidence() {
    return confidence;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
