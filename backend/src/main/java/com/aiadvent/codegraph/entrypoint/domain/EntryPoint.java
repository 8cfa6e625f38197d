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

@Entity
@Table(name = "entry_point")
public class EntryPoint {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "repository_id", nullable = false)
  private UUID repositoryId;

  @Column(name = "candidate_id", nullable = false)
  private Long candidateId;

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

  @Column(name = "name", nullable = false, length = 512)
  private String name;

  @Column(name = "description", columnDefinition = "text")
  private String description;

  @Column(name = "confidence", nullable = false)
  private double confidence;

  @Column(name = "reasoning", columnDefinition = "text")
  private String reasoning;

  @Column(name = "http_path", length = 1024)
  private String httpPath;

  @Column(name = "http_method", length = 16)
  private String httpMethod;

  @Column(name = "event_topic", length = 512)
  private String eventTopic;

  @Column(name = "schedule", length = 256)
  private String schedule;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb")
  private Map<String, String> metadata = new LinkedHashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EntryPoint() {}

  public EntryPoint(EntryPointCandidate candidate, String name, String description) {
    this.repositoryId = candidate.getRepositoryId();
    this.candidateId = candidate.getId();
    this.symbolId = candidate.getSymbolId();
    this.fileId = candidate.getFileId();
    this.detectionRunId = candidate.getDetectionRunId();
    this.type = candidate.getType();
    this.framework = candidate.getFramework();
    this.metadata = new LinkedHashMap<>(candidate.getMetadata());
    this.name = name;
    this.description = description;
    this.httpPath = metadata.get("path");
    this.httpMethod = metadata.get("method");
    this.eventTopic = metadata.get("topic");
    this.schedule = metadata.get("schedule");
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

  public Long getCandidateId() {
    return candidateId;
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

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public double getConfidence() {
    return confidence;
  }

  public void setConfidence(double confidence) {
    this.confidence = Math.max(0d, Math.min(1d, confidence));
  }

  public String getReasoning() {
    return reasoning;
  }

  public void setReasoning(String reasoning) {
    this.reasoning = reasoning;
  }

  public String getHttpPath() {
    return httpPath;
  }

  public String getHttpMethod() {
    return httpMethod;
  }

  public String getEventTopic() {
    return eventTopic;
  }

  public String getSchedule() {
    return schedule;
  }

  public Map<String, String> getMetadata() {
    return metadata != null ? metadata : Map.of();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
