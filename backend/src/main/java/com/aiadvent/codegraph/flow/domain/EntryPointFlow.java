package com.aiadvent.codegraph.flow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Narrated execution flow of one entry point. Never updated; regeneration replaces the row. */
@Entity
@Table(
    name = "entry_point_flow",
    uniqueConstraints =
        @UniqueConstraint(name = "uq_entry_point_flow_entry_point", columnNames = "entry_point_id"))
public class EntryPointFlow {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "repository_id", nullable = false)
  private UUID repositoryId;

  @Column(name = "entry_point_id", nullable = false)
  private Long entryPointId;

  @Column(name = "flow_name", nullable = false, length = 512)
  private String flowName;

  @Column(name = "technical_summary", columnDefinition = "text")
  private String technicalSummary;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "steps", columnDefinition = "jsonb", nullable = false)
  private List<FlowStep> steps = new ArrayList<>();

  @Column(name = "max_depth_analyzed", nullable = false)
  private int maxDepthAnalyzed;

  @Column(name = "iterations_completed", nullable = false)
  private int iterationsCompleted;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "symbol_ids_analyzed", columnDefinition = "jsonb", nullable = false)
  private List<Long> symbolIdsAnalyzed = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "file_paths", columnDefinition = "jsonb", nullable = false)
  private List<String> filePaths = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EntryPointFlow() {}

  public EntryPointFlow(
      UUID repositoryId,
      Long entryPointId,
      String flowName,
      String technicalSummary,
      List<FlowStep> steps,
      int maxDepthAnalyzed,
      int iterationsCompleted,
      List<Long> symbolIdsAnalyzed,
      List<String> filePaths) {
    this.repositoryId = repositoryId;
    this.entryPointId = entryPointId;
    this.flowName = flowName;
    this.technicalSummary = technicalSummary;
    this.steps = new ArrayList<>(steps);
    this.maxDepthAnalyzed = maxDepthAnalyzed;
    this.iterationsCompleted = iterationsCompleted;
    this.symbolIdsAnalyzed = new ArrayList<>(symbolIdsAnalyzed);
    this.filePaths = new ArrayList<>(filePaths);
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

  public Long getEntryPointId() {
    return entryPointId;
  }

  public String getFlowName() {
    return flowName;
  }

  public String getTechnicalSummary() {
    return technicalSummary;
  }

  public List<FlowStep> getSteps() {
    return steps != null ? List.copyOf(steps) : List.of();
  }

  public int getMaxDepthAnalyzed() {
    return maxDepthAnalyzed;
  }

  public int getIterationsCompleted() {
    return iterationsCompleted;
  }

  public List<Long> getSymbolIdsAnalyzed() {
    return symbolIdsAnalyzed != null ? List.copyOf(symbolIdsAnalyzed) : List.of();
  }

  public List<String> getFilePaths() {
    return filePaths != null ? List.copyOf(filePaths) : List.of();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
