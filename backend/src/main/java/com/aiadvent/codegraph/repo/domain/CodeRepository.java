package com.aiadvent.codegraph.repo.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Registered source repository. Status and file counters are derived from the stored file
 * statuses whenever an index run finishes.
 */
@Entity
@Table(name = "code_repository")
public class CodeRepository {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "root_path", nullable = false, length = 1024)
  private String rootPath;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 32)
  private RepositoryStatus status = RepositoryStatus.PENDING;

  @Column(name = "total_files", nullable = false)
  private int totalFiles;

  @Column(name = "parsed_files", nullable = false)
  private int parsedFiles;

  @Column(name = "failed_files", nullable = false)
  private int failedFiles;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "languages", columnDefinition = "jsonb")
  private List<String> languages = new ArrayList<>();

  @Column(name = "last_error", columnDefinition = "text")
  private String lastError;

  @Column(name = "last_indexed_at")
  private Instant lastIndexedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CodeRepository() {}

  public CodeRepository(String name, String rootPath) {
    this.name = name;
    this.rootPath = rootPath;
  }

  @PrePersist
  void onPersist() {
    Instant now = Instant.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getRootPath() {
    return rootPath;
  }

  public RepositoryStatus getStatus() {
    return status;
  }

  public void setStatus(RepositoryStatus status) {
    this.status = status;
  }

  public int getTotalFiles() {
    return totalFiles;
  }

  public void setTotalFiles(int totalFiles) {
    this.totalFiles = totalFiles;
  }

  public int getParsedFiles() {
    return parsedFiles;
  }

  public void setParsedFiles(int parsedFiles) {
    this.parsedFiles = parsedFiles;
  }

  public int getFailedFiles() {
    return failedFiles;
  }

  public void setFailedFiles(int failedFiles) {
    this.failedFiles = failedFiles;
  }

  public List<String> getLanguages() {
    return languages;
  }

  public void setLanguages(List<String> languages) {
    this.languages = languages != null ? new ArrayList<>(languages) : new ArrayList<>();
  }

  public String getLastError() {
    return lastError;
  }

  public void setLastError(String lastError) {
    this.lastError = lastError;
  }

  public Instant getLastIndexedAt() {
    return lastIndexedAt;
  }

  public void setLastIndexedAt(Instant lastIndexedAt) {
    this.lastIndexedAt = lastIndexedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
