package com.aiadvent.codegraph.index.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Indexed file. The content hash is written together with the file's symbols and references; a
 * {@code null} hash forces a reparse on the next run.
 */
@Entity
@Table(
    name = "source_file",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_source_file_path",
            columnNames = {"repository_id", "relative_path"}))
public class SourceFile {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "repository_id", nullable = false)
  private UUID repositoryId;

  @Column(name = "relative_path", nullable = false, length = 1024)
  private String relativePath;

  @Column(name = "language", nullable = false, length = 32)
  private String language;

  @Column(name = "content_hash", length = 64)
  private String contentHash;

  @Column(name = "content", columnDefinition = "text")
  private String content;

  @Column(name = "size_bytes", nullable = false)
  private long sizeBytes;

  @Enumerated(EnumType.STRING)
  @Column(name = "parse_status", length = 16)
  private FileParseStatus parseStatus;

  @Column(name = "parse_error", columnDefinition = "text")
  private String parseError;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SourceFile() {}

  public SourceFile(UUID repositoryId, String relativePath, String language) {
    this.repositoryId = repositoryId;
    this.relativePath = relativePath;
    this.language = language;
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

  public boolean isFailed() {
    return parseStatus == FileParseStatus.FAILED;
  }

  public Long getId() {
    return id;
  }

  public UUID getRepositoryId() {
    return repositoryId;
  }

  public String getRelativePath() {
    return relativePath;
  }

  public String getLanguage() {
    return language;
  }

  public void setLanguage(String language) {
    this.language = language;
  }

  public String getContentHash() {
    return contentHash;
  }

  public void setContentHash(String contentHash) {
    this.contentHash = contentHash;
  }

  public String getContent() {
    return content;
  }

  public void setContent(String content) {
    this.content = content;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public void setSizeBytes(long sizeBytes) {
    this.sizeBytes = sizeBytes;
  }

  public FileParseStatus getParseStatus() {
    return parseStatus;
  }

  public void setParseStatus(FileParseStatus parseStatus) {
    this.parseStatus = parseStatus;
  }

  public String getParseError() {
    return parseError;
  }

  public void setParseError(String parseError) {
    this.parseError = parseError;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public void setDeleted(boolean deleted) {
    this.deleted = deleted;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
