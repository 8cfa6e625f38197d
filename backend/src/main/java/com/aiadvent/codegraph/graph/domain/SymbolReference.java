package com.aiadvent.codegraph.graph.domain;

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
import java.util.UUID;

/**
 * Directed edge from a symbol to a call target, a used type or an import. Internal edges bind to
 * their target through {@code (repositoryId, targetQualifiedName)}; external edges keep only the
 * call-site identifier.
 */
@Entity
@Table(name = "symbol_reference")
public class SymbolReference {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "repository_id", nullable = false)
  private UUID repositoryId;

  @Column(name = "source_symbol_id", nullable = false)
  private Long sourceSymbolId;

  @Column(name = "source_file_id", nullable = false)
  private Long sourceFileId;

  @Enumerated(EnumType.STRING)
  @Column(name = "reference_type", nullable = false, length = 16)
  private ReferenceType referenceType;

  @Column(name = "target_name", nullable = false, length = 1024)
  private String targetName;

  @Column(name = "target_qualified_name", length = 2048)
  private String targetQualifiedName;

  @Column(name = "target_file_path", length = 1024)
  private String targetFilePath;

  @Column(name = "is_external", nullable = false)
  private boolean external;

  @Column(name = "ambiguous", nullable = false)
  private boolean ambiguous;

  @Column(name = "line", nullable = false)
  private int line;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SymbolReference() {}

  public SymbolReference(
      UUID repositoryId,
      Long sourceSymbolId,
      Long sourceFileId,
      ReferenceType referenceType,
      String targetName,
      int line) {
    this.repositoryId = repositoryId;
    this.sourceSymbolId = sourceSymbolId;
    this.sourceFileId = sourceFileId;
    this.referenceType = referenceType;
    this.targetName = targetName;
    this.line = line;
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

  public Long getSourceSymbolId() {
    return sourceSymbolId;
  }

  public Long getSourceFileId() {
    return sourceFileId;
  }

  public ReferenceType getReferenceType() {
    return referenceType;
  }

  public String getTargetName() {
    return targetName;
  }

  public String getTargetQualifiedName() {
    return targetQualifiedName;
  }

  public String getTargetFilePath() {
    return targetFilePath;
  }

  public void bindTarget(String targetQualifiedName, String targetFilePath) {
    this.targetQualifiedName = targetQualifiedName;
    this.targetFilePath = targetFilePath;
    this.external = false;
  }

  public boolean isExternal() {
    return external;
  }

  public void setExternal(boolean external) {
    this.external = external;
  }

  public boolean isAmbiguous() {
    return ambiguous;
  }

  public void setAmbiguous(boolean ambiguous) {
    this.ambiguous = ambiguous;
  }

  public int getLine() {
    return line;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
