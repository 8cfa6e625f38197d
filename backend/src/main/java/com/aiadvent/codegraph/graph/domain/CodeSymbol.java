package com.aiadvent.codegraph.graph.domain;

import com.aiadvent.codegraph.parser.model.SymbolKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(
    name = "code_symbol",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_code_symbol_qualified_name",
            columnNames = {"repository_id", "qualified_name"}))
public class CodeSymbol {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "repository_id", nullable = false)
  private UUID repositoryId;

  @Column(name = "file_id", nullable = false)
  private Long fileId;

  @Column(name = "file_path", nullable = false, length = 1024)
  private String filePath;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 16)
  private SymbolKind kind;

  @Column(name = "name", nullable = false, length = 512)
  private String name;

  @Column(name = "qualified_name", nullable = false, length = 2048)
  private String qualifiedName;

  @Column(name = "parent_qualified_name", length = 2048)
  private String parentQualifiedName;

  @Column(name = "signature", columnDefinition = "text")
  private String signature;

  @Column(name = "source_text", columnDefinition = "text")
  private String sourceText;

  @Column(name = "start_line", nullable = false)
  private int startLine;

  @Column(name = "end_line", nullable = false)
  private int endLine;

  @Column(name = "start_column", nullable = false)
  private int startColumn;

  @Column(name = "end_column", nullable = false)
  private int endColumn;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb")
  private SymbolMetadata metadata = SymbolMetadata.empty();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CodeSymbol() {}

  public CodeSymbol(
      UUID repositoryId,
      Long fileId,
      String filePath,
      SymbolKind kind,
      String name,
      String qualifiedName) {
    this.repositoryId = repositoryId;
    this.fileId = fileId;
    this.filePath = filePath;
    this.kind = kind;
    this.name = name;
    this.qualifiedName = qualifiedName;
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

  public Long getFileId() {
    return fileId;
  }

  public String getFilePath() {
    return filePath;
  }

  public SymbolKind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public String getQualifiedName() {
    return qualifiedName;
  }

  public String getParentQualifiedName() {
    return parentQualifiedName;
  }

  public void setParentQualifiedName(String parentQualifiedName) {
    this.parentQualifiedName = parentQualifiedName;
  }

  public String getSignature() {
    return signature;
  }

  public void setSignature(String signature) {
    this.signature = signature;
  }

  public String getSourceText() {
    return sourceText;
  }

  public void setSourceText(String sourceText) {
    this.sourceText = sourceText;
  }

  public int getStartLine() {
    return startLine;
  }

  public int getEndLine() {
    return endLine;
  }

  public int getStartColumn() {
    return startColumn;
  }

  public int getEndColumn() {
    return endColumn;
  }

  public void setSpan(int startLine, int startColumn, int endLine, int endColumn) {
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  public SymbolMetadata getMetadata() {
    return metadata != null ? metadata : SymbolMetadata.empty();
  }

  public void setMetadata(SymbolMetadata metadata) {
    this.metadata = metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
