package com.aiadvent.codegraph.parser.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbol extracted from a single file. {@code qualifiedName} is the raw name the adapter derived;
 * collisions are settled later when the repository-wide name table is built.
 *
 * @param parentIndex index of the enclosing symbol in the same file, {@code -1} for top level
 * @param declaredTypes simple type names keyed by variable name: fields and constructor
 *     properties for types, parameters and locals for callables
 */
public record SymbolDescriptor(
    String name,
    String qualifiedName,
    SymbolKind kind,
    int parentIndex,
    String signature,
    String sourceText,
    int startLine,
    int endLine,
    int startColumn,
    int endColumn,
    List<AnnotationUsage> annotations,
    List<String> superTypes,
    List<String> parameters,
    Map<String, String> declaredTypes,
    List<String> modifiers) {

  public SymbolDescriptor {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Symbol name must not be blank");
    }
    if (qualifiedName == null || qualifiedName.isBlank()) {
      throw new IllegalArgumentException("Qualified name must not be blank");
    }
    if (kind == null) {
      throw new IllegalArgumentException("Symbol kind must not be null");
    }
    annotations = annotations == null ? List.of() : List.copyOf(annotations);
    superTypes = superTypes == null ? List.of() : List.copyOf(superTypes);
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    declaredTypes = declaredTypes == null ? Map.of() : Map.copyOf(declaredTypes);
    modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
  }

  public boolean hasParent() {
    return parentIndex >= 0;
  }

  public static Builder builder(String name, SymbolKind kind) {
    return new Builder(name, kind);
  }

  public static final class Builder {
    private final String name;
    private final SymbolKind kind;
    private String qualifiedName;
    private int parentIndex = -1;
    private String signature;
    private String sourceText;
    private int startLine;
    private int endLine;
    private int startColumn;
    private int endColumn;
    private final List<AnnotationUsage> annotations = new ArrayList<>();
    private final List<String> superTypes = new ArrayList<>();
    private final List<String> parameters = new ArrayList<>();
    private final Map<String, String> declaredTypes = new LinkedHashMap<>();
    private final List<String> modifiers = new ArrayList<>();

    private Builder(String name, SymbolKind kind) {
      this.name = name;
      this.kind = kind;
    }

    public String name() {
      return name;
    }

    public SymbolKind kind() {
      return kind;
    }

    public Builder qualifiedName(String qualifiedName) {
      this.qualifiedName = qualifiedName;
      return this;
    }

    public Builder parentIndex(int parentIndex) {
      this.parentIndex = parentIndex;
      return this;
    }

    public Builder signature(String signature) {
      this.signature = signature;
      return this;
    }

    public Builder sourceText(String sourceText) {
      this.sourceText = sourceText;
      return this;
    }

    public Builder span(int startLine, int startColumn, int endLine, int endColumn) {
      this.startLine = startLine;
      this.startColumn = startColumn;
      this.endLine = endLine;
      this.endColumn = endColumn;
      return this;
    }

    public Builder annotation(AnnotationUsage annotation) {
      annotations.add(annotation);
      return this;
    }

    public Builder annotations(List<AnnotationUsage> values) {
      annotations.addAll(values);
      return this;
    }

    public Builder superType(String superType) {
      if (superType != null && !superType.isBlank()) {
        superTypes.add(superType);
      }
      return this;
    }

    public Builder parameter(String parameter) {
      parameters.add(parameter);
      return this;
    }

    public Builder declaredType(String variable, String type) {
      if (variable != null && type != null && !type.isBlank()) {
        declaredTypes.putIfAbsent(variable, type);
      }
      return this;
    }

    public Builder modifier(String modifier) {
      modifiers.add(modifier);
      return this;
    }

    public SymbolDescriptor build() {
      return new SymbolDescriptor(
          name,
          qualifiedName != null ? qualifiedName : name,
          kind,
          parentIndex,
          signature,
          sourceText,
          startLine,
          endLine,
          startColumn,
          endColumn,
          annotations,
          superTypes,
          parameters,
          declaredTypes,
          modifiers);
    }
  }
}
