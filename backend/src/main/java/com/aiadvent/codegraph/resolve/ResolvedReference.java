package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.graph.domain.ReferenceType;

/**
 * Edge produced by phase two.
 *
 * @param sourceIndex index of the source symbol within its file
 * @param targetQualifiedName bound target, {@code null} for external edges
 */
public record ResolvedReference(
    int sourceIndex,
    ReferenceType type,
    String targetName,
    String targetQualifiedName,
    String targetFilePath,
    boolean external,
    boolean ambiguous,
    int line) {

  static ResolvedReference internal(
      int sourceIndex,
      ReferenceType type,
      String targetName,
      IndexedSymbol target,
      boolean ambiguous,
      int line) {
    return new ResolvedReference(
        sourceIndex,
        type,
        targetName,
        target.qualifiedName(),
        target.filePath(),
        false,
        ambiguous,
        line);
  }

  static ResolvedReference external(
      int sourceIndex, ReferenceType type, String targetName, int line) {
    return new ResolvedReference(sourceIndex, type, targetName, null, null, true, false, line);
  }
}
