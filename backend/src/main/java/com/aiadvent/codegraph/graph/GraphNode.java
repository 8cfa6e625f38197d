package com.aiadvent.codegraph.graph;

import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.domain.ReferenceType;
import com.aiadvent.codegraph.graph.domain.SymbolReference;
import com.aiadvent.codegraph.parser.model.SymbolKind;

/**
 * Node of a traversal result. External leaves carry only the call-site name and the reference
 * type that reached them.
 *
 * @param depth hop count at which the node was first reached, {@code 0} for the root
 */
public record GraphNode(
    Long symbolId,
    String name,
    String qualifiedName,
    SymbolKind kind,
    String filePath,
    int depth,
    ReferenceType viaReference,
    boolean external,
    boolean ambiguous,
    int startLine,
    int endLine) {

  public static GraphNode root(CodeSymbol symbol) {
    return of(symbol, 0, null, false);
  }

  public static GraphNode of(
      CodeSymbol symbol, int depth, ReferenceType viaReference, boolean ambiguous) {
    return new GraphNode(
        symbol.getId(),
        symbol.getName(),
        symbol.getQualifiedName(),
        symbol.getKind(),
        symbol.getFilePath(),
        depth,
        viaReference,
        false,
        ambiguous,
        symbol.getStartLine(),
        symbol.getEndLine());
  }

  public static GraphNode externalLeaf(SymbolReference reference, int depth) {
    return new GraphNode(
        null,
        reference.getTargetName(),
        reference.getTargetQualifiedName(),
        null,
        reference.getTargetFilePath(),
        depth,
        reference.getReferenceType(),
        true,
        reference.isAmbiguous(),
        0,
        0);
  }
}
