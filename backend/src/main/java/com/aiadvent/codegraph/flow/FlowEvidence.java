package com.aiadvent.codegraph.flow;

import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.List;

/**
 * One symbol reached by the traversal.
 *
 * @param via reference type of the edge the symbol was first reached through, {@code null} for
 *     the entry point itself
 * @param logLines log-emitting lines of the symbol, prefixed with their line numbers
 */
public record FlowEvidence(
    int depth,
    Long symbolId,
    String name,
    String qualifiedName,
    SymbolKind kind,
    String filePath,
    int startLine,
    int endLine,
    String via,
    String snippet,
    List<String> logLines) {

  public FlowEvidence {
    logLines = logLines == null ? List.of() : List.copyOf(logLines);
  }
}
