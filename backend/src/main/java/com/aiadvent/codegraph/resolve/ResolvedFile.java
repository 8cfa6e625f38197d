package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.ParsedFile;
import java.util.List;

/** Parsed file with its final symbol names and its outgoing edges. */
public record ResolvedFile(
    ParsedFile parsedFile, List<IndexedSymbol> symbols, List<ResolvedReference> references) {

  public ResolvedFile {
    symbols = List.copyOf(symbols);
    references = List.copyOf(references);
  }

  public String relativePath() {
    return parsedFile.relativePath();
  }
}
