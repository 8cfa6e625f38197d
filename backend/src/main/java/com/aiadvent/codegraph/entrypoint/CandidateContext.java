package com.aiadvent.codegraph.entrypoint;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.Map;

/** Candidate plus the code it points at, as handed to an {@link EntryPointConfirmer}. */
public record CandidateContext(
    Long candidateId,
    EntryPointType type,
    String framework,
    String detectionPattern,
    Map<String, String> metadata,
    double confidence,
    String symbolName,
    String qualifiedName,
    SymbolKind symbolKind,
    String filePath,
    String signature,
    String sourceText) {

  public CandidateContext {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
