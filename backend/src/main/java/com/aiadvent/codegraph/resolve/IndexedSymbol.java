package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.List;
import java.util.Map;

/** Symbol as seen by the resolver: either freshly parsed or loaded from an unchanged file. */
public record IndexedSymbol(
    String qualifiedName,
    String name,
    SymbolKind kind,
    String filePath,
    String parentQualifiedName,
    Map<String, String> declaredTypes,
    List<String> superTypes) {

  public IndexedSymbol {
    declaredTypes = declaredTypes == null ? Map.of() : Map.copyOf(declaredTypes);
    superTypes = superTypes == null ? List.of() : List.copyOf(superTypes);
  }

  /** Self type of a Rust {@code impl} block, {@code null} for every other symbol. */
  public String implementedType() {
    return kind == SymbolKind.IMPL ? declaredTypes.get("self") : null;
  }
}
