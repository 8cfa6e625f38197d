package com.aiadvent.codegraph.parser.model;

import java.util.List;

/**
 * Output of phase one for a single file. A failed file carries its error and no symbols.
 *
 * @param packageName package (Java, Kotlin) or dotted module path (Python, JavaScript, Rust)
 */
public record ParsedFile(
    String relativePath,
    Language language,
    String packageName,
    List<ImportDirective> imports,
    List<SymbolDescriptor> symbols,
    List<CallSite> callSites,
    String error) {

  public ParsedFile {
    imports = imports == null ? List.of() : List.copyOf(imports);
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
    callSites = callSites == null ? List.of() : List.copyOf(callSites);
  }

  public static ParsedFile failed(String relativePath, Language language, String error) {
    return new ParsedFile(
        relativePath,
        language,
        null,
        List.of(),
        List.of(),
        List.of(),
        error != null ? error : "Unknown parse error");
  }

  public boolean isFailed() {
    return error != null;
  }
}
