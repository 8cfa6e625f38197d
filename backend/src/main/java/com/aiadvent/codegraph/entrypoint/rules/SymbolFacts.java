package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.Language;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a rule may look at for one symbol.
 *
 * @param parent enclosing symbol, {@code null} for top-level symbols
 * @param callNames bare names of the calls the symbol makes
 * @param importPaths import paths declared by the symbol's file
 */
public record SymbolFacts(
    CodeSymbol symbol,
    CodeSymbol parent,
    Language language,
    Set<String> callNames,
    List<String> importPaths) {

  public SymbolFacts {
    callNames = callNames == null ? Set.of() : Set.copyOf(callNames);
    importPaths = importPaths == null ? List.of() : List.copyOf(importPaths);
  }

  public List<AnnotationUsage> annotations() {
    return symbol.getMetadata().annotations();
  }

  public List<AnnotationUsage> parentAnnotations() {
    return parent != null ? parent.getMetadata().annotations() : List.of();
  }

  public Optional<AnnotationUsage> annotation(Set<String> simpleNames) {
    return find(annotations(), simpleNames);
  }

  public Optional<AnnotationUsage> parentAnnotation(Set<String> simpleNames) {
    return find(parentAnnotations(), simpleNames);
  }

  public boolean callable() {
    return symbol.getKind().isCallable();
  }

  public boolean importsFrom(String root) {
    return importPaths.stream()
        .anyMatch(path -> path.equals(root) || path.startsWith(root + "."));
  }

  public String sourceText() {
    return symbol.getSourceText() != null ? symbol.getSourceText() : "";
  }

  private static Optional<AnnotationUsage> find(
      List<AnnotationUsage> annotations, Set<String> simpleNames) {
    return annotations.stream()
        .filter(annotation -> simpleNames.contains(RuleSupport.simpleName(annotation.name())))
        .findFirst();
  }
}
