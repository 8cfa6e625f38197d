package com.aiadvent.codegraph.graph.domain;

import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import java.util.List;
import java.util.Map;

/** JSON payload stored with every symbol; entry-point rules and the resolver read it back. */
public record SymbolMetadata(
    List<AnnotationUsage> annotations,
    List<String> superTypes,
    List<String> parameters,
    List<String> modifiers,
    Map<String, String> declaredTypes) {

  public SymbolMetadata {
    annotations = annotations == null ? List.of() : List.copyOf(annotations);
    superTypes = superTypes == null ? List.of() : List.copyOf(superTypes);
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    declaredTypes = declaredTypes == null ? Map.of() : Map.copyOf(declaredTypes);
  }

  public static SymbolMetadata empty() {
    return new SymbolMetadata(null, null, null, null, null);
  }

  public static SymbolMetadata of(SymbolDescriptor descriptor) {
    return new SymbolMetadata(
        descriptor.annotations(),
        descriptor.superTypes(),
        descriptor.parameters(),
        descriptor.modifiers(),
        descriptor.declaredTypes());
  }
}
