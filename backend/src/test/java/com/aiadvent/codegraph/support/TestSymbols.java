package com.aiadvent.codegraph.support;

import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.domain.SymbolMetadata;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.test.util.ReflectionTestUtils;

/** Builders for persisted-looking symbols in unit tests. */
public final class TestSymbols {

  public static final UUID REPOSITORY_ID = UUID.fromString("7d3c1d62-3f4a-4d7e-9a55-0c8f1e2b6a10");

  private TestSymbols() {}

  public static CodeSymbol symbol(
      long id,
      String filePath,
      SymbolKind kind,
      String qualifiedName,
      AnnotationUsage... annotations) {
    return symbol(id, filePath, kind, qualifiedName, List.of(), annotations);
  }

  public static CodeSymbol symbol(
      long id,
      String filePath,
      SymbolKind kind,
      String qualifiedName,
      List<String> superTypes,
      AnnotationUsage... annotations) {
    int dot = qualifiedName.lastIndexOf('.');
    String name = dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
    CodeSymbol symbol =
        new CodeSymbol(REPOSITORY_ID, id * 10, filePath, kind, name, qualifiedName);
    ReflectionTestUtils.setField(symbol, "id", id);
    symbol.setMetadata(
        new SymbolMetadata(Arrays.asList(annotations), superTypes, null, null, null));
    return symbol;
  }

  public static AnnotationUsage annotation(String name, String... keyValues) {
    Map<String, String> arguments = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      arguments.put(keyValues[i], keyValues[i + 1]);
    }
    return new AnnotationUsage(name, arguments);
  }
}
