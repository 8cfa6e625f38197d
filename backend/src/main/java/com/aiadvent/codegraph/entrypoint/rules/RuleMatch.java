package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import java.util.LinkedHashMap;
import java.util.Map;

public record RuleMatch(
    String pattern,
    EntryPointType type,
    String framework,
    double confidence,
    Map<String, String> metadata) {

  public RuleMatch {
    metadata = metadata == null ? Map.of() : copyWithoutNulls(metadata);
  }

  private static Map<String, String> copyWithoutNulls(Map<String, String> source) {
    Map<String, String> copy = new LinkedHashMap<>();
    source.forEach(
        (key, value) -> {
          if (key != null && value != null && !value.isBlank()) {
            copy.put(key, value);
          }
        });
    return Map.copyOf(copy);
  }
}
