package com.aiadvent.codegraph.parser.model;

import java.util.Map;

/**
 * Annotation, decorator or attribute attached to a symbol. Positional arguments are keyed
 * {@code _0}, {@code _1}; string literal quotes are stripped.
 */
public record AnnotationUsage(String name, Map<String, String> arguments) {

  public AnnotationUsage {
    arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
  }

  public String simpleName() {
    int dot = name.lastIndexOf('.');
    return dot >= 0 ? name.substring(dot + 1) : name;
  }

  public String argument(String... keys) {
    for (String key : keys) {
      String value = arguments.get(key);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
