package com.aiadvent.codegraph.parser.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum Language {
  JAVA("java", List.of("java")),
  KOTLIN("kotlin", List.of("kt", "kts")),
  PYTHON("python", List.of("py")),
  JAVASCRIPT("javascript", List.of("js", "mjs", "cjs", "jsx")),
  RUST("rust", List.of("rs"));

  private static final Map<String, Language> BY_ID;
  private static final Map<String, Language> BY_EXTENSION;

  static {
    Map<String, Language> byId = new HashMap<>();
    Map<String, Language> byExtension = new HashMap<>();
    Arrays.stream(values())
        .forEach(
            language -> {
              byId.put(language.id, language);
              language.extensions.forEach(ext -> byExtension.put(ext, language));
            });
    BY_ID = Collections.unmodifiableMap(byId);
    BY_EXTENSION = Collections.unmodifiableMap(byExtension);
  }

  private final String id;
  private final List<String> extensions;

  Language(String id, List<String> extensions) {
    this.id = id;
    this.extensions = extensions;
  }

  public String id() {
    return id;
  }

  public List<String> extensions() {
    return extensions;
  }

  public static Optional<Language> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_ID.get(id.trim().toLowerCase(Locale.ROOT)));
  }

  public static Optional<Language> fromPath(String path) {
    if (path == null) {
      return Optional.empty();
    }
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    String name = path.substring(slash + 1);
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_EXTENSION.get(name.substring(dot + 1).toLowerCase(Locale.ROOT)));
  }
}
