package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class RuleSupport {

  private static final Pattern QUOTED = Pattern.compile("[\"'`]([^\"'`]*)[\"'`]");

  private RuleSupport() {}

  /** Last segment of a dotted or {@code ::} separated annotation name. */
  static String simpleName(String name) {
    if (name == null) {
      return "";
    }
    int colons = name.lastIndexOf("::");
    int start = Math.max(name.lastIndexOf('.') + 1, colons >= 0 ? colons + 2 : 0);
    return name.substring(start);
  }

  /**
   * First element of an annotation argument. Adapters join list values with commas, and array
   * literals such as {@code {"/a", "/b"}} or {@code ['POST']} may still arrive raw; either way the
   * first element wins. Enum constants keep their last segment when {@code lastSegment} is set.
   */
  static String firstValue(String raw, boolean lastSegment) {
    if (raw == null) {
      return null;
    }
    String value = raw.trim();
    if (value.startsWith("{") || value.startsWith("[") || value.startsWith("(")) {
      Matcher quoted = QUOTED.matcher(value);
      if (quoted.find()) {
        return quoted.group(1).isBlank() ? null : quoted.group(1);
      }
      value = value.substring(1, Math.max(1, value.length() - 1)).trim();
    }
    int comma = value.indexOf(',');
    if (comma >= 0) {
      value = value.substring(0, comma).trim();
    }
    value = stripQuotes(value);
    if (lastSegment) {
      int dot = value.lastIndexOf('.');
      value = dot >= 0 ? value.substring(dot + 1) : value;
    }
    return value.isBlank() ? null : value;
  }

  /** Argument text without surrounding quotes, {@code null} when blank. */
  static String rawValue(String raw) {
    if (raw == null) {
      return null;
    }
    String value = stripQuotes(raw.trim());
    return value.isBlank() ? null : value;
  }

  static String stripQuotes(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      char last = value.charAt(value.length() - 1);
      if ((first == '"' || first == '\'' || first == '`') && first == last) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }

  /** Joins a base and a relative route into one path that starts with a single slash. */
  static String joinPaths(String base, String path) {
    String left = base == null ? "" : base.trim();
    String right = path == null ? "" : path.trim();
    String joined = left + "/" + right;
    String normalized = joined.replaceAll("/{2,}", "/");
    if (!normalized.startsWith("/")) {
      normalized = "/" + normalized;
    }
    if (normalized.length() > 1 && normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }

  static String upper(String value) {
    return value == null ? null : value.toUpperCase(Locale.ROOT);
  }

  static final Set<String> PYTHON_VERBS =
      Set.of("get", "post", "put", "delete", "patch", "head", "options");

  /** Path and method metadata of a route decorator whose first argument is the path. */
  static Map<String, String> routeMetadata(AnnotationUsage decorator, String method) {
    String path = firstValue(decorator.argument("_0", "path", "rule"), false);
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("path", joinPaths(null, path));
    metadata.put("method", method);
    return metadata;
  }
}
