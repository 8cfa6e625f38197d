package com.aiadvent.codegraph.parser.model;

/**
 * Import normalized to a dotted path. Relative imports are already resolved against the importing
 * file by the adapter.
 */
public record ImportDirective(String path, String alias, boolean wildcard, int line) {

  public ImportDirective {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("Import path must not be blank");
    }
  }

  /** Short name under which the import is visible in the file. */
  public String visibleName() {
    if (alias != null && !alias.isBlank()) {
      return alias;
    }
    int dot = path.lastIndexOf('.');
    return dot >= 0 ? path.substring(dot + 1) : path;
  }
}
