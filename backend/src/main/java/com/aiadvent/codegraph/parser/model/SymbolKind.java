package com.aiadvent.codegraph.parser.model;

import java.util.Locale;

public enum SymbolKind {
  FUNCTION,
  METHOD,
  CLASS,
  MODULE,
  IMPORT,
  INTERFACE,
  STRUCT,
  TRAIT,
  ENUM,
  IMPL;

  public boolean isCallable() {
    return this == FUNCTION || this == METHOD;
  }

  public boolean isType() {
    return this == CLASS || this == INTERFACE || this == STRUCT || this == TRAIT || this == ENUM;
  }

  public boolean isContainer() {
    return isType() || this == IMPL || this == MODULE;
  }

  public static SymbolKind fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Symbol kind must not be blank");
    }
    return SymbolKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
