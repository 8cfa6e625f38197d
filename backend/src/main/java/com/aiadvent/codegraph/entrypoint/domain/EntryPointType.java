package com.aiadvent.codegraph.entrypoint.domain;

import java.util.Locale;

public enum EntryPointType {
  HTTP,
  EVENT,
  SCHEDULER;

  public static EntryPointType fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Entry point type must not be blank");
    }
    return EntryPointType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
