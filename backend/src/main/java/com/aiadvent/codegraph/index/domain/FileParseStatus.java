package com.aiadvent.codegraph.index.domain;

public enum FileParseStatus {
  PARSED,
  FAILED
}
