package com.aiadvent.codegraph.graph.domain;

public enum ReferenceType {
  CALL,
  USAGE,
  IMPORT
}
