package com.aiadvent.codegraph.parser.model;

public enum CallKind {
  /** Method or function invocation. */
  INVOCATION,
  /** Instantiation of a type ({@code new Foo()}, {@code Foo()} in Kotlin and Python). */
  CONSTRUCTION,
  /** Standalone identifier passed as a call argument. */
  ARGUMENT
}
