package com.aiadvent.codegraph.parser;

/**
 * Closed set of node roles shared by every adapter. Raw node types of a grammar are mapped onto
 * these inside the adapter package and never leak out of it.
 */
public enum CanonicalNodeKind {
  SYMBOL_DEFINITION,
  CALL_SITE,
  IDENTIFIER_LEAF,
  OTHER
}
