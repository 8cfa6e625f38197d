package com.aiadvent.codegraph.common.exception;

/** Raised when a repository, symbol, job, entry point or flow does not exist. */
public class CodeGraphNotFoundException extends RuntimeException {

  public CodeGraphNotFoundException(String message) {
    super(message);
  }

  public static CodeGraphNotFoundException of(String resource, Object id) {
    return new CodeGraphNotFoundException(resource + " not found: " + id);
  }
}
