package com.aiadvent.codegraph.parser;

public class SourceParseException extends RuntimeException {

  public SourceParseException(String message) {
    super(message);
  }

  public SourceParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
