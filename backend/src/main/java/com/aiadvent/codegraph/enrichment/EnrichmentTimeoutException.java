package com.aiadvent.codegraph.enrichment;

import java.time.Duration;

public class EnrichmentTimeoutException extends RuntimeException {

  public EnrichmentTimeoutException(String operation, Duration timeout) {
    super("Enrichment call '" + operation + "' timed out after " + timeout.toMillis() + " ms");
  }
}
