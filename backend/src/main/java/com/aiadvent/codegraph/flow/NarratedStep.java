package com.aiadvent.codegraph.flow;

import java.util.List;

/**
 * @param qualifiedNames symbols the step covers; their snippets are attached when the flow is
 *     stored
 */
public record NarratedStep(
    String title,
    String description,
    String filePath,
    List<String> logLines,
    List<String> qualifiedNames) {

  public NarratedStep {
    logLines = logLines == null ? List.of() : List.copyOf(logLines);
    qualifiedNames = qualifiedNames == null ? List.of() : List.copyOf(qualifiedNames);
  }
}
