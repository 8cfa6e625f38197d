package com.aiadvent.codegraph.flow.domain;

import java.util.List;

public record FlowStep(
    int stepNumber,
    String title,
    String description,
    String filePath,
    List<String> logLines,
    List<CodeSnippet> snippets) {

  public FlowStep {
    logLines = logLines == null ? List.of() : List.copyOf(logLines);
    snippets = snippets == null ? List.of() : List.copyOf(snippets);
  }
}
