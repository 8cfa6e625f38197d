package com.aiadvent.codegraph.flow;

import java.util.List;

public record FlowNarration(String flowName, String technicalSummary, List<NarratedStep> steps) {

  public FlowNarration {
    steps = steps == null ? List.of() : List.copyOf(steps);
  }
}
