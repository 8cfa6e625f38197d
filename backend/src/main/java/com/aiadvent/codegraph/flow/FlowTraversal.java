package com.aiadvent.codegraph.flow;

import java.util.List;

/** Evidence gathered per iteration, in discovery order, plus run-wide bookkeeping. */
public record FlowTraversal(
    List<List<FlowEvidence>> iterations,
    int maxDepthAnalyzed,
    List<Long> symbolIds,
    List<String> filePaths) {

  public FlowTraversal {
    iterations = iterations.stream().map(List::copyOf).toList();
    symbolIds = List.copyOf(symbolIds);
    filePaths = List.copyOf(filePaths);
  }

  public int iterationsCompleted() {
    return iterations.size();
  }
}
