package com.aiadvent.codegraph.flow;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import java.util.List;

/**
 * Input of one narration round.
 *
 * @param evidence symbols discovered in this iteration, in traversal order
 * @param previousSteps steps returned by the previous round, empty on the first one
 */
public record FlowNarrationRequest(
    String entryPointName,
    EntryPointType entryPointType,
    String framework,
    String qualifiedName,
    String filePath,
    int iteration,
    List<FlowEvidence> evidence,
    List<NarratedStep> previousSteps) {

  public FlowNarrationRequest {
    evidence = evidence == null ? List.of() : List.copyOf(evidence);
    previousSteps = previousSteps == null ? List.of() : List.copyOf(previousSteps);
  }
}
