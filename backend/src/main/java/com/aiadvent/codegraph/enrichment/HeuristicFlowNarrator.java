package com.aiadvent.codegraph.enrichment;

import com.aiadvent.codegraph.flow.FlowEvidence;
import com.aiadvent.codegraph.flow.FlowNarration;
import com.aiadvent.codegraph.flow.FlowNarrationRequest;
import com.aiadvent.codegraph.flow.FlowNarrator;
import com.aiadvent.codegraph.flow.NarratedStep;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Offline narrator: one step per traversal depth, appended to the previous round's steps. */
public class HeuristicFlowNarrator implements FlowNarrator {

  @Override
  public FlowNarration narrate(FlowNarrationRequest request) {
    List<NarratedStep> steps = new ArrayList<>(request.previousSteps());
    Map<Integer, List<FlowEvidence>> byDepth =
        request.evidence().stream()
            .collect(Collectors.groupingBy(FlowEvidence::depth, TreeMap::new, Collectors.toList()));
    byDepth.forEach((depth, evidence) -> steps.add(step(request, depth, evidence)));

    Set<String> symbols = new LinkedHashSet<>();
    Set<String> files = new LinkedHashSet<>();
    steps.forEach(step -> symbols.addAll(step.qualifiedNames()));
    steps.forEach(
        step -> {
          if (step.filePath() != null) {
            files.add(step.filePath());
          }
        });
    String summary =
        String.format(
            "%s %s entry point %s reaches %d symbols across %d files",
            request.framework(),
            request.entryPointType(),
            request.qualifiedName(),
            symbols.size(),
            files.size());
    return new FlowNarration(request.entryPointName(), summary, steps);
  }

  private static NarratedStep step(
      FlowNarrationRequest request, int depth, List<FlowEvidence> evidence) {
    List<String> names = evidence.stream().map(FlowEvidence::qualifiedName).toList();
    List<String> logLines =
        evidence.stream().flatMap(item -> item.logLines().stream()).toList();
    String title;
    String description;
    if (depth == 0) {
      title = "Enter " + request.entryPointName();
      description = "Request handled by " + request.qualifiedName();
    } else {
      String simpleNames =
          evidence.stream().map(FlowEvidence::name).distinct().collect(Collectors.joining(", "));
      title = "Depth " + depth + ": " + simpleNames;
      description = "Calls into " + String.join(", ", names);
    }
    return new NarratedStep(title, description, evidence.get(0).filePath(), logLines, names);
  }
}
