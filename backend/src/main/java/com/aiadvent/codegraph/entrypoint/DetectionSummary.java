package com.aiadvent.codegraph.entrypoint;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Outcome of a detection request.
 *
 * @param reusedExisting {@code true} when detection was skipped because entry points already
 *     existed and {@code force} was not set
 */
public record DetectionSummary(
    UUID repositoryId,
    UUID detectionRunId,
    int candidatesDetected,
    int entryPointsConfirmed,
    List<String> frameworksDetected,
    Map<String, Integer> byType,
    Map<String, Integer> byFramework,
    boolean reusedExisting) {

  public DetectionSummary {
    frameworksDetected = frameworksDetected == null ? List.of() : List.copyOf(frameworksDetected);
    byType = byType == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byType));
    byFramework =
        byFramework == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byFramework));
  }
}
