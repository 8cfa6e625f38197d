package com.aiadvent.codegraph.enrichment;

import com.aiadvent.codegraph.entrypoint.CandidateContext;
import com.aiadvent.codegraph.entrypoint.ConfirmationVerdict;
import com.aiadvent.codegraph.entrypoint.EntryPointConfirmer;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Offline confirmer. Accepts callable candidates at their rule confidence and rejects type-level
 * matches, whose handlers are detected on their own.
 */
public class HeuristicEntryPointConfirmer implements EntryPointConfirmer {

  @Override
  public List<ConfirmationVerdict> confirm(List<CandidateContext> candidates) {
    return candidates.stream().map(this::review).toList();
  }

  private ConfirmationVerdict review(CandidateContext candidate) {
    boolean callable = candidate.symbolKind() != null && candidate.symbolKind().isCallable();
    if (!callable) {
      return new ConfirmationVerdict(
          candidate.candidateId(),
          false,
          null,
          null,
          candidate.confidence(),
          "Type-level match of " + candidate.detectionPattern() + " is not invocable itself");
    }
    return new ConfirmationVerdict(
        candidate.candidateId(),
        true,
        nameOf(candidate),
        describe(candidate),
        candidate.confidence(),
        "Matched rule " + candidate.detectionPattern() + " on " + candidate.qualifiedName());
  }

  static String nameOf(CandidateContext candidate) {
    Map<String, String> metadata = candidate.metadata();
    return switch (candidate.type()) {
      case HTTP -> {
        String path = metadata.get("path");
        if (path == null) {
          yield candidate.qualifiedName();
        }
        yield metadata.getOrDefault("method", "ANY") + " " + path;
      }
      case EVENT -> metadata.containsKey("topic")
          ? "consume " + metadata.get("topic")
          : candidate.qualifiedName();
      case SCHEDULER -> metadata.containsKey("schedule")
          ? "schedule " + metadata.get("schedule")
          : candidate.qualifiedName();
    };
  }

  private static String describe(CandidateContext candidate) {
    return String.format(
        Locale.ROOT,
        "%s %s handler %s in %s",
        candidate.framework(),
        candidate.type().name().toLowerCase(Locale.ROOT),
        candidate.qualifiedName(),
        candidate.filePath());
  }
}
