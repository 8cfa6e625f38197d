package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class JaxRsResourceMethodRule implements EntryPointRule {

  private static final Set<String> VERBS =
      Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");
  private static final Set<String> PATH = Set.of("Path");

  @Override
  public String pattern() {
    return "jax_rs_resource_method";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (!facts.callable()) {
      return Optional.empty();
    }
    return facts
        .annotation(VERBS)
        .map(
            verb -> {
              String basePath = facts.parentAnnotation(PATH).map(this::pathOf).orElse(null);
              String path = facts.annotation(PATH).map(this::pathOf).orElse(null);
              Map<String, String> metadata = new LinkedHashMap<>();
              metadata.put("path", RuleSupport.joinPaths(basePath, path));
              metadata.put("method", RuleSupport.simpleName(verb.name()));
              return new RuleMatch(pattern(), EntryPointType.HTTP, "jax-rs", 0.9d, metadata);
            });
  }

  private String pathOf(AnnotationUsage annotation) {
    return RuleSupport.firstValue(annotation.argument("value", "_0"), false);
  }
}
