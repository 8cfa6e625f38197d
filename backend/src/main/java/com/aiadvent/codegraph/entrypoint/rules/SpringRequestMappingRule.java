package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Handler methods annotated with {@code @RequestMapping} or one of its shortcuts. */
public class SpringRequestMappingRule implements EntryPointRule {

  static final Set<String> MAPPINGS =
      Set.of(
          "RequestMapping",
          "GetMapping",
          "PostMapping",
          "PutMapping",
          "DeleteMapping",
          "PatchMapping");
  static final Set<String> CONTROLLERS = Set.of("RestController", "Controller");

  @Override
  public String pattern() {
    return "spring_request_mapping";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (!facts.callable()) {
      return Optional.empty();
    }
    return facts
        .annotation(MAPPINGS)
        .map(
            mapping -> {
              boolean underController = facts.parentAnnotation(CONTROLLERS).isPresent();
              String basePath =
                  facts
                      .parentAnnotation(Set.of("RequestMapping"))
                      .map(SpringRequestMappingRule::pathOf)
                      .orElse(null);
              Map<String, String> metadata = new LinkedHashMap<>();
              metadata.put("path", RuleSupport.joinPaths(basePath, pathOf(mapping)));
              metadata.put("method", methodOf(mapping));
              return new RuleMatch(
                  pattern(),
                  EntryPointType.HTTP,
                  "spring-boot",
                  underController ? 0.95d : 0.9d,
                  metadata);
            });
  }

  static String pathOf(AnnotationUsage mapping) {
    return RuleSupport.firstValue(mapping.argument("path", "value", "_0"), false);
  }

  private static String methodOf(AnnotationUsage mapping) {
    String simpleName = RuleSupport.simpleName(mapping.name());
    if (!"RequestMapping".equals(simpleName)) {
      return RuleSupport.upper(simpleName.substring(0, simpleName.length() - "Mapping".length()));
    }
    String method = RuleSupport.firstValue(mapping.argument("method"), true);
    return method != null ? RuleSupport.upper(method) : "ANY";
  }
}
