package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.Language;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Route attributes shared by actix-web and Rocket ({@code #[get("/")]}). Files that import from
 * {@code rocket} are attributed to Rocket, everything else to actix.
 */
public class RustWebRouteRule implements EntryPointRule {

  private static final Set<String> ATTRIBUTES =
      Set.of("get", "post", "put", "delete", "patch", "head", "route");

  @Override
  public String pattern() {
    return "actix_route";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (facts.language() != Language.RUST || !facts.callable()) {
      return Optional.empty();
    }
    return facts.annotation(ATTRIBUTES).map(attribute -> toMatch(facts, attribute));
  }

  private RuleMatch toMatch(SymbolFacts facts, AnnotationUsage attribute) {
    boolean rocket =
        facts.importsFrom("rocket") || attribute.name().startsWith("rocket::");
    String simpleName = RuleSupport.simpleName(attribute.name());
    String method =
        "route".equals(simpleName)
            ? RuleSupport.firstValue(attribute.argument("method", "_1"), true)
            : simpleName;
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(
        "path",
        RuleSupport.joinPaths(
            null, RuleSupport.firstValue(attribute.argument("_0", "path"), false)));
    metadata.put("method", method != null ? RuleSupport.upper(method) : "ANY");
    return rocket
        ? new RuleMatch("rocket_route", EntryPointType.HTTP, "rocket", 0.85d, metadata)
        : new RuleMatch(pattern(), EntryPointType.HTTP, "actix", 0.85d, metadata);
  }
}
