package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.Language;
import java.util.Optional;

/** Verb decorators such as {@code @router.get("/items")} outside of Flask modules. */
public class FastApiRouteRule implements EntryPointRule {

  @Override
  public String pattern() {
    return "fastapi_route";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (facts.language() != Language.PYTHON || !facts.callable()) {
      return Optional.empty();
    }
    if (facts.importsFrom("flask") && !facts.importsFrom("fastapi")) {
      return Optional.empty();
    }
    double confidence = facts.importsFrom("fastapi") ? 0.9d : 0.75d;
    return facts
        .annotation(RuleSupport.PYTHON_VERBS)
        .map(
            decorator ->
                new RuleMatch(
                    pattern(),
                    EntryPointType.HTTP,
                    "fastapi",
                    confidence,
                    RuleSupport.routeMetadata(
                        decorator, RuleSupport.upper(RuleSupport.simpleName(decorator.name())))));
  }
}
