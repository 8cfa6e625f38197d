package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.Language;
import java.util.Optional;
import java.util.Set;

/** {@code @app.route(...)} views, plus the Flask 2 verb shortcuts in files importing flask. */
public class FlaskRouteRule implements EntryPointRule {

  @Override
  public String pattern() {
    return "flask_route";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (facts.language() != Language.PYTHON || !facts.callable()) {
      return Optional.empty();
    }
    Optional<AnnotationUsage> route = facts.annotation(Set.of("route"));
    if (route.isPresent()) {
      String method = RuleSupport.firstValue(route.get().argument("methods"), false);
      return Optional.of(
          new RuleMatch(
              pattern(),
              EntryPointType.HTTP,
              "flask",
              0.9d,
              RuleSupport.routeMetadata(
                  route.get(), method != null ? RuleSupport.upper(method) : "GET")));
    }
    if (!facts.importsFrom("flask") || facts.importsFrom("fastapi")) {
      return Optional.empty();
    }
    return facts
        .annotation(RuleSupport.PYTHON_VERBS)
        .map(
            decorator ->
                new RuleMatch(
                    pattern(),
                    EntryPointType.HTTP,
                    "flask",
                    0.85d,
                    RuleSupport.routeMetadata(
                        decorator, RuleSupport.upper(RuleSupport.simpleName(decorator.name())))));
  }
}
