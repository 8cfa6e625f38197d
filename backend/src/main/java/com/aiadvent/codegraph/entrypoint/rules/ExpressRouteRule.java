package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.Language;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Symbols that register Express handlers, e.g. {@code router.post('/orders', create)}. The route
 * registration itself is the entry point; one match per symbol carries the first route found.
 */
public class ExpressRouteRule implements EntryPointRule {

  private static final Set<String> VERBS = Set.of("get", "post", "put", "delete", "patch", "all");
  private static final Pattern ROUTE =
      Pattern.compile(
          "\\b(app|router|server|api)\\.(get|post|put|delete|patch|all)"
              + "\\s*\\(\\s*['\"`]([^'\"`]*)");

  @Override
  public String pattern() {
    return "express_route";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (facts.language() != Language.JAVASCRIPT) {
      return Optional.empty();
    }
    if (facts.callNames().stream().noneMatch(VERBS::contains)) {
      return Optional.empty();
    }
    Matcher matcher = ROUTE.matcher(facts.sourceText());
    if (!matcher.find()) {
      return Optional.empty();
    }
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("path", RuleSupport.joinPaths(null, matcher.group(3)));
    metadata.put("method", RuleSupport.upper(matcher.group(2)));
    return Optional.of(new RuleMatch(pattern(), EntryPointType.HTTP, "express", 0.8d, metadata));
  }
}
