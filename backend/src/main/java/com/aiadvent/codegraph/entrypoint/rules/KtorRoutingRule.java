package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.Language;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Functions that build a Ktor routing tree: {@code routing { get("/x") { ... } }}. */
public class KtorRoutingRule implements EntryPointRule {

  private static final Set<String> ROUTING_CALLS = Set.of("routing", "route");
  private static final Set<String> VERBS = Set.of("get", "post", "put", "delete", "patch");
  private static final Pattern ROUTE =
      Pattern.compile("\\b(get|post|put|delete|patch)\\s*\\(\\s*\"([^\"]*)\"");

  @Override
  public String pattern() {
    return "ktor_routing";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (facts.language() != Language.KOTLIN || !facts.callable()) {
      return Optional.empty();
    }
    boolean routing = facts.callNames().stream().anyMatch(ROUTING_CALLS::contains);
    boolean verb = facts.callNames().stream().anyMatch(VERBS::contains);
    if (!routing || !verb) {
      return Optional.empty();
    }
    Map<String, String> metadata = new LinkedHashMap<>();
    Matcher matcher = ROUTE.matcher(facts.sourceText());
    if (matcher.find()) {
      metadata.put("path", RuleSupport.joinPaths(null, matcher.group(2)));
      metadata.put("method", RuleSupport.upper(matcher.group(1)));
    }
    return Optional.of(new RuleMatch(pattern(), EntryPointType.HTTP, "ktor", 0.75d, metadata));
  }
}
