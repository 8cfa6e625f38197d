package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** The {@code configure()} method of an Apache Camel route builder. */
public class CamelRouteBuilderRule implements EntryPointRule {

  private static final Set<String> BUILDERS =
      Set.of("RouteBuilder", "EndpointRouteBuilder", "SpringRouteBuilder");
  private static final Pattern FROM = Pattern.compile("\\bfrom\\s*\\(\\s*\"([^\"]+)\"");

  @Override
  public String pattern() {
    return "camel_route_builder";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (!facts.callable()
        || !"configure".equals(facts.symbol().getName())
        || facts.parent() == null) {
      return Optional.empty();
    }
    boolean builder =
        facts.parent().getMetadata().superTypes().stream()
            .map(RuleSupport::simpleName)
            .map(CamelRouteBuilderRule::stripTypeArguments)
            .anyMatch(BUILDERS::contains);
    if (!builder) {
      return Optional.empty();
    }
    Map<String, String> metadata = new LinkedHashMap<>();
    Matcher from = FROM.matcher(facts.sourceText());
    if (from.find()) {
      metadata.put("topic", from.group(1));
    }
    double confidence = facts.callNames().contains("from") ? 0.9d : 0.85d;
    return Optional.of(
        new RuleMatch(pattern(), EntryPointType.EVENT, "apache-camel", confidence, metadata));
  }

  private static String stripTypeArguments(String type) {
    int generic = type.indexOf('<');
    return generic >= 0 ? type.substring(0, generic) : type;
  }
}
