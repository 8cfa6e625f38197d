package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Controller types themselves. The match is weak: the handler methods carry the actual routes,
 * so a confirmer normally rejects it.
 */
public class SpringRestControllerRule implements EntryPointRule {

  @Override
  public String pattern() {
    return "spring_rest_controller";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (facts.symbol().getKind() != SymbolKind.CLASS) {
      return Optional.empty();
    }
    return facts
        .annotation(SpringRequestMappingRule.CONTROLLERS)
        .map(
            controller -> {
              Map<String, String> metadata = new LinkedHashMap<>();
              facts
                  .annotation(Set.of("RequestMapping"))
                  .map(SpringRequestMappingRule::pathOf)
                  .ifPresent(path -> metadata.put("path", RuleSupport.joinPaths(path, null)));
              return new RuleMatch(pattern(), EntryPointType.HTTP, "spring-boot", 0.6d, metadata);
            });
  }
}
