package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.Language;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class CeleryTaskRule implements EntryPointRule {

  @Override
  public String pattern() {
    return "celery_task";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (facts.language() != Language.PYTHON || !facts.callable()) {
      return Optional.empty();
    }
    return facts
        .annotation(Set.of("task", "shared_task"))
        .map(
            task -> {
              Map<String, String> metadata = new LinkedHashMap<>();
              String name = RuleSupport.rawValue(task.argument("name", "queue"));
              metadata.put("topic", name != null ? name : facts.symbol().getQualifiedName());
              return new RuleMatch(pattern(), EntryPointType.EVENT, "celery", 0.85d, metadata);
            });
  }
}
