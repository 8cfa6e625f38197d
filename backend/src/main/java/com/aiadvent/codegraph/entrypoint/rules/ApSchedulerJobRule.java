package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.Language;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/** {@code @scheduler.scheduled_job('cron', hour=3)} style jobs. */
public class ApSchedulerJobRule implements EntryPointRule {

  @Override
  public String pattern() {
    return "apscheduler_job";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (facts.language() != Language.PYTHON || !facts.callable()) {
      return Optional.empty();
    }
    return facts
        .annotation(Set.of("scheduled_job"))
        .map(
            job -> {
              Map<String, String> metadata = new LinkedHashMap<>();
              metadata.put("schedule", scheduleOf(job));
              return new RuleMatch(
                  pattern(), EntryPointType.SCHEDULER, "apscheduler", 0.85d, metadata);
            });
  }

  private static String scheduleOf(AnnotationUsage job) {
    StringJoiner schedule = new StringJoiner(" ");
    String trigger = job.argument("_0", "trigger");
    if (trigger != null) {
      schedule.add(RuleSupport.stripQuotes(trigger.trim()));
    }
    new TreeMap<>(job.arguments())
        .forEach(
            (key, value) -> {
              if (!key.startsWith("_") && !"trigger".equals(key) && !"id".equals(key)) {
                schedule.add(key + "=" + RuleSupport.stripQuotes(value.trim()));
              }
            });
    return schedule.length() > 0 ? schedule.toString() : null;
  }
}
