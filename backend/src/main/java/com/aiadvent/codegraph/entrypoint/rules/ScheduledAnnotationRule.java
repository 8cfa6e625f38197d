package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class ScheduledAnnotationRule implements EntryPointRule {

  private static final List<String> SCHEDULE_KEYS =
      List.of(
          "cron",
          "fixedRate",
          "fixedRateString",
          "fixedDelay",
          "fixedDelayString",
          "value",
          "_0");

  @Override
  public String pattern() {
    return "scheduled_annotation";
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (!facts.callable()) {
      return Optional.empty();
    }
    return facts
        .annotation(Set.of("Scheduled", "Schedules", "CronSchedule"))
        .map(
            scheduled -> {
              Map<String, String> metadata = new LinkedHashMap<>();
              metadata.put("schedule", scheduleOf(scheduled));
              return new RuleMatch(
                  pattern(), EntryPointType.SCHEDULER, "scheduler", 0.9d, metadata);
            });
  }

  /** {@code cron=0 0 * * * *} style rendering of the first schedule argument present. */
  static String scheduleOf(AnnotationUsage scheduled) {
    for (String key : SCHEDULE_KEYS) {
      String value = scheduled.argument(key);
      if (value != null) {
        String schedule = RuleSupport.rawValue(value);
        return key.startsWith("_") || "value".equals(key) ? schedule : key + "=" + schedule;
      }
    }
    return null;
  }
}
