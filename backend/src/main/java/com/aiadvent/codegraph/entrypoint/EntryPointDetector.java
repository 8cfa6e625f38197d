package com.aiadvent.codegraph.entrypoint;

import com.aiadvent.codegraph.entrypoint.rules.EntryPointRule;
import com.aiadvent.codegraph.entrypoint.rules.EntryPointRuleCatalog;
import com.aiadvent.codegraph.entrypoint.rules.RuleMatch;
import com.aiadvent.codegraph.entrypoint.rules.SymbolFacts;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Runs every rule over every symbol and keeps the strongest match per symbol. */
@Component
public class EntryPointDetector {

  private static final List<String> TEST_DIRECTORIES =
      List.of("/src/test/", "/test/", "/tests/", "/__tests__/");
  private static final List<String> TEST_SUFFIXES =
      List.of(
          "Test.java",
          "Tests.java",
          "Test.kt",
          "Tests.kt",
          "_test.py",
          ".test.js",
          ".spec.js",
          "_test.rs");

  private final List<EntryPointRule> rules;

  public EntryPointDetector() {
    this(EntryPointRuleCatalog.defaultRules());
  }

  EntryPointDetector(List<EntryPointRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public List<DetectedCandidate> detect(Collection<SymbolFacts> facts) {
    Map<Long, DetectedCandidate> bySymbol = new LinkedHashMap<>();
    for (SymbolFacts fact : facts) {
      if (isTestFile(fact.symbol().getFilePath())) {
        continue;
      }
      for (EntryPointRule rule : rules) {
        Optional<RuleMatch> match = rule.match(fact);
        if (match.isEmpty()) {
          continue;
        }
        DetectedCandidate current = bySymbol.get(fact.symbol().getId());
        if (current == null || match.get().confidence() > current.match().confidence()) {
          bySymbol.put(fact.symbol().getId(), new DetectedCandidate(fact, match.get()));
        }
      }
    }
    return new ArrayList<>(bySymbol.values());
  }

  static boolean isTestFile(String relativePath) {
    if (relativePath == null) {
      return false;
    }
    String path = "/" + relativePath.replace('\\', '/');
    String lowerPath = path.toLowerCase(Locale.ROOT);
    if (TEST_DIRECTORIES.stream().anyMatch(lowerPath::contains)) {
      return true;
    }
    String fileName = path.substring(path.lastIndexOf('/') + 1);
    if (fileName.startsWith("test_") && fileName.endsWith(".py")) {
      return true;
    }
    return TEST_SUFFIXES.stream().anyMatch(fileName::endsWith);
  }
}
