package com.aiadvent.codegraph.entrypoint.rules;

import java.util.Optional;

/** Framework-specific recognizer for symbols that are invoked from outside the codebase. */
public interface EntryPointRule {

  String pattern();

  Optional<RuleMatch> match(SymbolFacts facts);
}
