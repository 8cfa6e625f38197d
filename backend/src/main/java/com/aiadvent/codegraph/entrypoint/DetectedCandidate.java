package com.aiadvent.codegraph.entrypoint;

import com.aiadvent.codegraph.entrypoint.rules.RuleMatch;
import com.aiadvent.codegraph.entrypoint.rules.SymbolFacts;

public record DetectedCandidate(SymbolFacts facts, RuleMatch match) {}
