package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.CallSite;
import java.util.List;

/** One step of the binding chain. An empty list hands the call site to the next step. */
interface ResolutionStrategy {

  List<IndexedSymbol> resolve(CallSite site, ResolutionContext context);
}
