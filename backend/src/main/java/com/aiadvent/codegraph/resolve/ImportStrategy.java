package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.ImportDirective;
import java.util.List;

/** Binds names and receivers that come in through the file's imports. */
class ImportStrategy implements ResolutionStrategy {

  @Override
  public List<IndexedSymbol> resolve(CallSite site, ResolutionContext context) {
    List<ImportDirective> imports = context.file().imports();
    if (imports.isEmpty()) {
      return List.of();
    }
    return site.receiver() == null
        ? bare(site, imports, context)
        : qualified(site, imports, context);
  }

  private List<IndexedSymbol> bare(
      CallSite site, List<ImportDirective> imports, ResolutionContext context) {
    SymbolIndex index = context.index();
    for (ImportDirective directive : imports) {
      if (directive.wildcard() || !directive.visibleName().equals(site.name())) {
        continue;
      }
      List<IndexedSymbol> targets = index.lookup(directive.path());
      if (targets.isEmpty()) {
        targets = index.lookup(directive.path() + "." + site.name());
      }
      if (!targets.isEmpty()) {
        return targets;
      }
    }
    for (ImportDirective directive : imports) {
      if (directive.wildcard()) {
        List<IndexedSymbol> targets = index.lookup(directive.path() + "." + site.name());
        if (!targets.isEmpty()) {
          return targets;
        }
      }
    }
    return List.of();
  }

  private List<IndexedSymbol> qualified(
      CallSite site, List<ImportDirective> imports, ResolutionContext context) {
    String receiver = site.receiver();
    int dot = receiver.indexOf('.');
    String first = dot > 0 ? receiver.substring(0, dot) : receiver;
    String rest = dot > 0 ? receiver.substring(dot) : "";
    for (ImportDirective directive : imports) {
      if (!directive.wildcard() && directive.visibleName().equals(first)) {
        List<IndexedSymbol> targets = context.membersAt(directive.path() + rest, site.name());
        if (!targets.isEmpty()) {
          return targets;
        }
      }
    }
    for (ImportDirective directive : imports) {
      if (directive.wildcard()) {
        List<IndexedSymbol> targets =
            context.membersAt(directive.path() + "." + receiver, site.name());
        if (!targets.isEmpty()) {
          return targets;
        }
      }
    }
    return List.of();
  }
}
