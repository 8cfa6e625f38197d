package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.CallSite;
import java.util.List;

/** Qualifies the name, or a {@code Type.member} receiver, with the file's package or module. */
class SamePackageStrategy implements ResolutionStrategy {

  @Override
  public List<IndexedSymbol> resolve(CallSite site, ResolutionContext context) {
    String packageName = context.packageName();
    if (site.receiver() == null) {
      return context.index().lookup(ResolutionContext.qualify(packageName, site.name()));
    }
    List<IndexedSymbol> absolute = context.membersAt(site.receiver(), site.name());
    if (!absolute.isEmpty()) {
      return absolute;
    }
    if (packageName.isEmpty()) {
      return List.of();
    }
    return context.membersAt(
        ResolutionContext.qualify(packageName, site.receiver()), site.name());
  }
}
