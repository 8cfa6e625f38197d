package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.List;
import java.util.Optional;

/** Binds self calls, calls on typed variables and bare calls to enclosing scopes. */
class LocalScopeStrategy implements ResolutionStrategy {

  private static final String SUPER_RECEIVER = "super";

  @Override
  public List<IndexedSymbol> resolve(CallSite site, ResolutionContext context) {
    if (site.selfReceiver()) {
      return context
          .enclosingType()
          .map(type -> context.membersOf(type, site.name()))
          .orElse(List.of());
    }
    if (SUPER_RECEIVER.equals(site.receiver())) {
      return context
          .enclosingType()
          .map(type -> context.inheritedMembersOf(type, site.name()))
          .orElse(List.of());
    }
    if (site.receiver() != null) {
      Optional<IndexedSymbol> type = context.typeOfPath(site.receiver());
      if (type.isEmpty()) {
        type = sameFileType(site.receiver(), context);
      }
      return type.map(resolved -> context.membersOf(resolved, site.name())).orElse(List.of());
    }
    return switch (site.kind()) {
      case CONSTRUCTION -> context.resolveType(site.name()).map(List::of).orElse(List.of());
      case ARGUMENT -> argument(site, context);
      case INVOCATION -> bareInvocation(site, context);
    };
  }

  private List<IndexedSymbol> argument(CallSite site, ResolutionContext context) {
    Optional<String> declared = context.declaredTypeOf(site.name());
    if (declared.isPresent()) {
      return context.resolveType(declared.get()).map(List::of).orElse(List.of());
    }
    for (IndexedSymbol scope : context.ancestry()) {
      List<IndexedSymbol> callables =
          scopeMembers(scope, site.name(), context).stream()
              .filter(symbol -> symbol.kind().isCallable())
              .toList();
      if (!callables.isEmpty()) {
        return callables;
      }
    }
    return List.of();
  }

  private List<IndexedSymbol> bareInvocation(CallSite site, ResolutionContext context) {
    for (IndexedSymbol scope : context.ancestry()) {
      List<IndexedSymbol> members = scopeMembers(scope, site.name(), context);
      if (!members.isEmpty()) {
        return members;
      }
    }
    return List.of();
  }

  private List<IndexedSymbol> scopeMembers(
      IndexedSymbol scope, String name, ResolutionContext context) {
    if (scope.kind().isType()) {
      return context.implicitReceiver() ? context.membersOf(scope, name) : List.of();
    }
    if (scope.kind() == SymbolKind.IMPL) {
      return List.of();
    }
    return context.index().members(scope.qualifiedName(), name);
  }

  private Optional<IndexedSymbol> sameFileType(String receiver, ResolutionContext context) {
    if (receiver.indexOf('.') >= 0) {
      return Optional.empty();
    }
    for (IndexedSymbol symbol : context.ancestry()) {
      if (symbol.kind().isType() && symbol.name().equals(receiver)) {
        return Optional.of(symbol);
      }
    }
    return Optional.empty();
  }
}
