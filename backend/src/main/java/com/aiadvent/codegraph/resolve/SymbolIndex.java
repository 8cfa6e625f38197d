package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Repository-wide name table. Members are keyed by their container, which is the qualified name
 * minus the collision suffix and the last segment, so overloads {@code a.B.m} and {@code a.B.m#2}
 * are both members {@code m} of {@code a.B}.
 */
public class SymbolIndex {

  private static final Pattern COLLISION_SUFFIX = Pattern.compile("#\\d+$");
  private static final Set<SymbolKind> NON_MEMBER_KINDS =
      EnumSet.of(SymbolKind.IMPL, SymbolKind.MODULE, SymbolKind.IMPORT);

  private final Map<String, IndexedSymbol> byQualifiedName = new HashMap<>();
  private final Map<String, Map<String, List<IndexedSymbol>>> membersByContainer = new HashMap<>();

  public SymbolIndex(Collection<IndexedSymbol> symbols) {
    for (IndexedSymbol symbol : symbols) {
      add(symbol);
    }
  }

  private void add(IndexedSymbol symbol) {
    byQualifiedName.put(symbol.qualifiedName(), symbol);
    if (NON_MEMBER_KINDS.contains(symbol.kind())) {
      return;
    }
    membersByContainer
        .computeIfAbsent(containerOf(symbol.qualifiedName()), key -> new HashMap<>())
        .computeIfAbsent(symbol.name(), key -> new ArrayList<>())
        .add(symbol);
  }

  public Optional<IndexedSymbol> get(String qualifiedName) {
    return Optional.ofNullable(qualifiedName).map(byQualifiedName::get);
  }

  public List<IndexedSymbol> members(String container, String name) {
    if (container == null || name == null) {
      return List.of();
    }
    Map<String, List<IndexedSymbol>> members = membersByContainer.get(container);
    if (members == null) {
      return List.of();
    }
    return members.getOrDefault(name, List.of());
  }

  /**
   * Symbols answering to a dotted path: the exact qualified name when it exists, otherwise every
   * overload registered under the path's container.
   */
  public List<IndexedSymbol> lookup(String path) {
    if (path == null || path.isBlank()) {
      return List.of();
    }
    IndexedSymbol exact = byQualifiedName.get(path);
    if (exact != null && exact.kind() != SymbolKind.IMPORT) {
      return List.of(exact);
    }
    int dot = path.lastIndexOf('.');
    if (dot < 0) {
      return List.of();
    }
    return members(path.substring(0, dot), path.substring(dot + 1));
  }

  public Optional<IndexedSymbol> lookupType(String path) {
    return lookup(path).stream().filter(symbol -> symbol.kind().isType()).findFirst();
  }

  public int size() {
    return byQualifiedName.size();
  }

  public static String containerOf(String qualifiedName) {
    String base = stripSuffix(qualifiedName);
    int dot = base.lastIndexOf('.');
    return dot >= 0 ? base.substring(0, dot) : "";
  }

  public static String stripSuffix(String qualifiedName) {
    return COLLISION_SUFFIX.matcher(qualifiedName).replaceFirst("");
  }
}
