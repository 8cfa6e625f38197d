package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.ImportDirective;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the strategies know about one call site: the file it sits in, the chain of symbols
 * enclosing it (innermost first) and the repository-wide index.
 */
final class ResolutionContext {

  private static final int MAX_SUPERTYPE_DEPTH = 8;

  private final ParsedFile file;
  private final List<IndexedSymbol> fileSymbols;
  private final SymbolIndex index;
  private final List<IndexedSymbol> ancestry;

  ResolutionContext(
      ParsedFile file, List<IndexedSymbol> fileSymbols, SymbolIndex index, int ownerIndex) {
    this.file = file;
    this.fileSymbols = fileSymbols;
    this.index = index;
    this.ancestry = new ArrayList<>();
    List<SymbolDescriptor> descriptors = file.symbols();
    int current = ownerIndex;
    while (current >= 0 && current < descriptors.size() && ancestry.size() <= descriptors.size()) {
      ancestry.add(fileSymbols.get(current));
      current = descriptors.get(current).parentIndex();
    }
  }

  ParsedFile file() {
    return file;
  }

  SymbolIndex index() {
    return index;
  }

  List<IndexedSymbol> ancestry() {
    return ancestry;
  }

  String packageName() {
    return file.packageName() != null ? file.packageName() : "";
  }

  /** Whether bare calls inside a type body reach the type's own members. */
  boolean implicitReceiver() {
    return file.language() == Language.JAVA || file.language() == Language.KOTLIN;
  }

  /** Nearest enclosing type; an {@code impl} block stands for the type it implements. */
  Optional<IndexedSymbol> enclosingType() {
    for (IndexedSymbol symbol : ancestry) {
      if (symbol.kind().isType()) {
        return Optional.of(symbol);
      }
      if (symbol.kind() == SymbolKind.IMPL) {
        return resolveType(symbol.implementedType());
      }
    }
    return Optional.empty();
  }

  /** Declared type of a local, parameter or field visible from the call site. */
  Optional<String> declaredTypeOf(String variable) {
    for (IndexedSymbol symbol : ancestry) {
      if (symbol.kind() == SymbolKind.IMPL) {
        Optional<String> field =
            resolveType(symbol.implementedType())
                .map(type -> type.declaredTypes().get(variable));
        if (field.isPresent()) {
          return field;
        }
        continue;
      }
      String type = symbol.declaredTypes().get(variable);
      if (type != null) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /**
   * Type of a dotted receiver such as {@code repo} or {@code service.repo}: the first segment is a
   * declared variable, later segments are fields of the previous type.
   */
  Optional<IndexedSymbol> typeOfPath(String receiver) {
    String[] segments = receiver.split("\\.");
    Optional<IndexedSymbol> type = declaredTypeOf(segments[0]).flatMap(this::resolveType);
    for (int i = 1; i < segments.length && type.isPresent(); i++) {
      String field = type.get().declaredTypes().get(segments[i]);
      type = field != null ? resolveType(field) : Optional.empty();
    }
    return type;
  }

  Optional<IndexedSymbol> resolveType(String typeName) {
    if (typeName == null || typeName.isBlank()) {
      return Optional.empty();
    }
    String name = typeName.replace("::", ".").trim();
    if ("Self".equals(name)) {
      return enclosingType();
    }
    boolean dotted = name.indexOf('.') > 0;
    if (!dotted) {
      for (IndexedSymbol symbol : fileSymbols) {
        if (symbol.kind().isType() && symbol.name().equals(name)) {
          return Optional.of(symbol);
        }
      }
    }
    String first = dotted ? name.substring(0, name.indexOf('.')) : name;
    String rest = dotted ? name.substring(name.indexOf('.')) : "";
    for (ImportDirective directive : file.imports()) {
      if (!directive.wildcard() && directive.visibleName().equals(first)) {
        Optional<IndexedSymbol> imported = index.lookupType(directive.path() + rest);
        if (imported.isPresent()) {
          return imported;
        }
      }
    }
    Optional<IndexedSymbol> local = index.lookupType(qualify(packageName(), name));
    if (local.isPresent()) {
      return local;
    }
    for (ImportDirective directive : file.imports()) {
      if (directive.wildcard()) {
        Optional<IndexedSymbol> imported = index.lookupType(directive.path() + "." + name);
        if (imported.isPresent()) {
          return imported;
        }
      }
    }
    for (ImportDirective directive : file.imports()) {
      if (!directive.wildcard()) {
        Optional<IndexedSymbol> nested = index.lookupType(directive.path() + "." + name);
        if (nested.isPresent()) {
          return nested;
        }
      }
    }
    return dotted ? index.lookupType(name) : Optional.empty();
  }

  /** Members named {@code name} of a type, falling back to its supertypes. */
  List<IndexedSymbol> membersOf(IndexedSymbol type, String name) {
    return membersOf(type, name, new HashSet<>(), 0);
  }

  /** Members inherited from the supertypes of {@code type}, skipping the type itself. */
  List<IndexedSymbol> inheritedMembersOf(IndexedSymbol type, String name) {
    Set<String> visited = new HashSet<>();
    visited.add(type.qualifiedName());
    for (String superType : type.superTypes()) {
      Optional<IndexedSymbol> resolved = resolveType(superType);
      if (resolved.isPresent()) {
        List<IndexedSymbol> members = membersOf(resolved.get(), name, visited, 1);
        if (!members.isEmpty()) {
          return members;
        }
      }
    }
    return List.of();
  }

  private List<IndexedSymbol> membersOf(
      IndexedSymbol type, String name, Set<String> visited, int depth) {
    if (!visited.add(type.qualifiedName()) || depth > MAX_SUPERTYPE_DEPTH) {
      return List.of();
    }
    List<IndexedSymbol> members = index.members(type.qualifiedName(), name);
    if (!members.isEmpty()) {
      return members;
    }
    for (String superType : type.superTypes()) {
      Optional<IndexedSymbol> resolved = resolveType(superType);
      if (resolved.isPresent()) {
        List<IndexedSymbol> inherited = membersOf(resolved.get(), name, visited, depth + 1);
        if (!inherited.isEmpty()) {
          return inherited;
        }
      }
    }
    return List.of();
  }

  /** Members of whatever {@code path} names: a type (with supertypes), a module or a package. */
  List<IndexedSymbol> membersAt(String path, String name) {
    Optional<IndexedSymbol> type = index.lookupType(path);
    if (type.isPresent()) {
      return membersOf(type.get(), name);
    }
    return index.members(path, name);
  }

  static String qualify(String prefix, String name) {
    return prefix == null || prefix.isEmpty() ? name : prefix + "." + name;
  }
}
