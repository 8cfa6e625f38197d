package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.graph.domain.ReferenceType;
import com.aiadvent.codegraph.parser.model.CallKind;
import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.ImportDirective;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Phase two of indexing. Allocates final qualified names for every parsed symbol, builds the
 * repository-wide index (parsed symbols plus those retained from unchanged files) and binds every
 * call site through the strategy chain: local scope, imports, same package. Whatever is left is an
 * external edge, except for argument identifiers, which are dropped.
 */
@Component
public class SymbolResolver {

  private static final Logger log = LoggerFactory.getLogger(SymbolResolver.class);

  private final List<ResolutionStrategy> strategies;

  public SymbolResolver() {
    this(List.of(new LocalScopeStrategy(), new ImportStrategy(), new SamePackageStrategy()));
  }

  SymbolResolver(List<ResolutionStrategy> strategies) {
    this.strategies = List.copyOf(strategies);
  }

  public List<ResolvedFile> resolve(
      Collection<ParsedFile> parsedFiles, Collection<IndexedSymbol> retainedSymbols) {
    List<ParsedFile> ordered = new ArrayList<>(parsedFiles);
    ordered.sort(Comparator.comparing(ParsedFile::relativePath));

    QualifiedNameAllocator allocator =
        new QualifiedNameAllocator(
            retainedSymbols.stream().map(IndexedSymbol::qualifiedName).toList());
    List<IndexedSymbol> all = new ArrayList<>(retainedSymbols);
    List<List<IndexedSymbol>> perFile = new ArrayList<>(ordered.size());
    for (ParsedFile file : ordered) {
      List<IndexedSymbol> symbols = materialize(file, allocator);
      perFile.add(symbols);
      all.addAll(symbols);
    }
    SymbolIndex index = new SymbolIndex(all);

    List<ResolvedFile> resolved = new ArrayList<>(ordered.size());
    int edges = 0;
    for (int i = 0; i < ordered.size(); i++) {
      ParsedFile file = ordered.get(i);
      List<IndexedSymbol> symbols = perFile.get(i);
      List<ResolvedReference> references =
          file.isFailed() ? List.of() : bindFile(file, symbols, index);
      edges += references.size();
      resolved.add(new ResolvedFile(file, symbols, references));
    }
    log.debug(
        "Resolved call graph (files={}, indexedSymbols={}, edges={})",
        ordered.size(),
        index.size(),
        edges);
    return resolved;
  }

  private List<IndexedSymbol> materialize(ParsedFile file, QualifiedNameAllocator allocator) {
    List<SymbolDescriptor> descriptors = file.symbols();
    if (descriptors.isEmpty()) {
      return List.of();
    }
    String[] names = allocator.allocate(descriptors);
    List<IndexedSymbol> symbols = new ArrayList<>(descriptors.size());
    for (int i = 0; i < descriptors.size(); i++) {
      SymbolDescriptor descriptor = descriptors.get(i);
      String parent =
          descriptor.hasParent() && descriptor.parentIndex() < names.length
              ? names[descriptor.parentIndex()]
              : null;
      symbols.add(
          new IndexedSymbol(
              names[i],
              descriptor.name(),
              descriptor.kind(),
              file.relativePath(),
              parent,
              descriptor.declaredTypes(),
              descriptor.superTypes()));
    }
    return symbols;
  }

  private List<ResolvedReference> bindFile(
      ParsedFile file, List<IndexedSymbol> symbols, SymbolIndex index) {
    List<ResolvedReference> references = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    bindImports(file, index, references, seen);
    for (CallSite site : file.callSites()) {
      if (site.ownerIndex() < 0 || site.ownerIndex() >= symbols.size()) {
        continue;
      }
      ReferenceType type =
          site.kind() == CallKind.ARGUMENT ? ReferenceType.USAGE : ReferenceType.CALL;
      List<IndexedSymbol> targets =
          site.chained()
              ? List.of()
              : bind(site, new ResolutionContext(file, symbols, index, site.ownerIndex()));
      if (targets.isEmpty()) {
        if (site.kind() != CallKind.ARGUMENT) {
          add(
              references,
              seen,
              ResolvedReference.external(site.ownerIndex(), type, site.name(), site.line()));
        }
        continue;
      }
      boolean ambiguous = targets.size() > 1;
      for (IndexedSymbol target : targets) {
        add(
            references,
            seen,
            ResolvedReference.internal(
                site.ownerIndex(), type, site.name(), target, ambiguous, site.line()));
      }
    }
    return references;
  }

  private List<IndexedSymbol> bind(CallSite site, ResolutionContext context) {
    for (ResolutionStrategy strategy : strategies) {
      List<IndexedSymbol> targets = strategy.resolve(site, context);
      if (!targets.isEmpty()) {
        return List.copyOf(new LinkedHashSet<>(targets));
      }
    }
    return List.of();
  }

  private void bindImports(
      ParsedFile file, SymbolIndex index, List<ResolvedReference> references, Set<String> seen) {
    List<Integer> owners = importOwners(file);
    if (owners.isEmpty()) {
      return;
    }
    for (ImportDirective directive : file.imports()) {
      List<IndexedSymbol> targets =
          directive.wildcard() ? List.of() : List.copyOf(index.lookup(directive.path()));
      String targetName = directive.wildcard() ? directive.path() + ".*" : directive.path();
      for (int owner : owners) {
        if (targets.isEmpty()) {
          add(
              references,
              seen,
              ResolvedReference.external(
                  owner, ReferenceType.IMPORT, targetName, directive.line()));
          continue;
        }
        for (IndexedSymbol target : targets) {
          add(
              references,
              seen,
              ResolvedReference.internal(
                  owner,
                  ReferenceType.IMPORT,
                  targetName,
                  target,
                  targets.size() > 1,
                  directive.line()));
        }
      }
    }
  }

  /** Imports attach to the module symbol, except in Java where each top-level type owns them. */
  private List<Integer> importOwners(ParsedFile file) {
    List<Integer> owners = new ArrayList<>();
    List<SymbolDescriptor> descriptors = file.symbols();
    for (int i = 0; i < descriptors.size(); i++) {
      SymbolDescriptor descriptor = descriptors.get(i);
      if (descriptor.hasParent()) {
        continue;
      }
      if (file.language() == Language.JAVA
          ? descriptor.kind().isType()
          : descriptor.kind() == SymbolKind.MODULE) {
        owners.add(i);
      }
    }
    return owners;
  }

  private void add(
      List<ResolvedReference> references, Set<String> seen, ResolvedReference reference) {
    String target =
        reference.external()
            ? "external:" + reference.targetName()
            : reference.targetQualifiedName();
    String key =
        reference.sourceIndex() + "|" + reference.type() + "|" + target + "|" + reference.line();
    if (seen.add(key)) {
      references.add(reference);
    }
  }
}
