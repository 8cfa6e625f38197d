package com.aiadvent.codegraph.entrypoint;

import com.aiadvent.codegraph.entrypoint.rules.SymbolFacts;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.domain.ReferenceType;
import com.aiadvent.codegraph.graph.domain.SymbolReference;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.graph.persistence.SymbolReferenceRepository;
import com.aiadvent.codegraph.index.domain.SourceFile;
import com.aiadvent.codegraph.index.persistence.SourceFileRepository;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Assembles per-symbol rule input from the stored graph of a repository. */
@Component
public class SymbolFactsLoader {

  private final SourceFileRepository sourceFileRepository;
  private final CodeSymbolRepository symbolRepository;
  private final SymbolReferenceRepository referenceRepository;

  public SymbolFactsLoader(
      SourceFileRepository sourceFileRepository,
      CodeSymbolRepository symbolRepository,
      SymbolReferenceRepository referenceRepository) {
    this.sourceFileRepository = sourceFileRepository;
    this.symbolRepository = symbolRepository;
    this.referenceRepository = referenceRepository;
  }

  @Transactional(readOnly = true)
  public List<SymbolFacts> load(UUID repositoryId) {
    Map<Long, Language> languages = new HashMap<>();
    for (SourceFile file :
        sourceFileRepository.findByRepositoryIdAndDeletedFalseOrderByRelativePathAsc(
            repositoryId)) {
      Language.fromId(file.getLanguage()).ifPresent(lang -> languages.put(file.getId(), lang));
    }

    List<CodeSymbol> symbols = symbolRepository.findByRepositoryId(repositoryId);
    Map<String, CodeSymbol> byQualifiedName =
        symbols.stream()
            .collect(
                Collectors.toMap(
                    CodeSymbol::getQualifiedName, Function.identity(), (left, right) -> left));

    Map<Long, Set<String>> callNames = new HashMap<>();
    for (SymbolReference call :
        referenceRepository.findByRepositoryIdAndReferenceType(repositoryId, ReferenceType.CALL)) {
      callNames
          .computeIfAbsent(call.getSourceSymbolId(), id -> new LinkedHashSet<>())
          .add(call.getTargetName());
    }
    Map<Long, Set<String>> importPaths = new HashMap<>();
    for (SymbolReference imported :
        referenceRepository.findByRepositoryIdAndReferenceType(
            repositoryId, ReferenceType.IMPORT)) {
      importPaths
          .computeIfAbsent(imported.getSourceFileId(), id -> new LinkedHashSet<>())
          .add(imported.getTargetName());
    }

    List<SymbolFacts> facts = new ArrayList<>(symbols.size());
    symbols.stream()
        .filter(symbol -> symbol.getKind() != SymbolKind.IMPORT)
        .filter(symbol -> languages.containsKey(symbol.getFileId()))
        .sorted(Comparator.comparing(CodeSymbol::getQualifiedName))
        .forEach(
            symbol ->
                facts.add(
                    new SymbolFacts(
                        symbol,
                        symbol.getParentQualifiedName() != null
                            ? byQualifiedName.get(symbol.getParentQualifiedName())
                            : null,
                        languages.get(symbol.getFileId()),
                        callNames.getOrDefault(symbol.getId(), Set.of()),
                        new ArrayList<>(
                            importPaths.getOrDefault(symbol.getFileId(), Set.of())))));
    return facts;
  }
}
