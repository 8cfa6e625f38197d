package com.aiadvent.codegraph.graph;

import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.domain.SymbolMetadata;
import com.aiadvent.codegraph.graph.domain.SymbolReference;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.graph.persistence.SymbolReferenceRepository;
import com.aiadvent.codegraph.index.domain.SourceFile;
import com.aiadvent.codegraph.index.persistence.SourceFileRepository;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.resolve.IndexedSymbol;
import com.aiadvent.codegraph.resolve.ResolvedFile;
import com.aiadvent.codegraph.resolve.ResolvedReference;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists one file's slice of the graph. Each public method is a single transaction, so the
 * content hash of a file is never committed without the symbols and edges derived from it.
 */
@Component
public class GraphWriter {

  private static final Logger log = LoggerFactory.getLogger(GraphWriter.class);

  private final SourceFileRepository sourceFileRepository;
  private final CodeSymbolRepository symbolRepository;
  private final SymbolReferenceRepository referenceRepository;
  private final Counter symbolsWrittenCounter;
  private final Counter edgesWrittenCounter;

  public GraphWriter(
      SourceFileRepository sourceFileRepository,
      CodeSymbolRepository symbolRepository,
      SymbolReferenceRepository referenceRepository,
      @Nullable MeterRegistry meterRegistry) {
    this.sourceFileRepository = sourceFileRepository;
    this.symbolRepository = symbolRepository;
    this.referenceRepository = referenceRepository;
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.symbolsWrittenCounter = registry.counter("code_graph_symbols_written_total");
    this.edgesWrittenCounter = registry.counter("code_graph_edges_written_total");
  }

  /**
   * Drops a file's symbols and edges and clears its hash so that an interrupted run reparses it.
   * Deleted files are soft-removed at the same time.
   */
  @Transactional
  public void releaseFile(SourceFile file, boolean deleted) {
    if (file.getId() == null) {
      return;
    }
    int edges = referenceRepository.deleteBySourceFileId(file.getId());
    int symbols = symbolRepository.deleteByFileId(file.getId());
    file.setContentHash(null);
    file.setDeleted(deleted);
    sourceFileRepository.save(file);
    log.debug(
        "Released file (file={}, deleted={}, symbols={}, edges={})",
        file.getRelativePath(),
        deleted,
        symbols,
        edges);
  }

  /** Writes the file row, then replaces its symbols and outgoing edges. */
  @Transactional
  public WriteSummary replaceFile(SourceFile file, ResolvedFile resolved) {
    SourceFile saved = sourceFileRepository.saveAndFlush(file);
    referenceRepository.deleteBySourceFileId(saved.getId());
    symbolRepository.deleteByFileId(saved.getId());
    if (resolved == null || resolved.symbols().isEmpty()) {
      return new WriteSummary(saved.getId(), 0, 0);
    }

    List<SymbolDescriptor> descriptors = resolved.parsedFile().symbols();
    List<CodeSymbol> symbols = new ArrayList<>(descriptors.size());
    for (int i = 0; i < descriptors.size(); i++) {
      symbols.add(toEntity(saved, descriptors.get(i), resolved.symbols().get(i)));
    }
    List<CodeSymbol> persisted = symbolRepository.saveAll(symbols);

    List<SymbolReference> references = new ArrayList<>(resolved.references().size());
    for (ResolvedReference reference : resolved.references()) {
      references.add(toEntity(saved, persisted.get(reference.sourceIndex()), reference));
    }
    if (!references.isEmpty()) {
      referenceRepository.saveAll(references);
    }
    symbolsWrittenCounter.increment(persisted.size());
    edgesWrittenCounter.increment(references.size());
    log.debug(
        "Graph slice written (file={}, symbols={}, edges={})",
        saved.getRelativePath(),
        persisted.size(),
        references.size());
    return new WriteSummary(saved.getId(), persisted.size(), references.size());
  }

  private CodeSymbol toEntity(SourceFile file, SymbolDescriptor descriptor, IndexedSymbol named) {
    CodeSymbol symbol =
        new CodeSymbol(
            file.getRepositoryId(),
            file.getId(),
            file.getRelativePath(),
            descriptor.kind(),
            descriptor.name(),
            named.qualifiedName());
    symbol.setParentQualifiedName(named.parentQualifiedName());
    symbol.setSignature(descriptor.signature());
    symbol.setSourceText(descriptor.sourceText());
    symbol.setSpan(
        descriptor.startLine(),
        descriptor.startColumn(),
        descriptor.endLine(),
        descriptor.endColumn());
    symbol.setMetadata(SymbolMetadata.of(descriptor));
    return symbol;
  }

  private SymbolReference toEntity(
      SourceFile file, CodeSymbol source, ResolvedReference reference) {
    SymbolReference entity =
        new SymbolReference(
            file.getRepositoryId(),
            source.getId(),
            file.getId(),
            reference.type(),
            reference.targetName(),
            reference.line());
    if (reference.external()) {
      entity.setExternal(true);
    } else {
      entity.bindTarget(reference.targetQualifiedName(), reference.targetFilePath());
    }
    entity.setAmbiguous(reference.ambiguous());
    return entity;
  }

  public record WriteSummary(Long fileId, int symbols, int edges) {}
}
