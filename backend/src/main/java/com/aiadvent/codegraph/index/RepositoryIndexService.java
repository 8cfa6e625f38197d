package com.aiadvent.codegraph.index;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.graph.GraphWriter;
import com.aiadvent.codegraph.graph.GraphWriter.WriteSummary;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.index.ChangeSet.ChangedFile;
import com.aiadvent.codegraph.index.domain.FileParseStatus;
import com.aiadvent.codegraph.index.domain.SourceFile;
import com.aiadvent.codegraph.index.persistence.SourceFileRepository;
import com.aiadvent.codegraph.parser.SourceParser;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.repo.RepositoryStatusCalculator;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import com.aiadvent.codegraph.repo.persistence.CodeRepositoryRepository;
import com.aiadvent.codegraph.resolve.IndexedSymbol;
import com.aiadvent.codegraph.resolve.ResolvedFile;
import com.aiadvent.codegraph.resolve.SymbolResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Two-phase incremental indexing of one repository.
 *
 * <p>Phase one parses every changed or new file. Phase two resolves their call sites against the
 * symbols of the whole repository: the freshly parsed ones plus those retained from unchanged
 * files. Edges that live in unchanged files are kept as stored; they bind by qualified name, so a
 * target that disappears simply becomes a dangling leaf until that file changes.
 */
@Service
public class RepositoryIndexService {

  private static final Logger log = LoggerFactory.getLogger(RepositoryIndexService.class);

  private final CodeRepositoryRepository repositoryRepository;
  private final SourceFileRepository sourceFileRepository;
  private final CodeSymbolRepository symbolRepository;
  private final FileDiscoveryService discoveryService;
  private final ChangeDetector changeDetector;
  private final SourceParser sourceParser;
  private final SymbolResolver symbolResolver;
  private final GraphWriter graphWriter;
  private final RepositoryStatusCalculator statusCalculator;
  private final CodeGraphProperties properties;
  private final Timer indexTimer;
  private final Counter failedFilesCounter;

  public RepositoryIndexService(
      CodeRepositoryRepository repositoryRepository,
      SourceFileRepository sourceFileRepository,
      CodeSymbolRepository symbolRepository,
      FileDiscoveryService discoveryService,
      ChangeDetector changeDetector,
      SourceParser sourceParser,
      SymbolResolver symbolResolver,
      GraphWriter graphWriter,
      RepositoryStatusCalculator statusCalculator,
      CodeGraphProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    this.repositoryRepository = repositoryRepository;
    this.sourceFileRepository = sourceFileRepository;
    this.symbolRepository = symbolRepository;
    this.discoveryService = discoveryService;
    this.changeDetector = changeDetector;
    this.sourceParser = sourceParser;
    this.symbolResolver = symbolResolver;
    this.graphWriter = graphWriter;
    this.statusCalculator = statusCalculator;
    this.properties = properties;
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.indexTimer = registry.timer("code_graph_index_duration");
    this.failedFilesCounter = registry.counter("code_graph_files_failed_total");
  }

  public IndexReport index(UUID repositoryId) {
    return indexTimer.record(() -> doIndex(repositoryId));
  }

  private IndexReport doIndex(UUID repositoryId) {
    CodeRepository repository =
        repositoryRepository
            .findById(repositoryId)
            .orElseThrow(() -> CodeGraphNotFoundException.of("Repository", repositoryId));
    List<DiscoveredFile> discovered = discoveryService.discover(Path.of(repository.getRootPath()));
    List<SourceFile> stored = sourceFileRepository.findByRepositoryId(repositoryId);
    ChangeSet changes = changeDetector.detect(stored, discovered);
    Set<String> languages = new TreeSet<>();
    discovered.forEach(file -> languages.add(file.language().id()));

    if (changes.isEmpty()) {
      int failed = (int) changes.unchanged().stream().filter(SourceFile::isFailed).count();
      statusCalculator.apply(repository, changes.unchanged().size(), failed, languages);
      repositoryRepository.save(repository);
      log.info(
          "Repository unchanged (repositoryId={}, files={}, failed={})",
          repositoryId,
          changes.unchanged().size(),
          failed);
      return report(repository, changes, 0, 0);
    }

    repository.setStatus(RepositoryStatus.PARSING);
    repositoryRepository.save(repository);
    log.info(
        "Indexing repository (repositoryId={}, unchanged={}, changed={}, added={}, deleted={})",
        repositoryId,
        changes.unchanged().size(),
        changes.changed().size(),
        changes.added().size(),
        changes.deleted().size());

    List<ChangedFile> work = new ArrayList<>(changes.changed());
    work.addAll(changes.added());
    work.sort(Comparator.comparing(changed -> changed.discovered().relativePath()));
    Map<String, ParsedFile> parsed = parseAll(repositoryId, work);

    List<ResolvedFile> resolved =
        symbolResolver.resolve(parsed.values(), retainedSymbols(repositoryId, changes.unchanged()));
    Map<String, ResolvedFile> resolvedByPath = new HashMap<>();
    resolved.forEach(file -> resolvedByPath.put(file.relativePath(), file));

    for (SourceFile deleted : changes.deleted()) {
      graphWriter.releaseFile(deleted, true);
    }
    // Changed files keep their old slice until replaceFile swaps it in one transaction.

    int symbolsWritten = 0;
    int edgesWritten = 0;
    int newlyFailed = 0;
    for (ChangedFile changed : work) {
      DiscoveredFile file = changed.discovered();
      ParsedFile parsedFile = parsed.get(file.relativePath());
      SourceFile entity =
          changed.stored() != null
              ? changed.stored()
              : new SourceFile(repositoryId, file.relativePath(), file.language().id());
      entity.setLanguage(file.language().id());
      entity.setContentHash(file.contentHash());
      entity.setContent(file.content());
      entity.setSizeBytes(file.sizeBytes());
      entity.setDeleted(false);
      if (parsedFile.isFailed()) {
        newlyFailed++;
        entity.setParseStatus(FileParseStatus.FAILED);
        entity.setParseError(parsedFile.error());
      } else {
        entity.setParseStatus(FileParseStatus.PARSED);
        entity.setParseError(null);
      }
      WriteSummary summary =
          graphWriter.replaceFile(entity, resolvedByPath.get(file.relativePath()));
      symbolsWritten += summary.symbols();
      edgesWritten += summary.edges();
    }
    failedFilesCounter.increment(newlyFailed);

    int total = changes.unchanged().size() + work.size();
    int failed =
        (int) changes.unchanged().stream().filter(SourceFile::isFailed).count() + newlyFailed;
    statusCalculator.apply(repository, total, failed, languages);
    repositoryRepository.save(repository);
    log.info(
        "Repository indexed (repositoryId={}, status={}, total={}, failed={}, symbols={},"
            + " edges={})",
        repositoryId,
        repository.getStatus(),
        total,
        failed,
        symbolsWritten,
        edgesWritten);
    return report(repository, changes, symbolsWritten, edgesWritten);
  }

  private Map<String, ParsedFile> parseAll(UUID repositoryId, List<ChangedFile> work) {
    Map<String, ParsedFile> parsed = new HashMap<>();
    int batchSize = properties.getParsing().getMaxFilesPerBatch();
    for (int from = 0; from < work.size(); from += batchSize) {
      List<ChangedFile> batch = work.subList(from, Math.min(work.size(), from + batchSize));
      int failures = 0;
      for (ChangedFile changed : batch) {
        DiscoveredFile file = changed.discovered();
        ParsedFile result =
            sourceParser.parse(file.relativePath(), file.language(), file.content());
        if (result.isFailed()) {
          failures++;
        }
        parsed.put(file.relativePath(), result);
      }
      log.debug(
          "Parsed batch (repositoryId={}, from={}, size={}, failed={})",
          repositoryId,
          from,
          batch.size(),
          failures);
    }
    return parsed;
  }

  private List<IndexedSymbol> retainedSymbols(UUID repositoryId, List<SourceFile> unchanged) {
    if (unchanged.isEmpty()) {
      return List.of();
    }
    Set<Long> unchangedIds = new HashSet<>();
    unchanged.forEach(file -> unchangedIds.add(file.getId()));
    return symbolRepository.findByRepositoryId(repositoryId).stream()
        .filter(symbol -> unchangedIds.contains(symbol.getFileId()))
        .map(RepositoryIndexService::toIndexed)
        .toList();
  }

  static IndexedSymbol toIndexed(CodeSymbol symbol) {
    return new IndexedSymbol(
        symbol.getQualifiedName(),
        symbol.getName(),
        symbol.getKind(),
        symbol.getFilePath(),
        symbol.getParentQualifiedName(),
        symbol.getMetadata().declaredTypes(),
        symbol.getMetadata().superTypes());
  }

  private IndexReport report(
      CodeRepository repository, ChangeSet changes, int symbolsWritten, int edgesWritten) {
    return new IndexReport(
        repository.getId(),
        repository.getStatus(),
        repository.getTotalFiles(),
        repository.getParsedFiles(),
        repository.getFailedFiles(),
        changes.unchanged().size(),
        changes.changed().size(),
        changes.added().size(),
        changes.deleted().size(),
        symbolsWritten,
        edgesWritten);
  }
}
