package com.aiadvent.codegraph.query;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.entrypoint.DetectionSummary;
import com.aiadvent.codegraph.entrypoint.EntryPointService;
import com.aiadvent.codegraph.entrypoint.domain.EntryPoint;
import com.aiadvent.codegraph.entrypoint.domain.EntryPointCandidate;
import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.flow.FlowService;
import com.aiadvent.codegraph.flow.domain.EntryPointFlow;
import com.aiadvent.codegraph.graph.GraphQueryResult;
import com.aiadvent.codegraph.graph.GraphQueryService;
import com.aiadvent.codegraph.graph.SymbolLookupService;
import com.aiadvent.codegraph.graph.SymbolLookupService.LookupResult;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.index.domain.FileParseStatus;
import com.aiadvent.codegraph.index.domain.SourceFile;
import com.aiadvent.codegraph.index.persistence.SourceFileRepository;
import com.aiadvent.codegraph.job.JobQueuePort;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import com.aiadvent.codegraph.repo.RepositoryRegistrationService;
import com.aiadvent.codegraph.repo.RepositoryRegistrationService.Registration;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.persistence.CodeRepositoryRepository;
import java.util.List;
import java.util.UUID;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Single entry into the indexer for callers embedding it: registration, graph queries, entry
 * points and flows. Not-found conditions raise {@link CodeGraphNotFoundException}; malformed
 * arguments raise {@link IllegalArgumentException}.
 */
@Service
public class CodeGraphQueryService {

  private final RepositoryRegistrationService registrationService;
  private final CodeRepositoryRepository repositoryRepository;
  private final SourceFileRepository sourceFileRepository;
  private final JobQueuePort jobQueue;
  private final GraphQueryService graphQueryService;
  private final SymbolLookupService symbolLookupService;
  private final EntryPointService entryPointService;
  private final FlowService flowService;

  public CodeGraphQueryService(
      RepositoryRegistrationService registrationService,
      CodeRepositoryRepository repositoryRepository,
      SourceFileRepository sourceFileRepository,
      JobQueuePort jobQueue,
      GraphQueryService graphQueryService,
      SymbolLookupService symbolLookupService,
      EntryPointService entryPointService,
      FlowService flowService) {
    this.registrationService = registrationService;
    this.repositoryRepository = repositoryRepository;
    this.sourceFileRepository = sourceFileRepository;
    this.jobQueue = jobQueue;
    this.graphQueryService = graphQueryService;
    this.symbolLookupService = symbolLookupService;
    this.entryPointService = entryPointService;
    this.flowService = flowService;
  }

  public Registration registerRepository(String name, String rootPath) {
    return registrationService.register(name, rootPath);
  }

  public IndexJob requestReparse(UUID repositoryId) {
    return registrationService.requestReparse(requireId(repositoryId));
  }

  public CodeRepository getRepository(UUID repositoryId) {
    return repositoryRepository
        .findById(requireId(repositoryId))
        .orElseThrow(() -> CodeGraphNotFoundException.of("Repository", repositoryId));
  }

  public List<SourceFile> listFiles(UUID repositoryId, boolean failedOnly) {
    getRepository(repositoryId);
    if (failedOnly) {
      return sourceFileRepository
          .findByRepositoryIdAndDeletedFalseAndParseStatusOrderByRelativePathAsc(
              repositoryId, FileParseStatus.FAILED);
    }
    return sourceFileRepository.findByRepositoryIdAndDeletedFalseOrderByRelativePathAsc(
        repositoryId);
  }

  public IndexJob getJob(Long jobId) {
    if (jobId == null) {
      throw new IllegalArgumentException("Job id must not be null");
    }
    return jobQueue.find(jobId).orElseThrow(() -> CodeGraphNotFoundException.of("Job", jobId));
  }

  public List<CodeSymbol> listSymbols(
      UUID repositoryId, @Nullable SymbolKind kind, int limit, int offset) {
    getRepository(repositoryId);
    return graphQueryService.listSymbols(repositoryId, kind, limit, offset);
  }

  public List<CodeSymbol> searchSymbols(UUID repositoryId, String query, int limit) {
    getRepository(repositoryId);
    return graphQueryService.searchSymbols(repositoryId, query, limit);
  }

  public CodeSymbol getSymbol(UUID repositoryId, Long symbolId) {
    return graphQueryService.getSymbol(requireId(repositoryId), symbolId);
  }

  public GraphQueryResult upstream(UUID repositoryId, Long symbolId, @Nullable Integer maxDepth) {
    return graphQueryService.upstream(requireId(repositoryId), symbolId, maxDepth);
  }

  public GraphQueryResult downstream(
      UUID repositoryId, Long symbolId, @Nullable Integer maxDepth) {
    return graphQueryService.downstream(requireId(repositoryId), symbolId, maxDepth);
  }

  public LookupResult lookupByQualifiedPath(
      UUID repositoryId, String pathPrefix, String name, @Nullable Integer depth) {
    getRepository(repositoryId);
    return symbolLookupService.lookupByQualifiedPath(repositoryId, pathPrefix, name, depth);
  }

  public DetectionSummary detectEntryPoints(UUID repositoryId, boolean force) {
    return entryPointService.detect(requireId(repositoryId), force);
  }

  public IndexJob scheduleEntryPointDetection(UUID repositoryId, boolean force) {
    return entryPointService.scheduleDetection(requireId(repositoryId), force);
  }

  public List<EntryPointCandidate> listEntryPointCandidates(UUID repositoryId) {
    return entryPointService.listCandidates(requireId(repositoryId));
  }

  public List<EntryPoint> listEntryPoints(
      UUID repositoryId, @Nullable EntryPointType type, @Nullable String framework) {
    return entryPointService.listEntryPoints(requireId(repositoryId), type, framework);
  }

  public IndexJob generateFlow(UUID repositoryId, Long entryPointId) {
    return flowService.generateFlow(requireId(repositoryId), entryPointId);
  }

  public EntryPointFlow getFlow(UUID repositoryId, Long entryPointId) {
    return flowService.getFlow(requireId(repositoryId), entryPointId);
  }

  private static UUID requireId(UUID repositoryId) {
    if (repositoryId == null) {
      throw new IllegalArgumentException("Repository id must not be null");
    }
    return repositoryId;
  }
}
