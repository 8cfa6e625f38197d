package com.aiadvent.codegraph.entrypoint;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.enrichment.EnrichmentCallExecutor;
import com.aiadvent.codegraph.entrypoint.domain.EntryPoint;
import com.aiadvent.codegraph.entrypoint.domain.EntryPointCandidate;
import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.entrypoint.persistence.EntryPointCandidateRepository;
import com.aiadvent.codegraph.entrypoint.persistence.EntryPointRepository;
import com.aiadvent.codegraph.entrypoint.rules.SymbolFacts;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.job.JobQueuePort;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import com.aiadvent.codegraph.repo.persistence.CodeRepositoryRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Detects entry-point candidates with the rule library, confirms them in batches and keeps the
 * confirmed set as the repository's entry points.
 */
@Service
public class EntryPointService {

  private static final Logger log = LoggerFactory.getLogger(EntryPointService.class);
  private static final String CONFIRM_OPERATION = "entry-point-confirmation";

  private final CodeRepositoryRepository repositoryRepository;
  private final SymbolFactsLoader factsLoader;
  private final EntryPointDetector detector;
  private final EntryPointCandidateRepository candidateRepository;
  private final EntryPointRepository entryPointRepository;
  private final EntryPointStore entryPointStore;
  private final EntryPointConfirmer confirmer;
  private final EnrichmentCallExecutor enrichmentCallExecutor;
  private final JobQueuePort jobQueue;
  private final ObjectMapper objectMapper;
  private final CodeGraphProperties properties;
  private final Counter candidatesCounter;
  private final Counter confirmedCounter;

  public EntryPointService(
      CodeRepositoryRepository repositoryRepository,
      SymbolFactsLoader factsLoader,
      EntryPointDetector detector,
      EntryPointCandidateRepository candidateRepository,
      EntryPointRepository entryPointRepository,
      EntryPointStore entryPointStore,
      EntryPointConfirmer confirmer,
      EnrichmentCallExecutor enrichmentCallExecutor,
      JobQueuePort jobQueue,
      ObjectMapper objectMapper,
      CodeGraphProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    this.repositoryRepository = repositoryRepository;
    this.factsLoader = factsLoader;
    this.detector = detector;
    this.candidateRepository = candidateRepository;
    this.entryPointRepository = entryPointRepository;
    this.entryPointStore = entryPointStore;
    this.confirmer = confirmer;
    this.enrichmentCallExecutor = enrichmentCallExecutor;
    this.jobQueue = jobQueue;
    this.objectMapper = objectMapper;
    this.properties = properties;
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.candidatesCounter = registry.counter("code_graph_entry_point_candidates_total");
    this.confirmedCounter = registry.counter("code_graph_entry_points_confirmed_total");
  }

  /**
   * Runs detection synchronously. Without {@code force} an existing entry-point set is returned
   * as is; with it, the previous entry points and their flows are replaced.
   */
  public DetectionSummary detect(UUID repositoryId, boolean force) {
    CodeRepository repository = requireRepository(repositoryId);
    if (repository.getStatus() != RepositoryStatus.COMPLETED) {
      log.warn(
          "Detecting entry points on a repository that is not fully indexed (repositoryId={},"
              + " status={})",
          repositoryId,
          repository.getStatus());
    }
    if (!force && entryPointRepository.existsByRepositoryId(repositoryId)) {
      return summarizeExisting(repositoryId);
    }

    List<SymbolFacts> facts = factsLoader.load(repositoryId);
    List<DetectedCandidate> detected = detector.detect(facts);
    UUID runId = UUID.randomUUID();
    Map<Long, CodeSymbol> symbolsById = new HashMap<>();
    List<EntryPointCandidate> candidates = new ArrayList<>(detected.size());
    for (DetectedCandidate candidate : detected) {
      CodeSymbol symbol = candidate.facts().symbol();
      symbolsById.put(symbol.getId(), symbol);
      candidates.add(
          new EntryPointCandidate(
              repositoryId,
              symbol.getId(),
              symbol.getFileId(),
              runId,
              candidate.match().type(),
              candidate.match().framework(),
              candidate.match().pattern(),
              candidate.match().metadata(),
              candidate.match().confidence()));
    }
    List<EntryPointCandidate> saved = candidateRepository.saveAll(candidates);
    candidatesCounter.increment(saved.size());
    log.info(
        "Entry-point candidates detected (repositoryId={}, runId={}, symbols={}, candidates={})",
        repositoryId,
        runId,
        facts.size(),
        saved.size());

    List<EntryPoint> confirmed = confirm(saved, symbolsById);
    List<EntryPoint> stored = entryPointStore.replace(repositoryId, confirmed);
    confirmedCounter.increment(stored.size());

    List<String> frameworks =
        new ArrayList<>(
            saved.stream()
                .map(EntryPointCandidate::getFramework)
                .collect(Collectors.toCollection(TreeSet::new)));
    DetectionSummary summary =
        new DetectionSummary(
            repositoryId,
            runId,
            saved.size(),
            stored.size(),
            frameworks,
            countBy(stored, entryPoint -> entryPoint.getType().name()),
            countBy(stored, EntryPoint::getFramework),
            false);
    log.info(
        "Entry points confirmed (repositoryId={}, runId={}, confirmed={}, frameworks={})",
        repositoryId,
        runId,
        stored.size(),
        frameworks);
    return summary;
  }

  @Transactional
  public IndexJob scheduleDetection(UUID repositoryId, boolean force) {
    requireRepository(repositoryId);
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("force", force);
    return jobQueue.enqueueUnique(repositoryId, JobType.DETECT_ENTRY_POINTS, payload);
  }

  /** Candidates of the most recent detection run, confirmed or not. */
  @Transactional(readOnly = true)
  public List<EntryPointCandidate> listCandidates(UUID repositoryId) {
    requireRepository(repositoryId);
    return candidateRepository
        .findFirstByRepositoryIdOrderByIdDesc(repositoryId)
        .map(
            latest ->
                candidateRepository.findByRepositoryIdAndDetectionRunIdOrderByIdAsc(
                    repositoryId, latest.getDetectionRunId()))
        .orElse(List.of());
  }

  @Transactional(readOnly = true)
  public List<EntryPoint> listEntryPoints(
      UUID repositoryId, @Nullable EntryPointType type, @Nullable String framework) {
    requireRepository(repositoryId);
    return entryPointRepository.findByRepositoryIdOrderByIdAsc(repositoryId).stream()
        .filter(entryPoint -> type == null || entryPoint.getType() == type)
        .filter(
            entryPoint ->
                !StringUtils.hasText(framework)
                    || entryPoint.getFramework().equalsIgnoreCase(framework.trim()))
        .toList();
  }

  @Transactional(readOnly = true)
  public EntryPoint getEntryPoint(UUID repositoryId, Long entryPointId) {
    if (entryPointId == null) {
      throw new IllegalArgumentException("Entry point id must not be null");
    }
    return entryPointRepository
        .findByIdAndRepositoryId(entryPointId, repositoryId)
        .orElseThrow(() -> CodeGraphNotFoundException.of("Entry point", entryPointId));
  }

  private List<EntryPoint> confirm(
      List<EntryPointCandidate> candidates, Map<Long, CodeSymbol> symbolsById) {
    int batchSize = properties.getEntryPoints().getConfirmationBatchSize();
    double minConfidence = properties.getEntryPoints().getMinConfidence();
    List<EntryPoint> confirmed = new ArrayList<>();
    for (int start = 0; start < candidates.size(); start += batchSize) {
      List<EntryPointCandidate> batch =
          candidates.subList(start, Math.min(start + batchSize, candidates.size()));
      List<CandidateContext> contexts =
          batch.stream().map(candidate -> toContext(candidate, symbolsById)).toList();
      List<ConfirmationVerdict> verdicts =
          enrichmentCallExecutor.call(CONFIRM_OPERATION, () -> confirmer.confirm(contexts));
      Map<Long, ConfirmationVerdict> byCandidate = new HashMap<>();
      if (verdicts != null) {
        verdicts.forEach(verdict -> byCandidate.putIfAbsent(verdict.candidateId(), verdict));
      }
      for (EntryPointCandidate candidate : batch) {
        ConfirmationVerdict verdict = byCandidate.get(candidate.getId());
        if (verdict == null || !verdict.confirmed() || verdict.confidence() < minConfidence) {
          continue;
        }
        String name = nameOf(verdict, candidate, symbolsById);
        EntryPoint entryPoint = new EntryPoint(candidate, name, verdict.description());
        entryPoint.setConfidence(verdict.confidence());
        entryPoint.setReasoning(verdict.reasoning());
        confirmed.add(entryPoint);
      }
    }
    return confirmed;
  }

  private static String nameOf(
      ConfirmationVerdict verdict,
      EntryPointCandidate candidate,
      Map<Long, CodeSymbol> symbolsById) {
    if (StringUtils.hasText(verdict.name())) {
      return verdict.name();
    }
    CodeSymbol symbol = symbolsById.get(candidate.getSymbolId());
    return symbol != null ? symbol.getQualifiedName() : candidate.getDetectionPattern();
  }

  private static CandidateContext toContext(
      EntryPointCandidate candidate, Map<Long, CodeSymbol> symbolsById) {
    CodeSymbol symbol = symbolsById.get(candidate.getSymbolId());
    return new CandidateContext(
        candidate.getId(),
        candidate.getType(),
        candidate.getFramework(),
        candidate.getDetectionPattern(),
        candidate.getMetadata(),
        candidate.getConfidence(),
        symbol.getName(),
        symbol.getQualifiedName(),
        symbol.getKind(),
        symbol.getFilePath(),
        symbol.getSignature(),
        symbol.getSourceText());
  }

  private DetectionSummary summarizeExisting(UUID repositoryId) {
    List<EntryPoint> existing = entryPointRepository.findByRepositoryIdOrderByIdAsc(repositoryId);
    UUID runId = existing.isEmpty() ? null : existing.get(0).getDetectionRunId();
    int candidates =
        runId == null
            ? 0
            : candidateRepository
                .findByRepositoryIdAndDetectionRunIdOrderByIdAsc(repositoryId, runId)
                .size();
    List<String> frameworks =
        new ArrayList<>(
            existing.stream()
                .map(EntryPoint::getFramework)
                .collect(Collectors.toCollection(TreeSet::new)));
    log.info(
        "Entry points already present, detection skipped (repositoryId={}, entryPoints={})",
        repositoryId,
        existing.size());
    return new DetectionSummary(
        repositoryId,
        runId,
        candidates,
        existing.size(),
        frameworks,
        countBy(existing, entryPoint -> entryPoint.getType().name()),
        countBy(existing, EntryPoint::getFramework),
        true);
  }

  private static Map<String, Integer> countBy(
      List<EntryPoint> entryPoints, Function<EntryPoint, String> key) {
    Map<String, Integer> counts = new TreeMap<>();
    entryPoints.forEach(entryPoint -> counts.merge(key.apply(entryPoint), 1, Integer::sum));
    return counts;
  }

  private CodeRepository requireRepository(UUID repositoryId) {
    if (repositoryId == null) {
      throw new IllegalArgumentException("Repository id must not be null");
    }
    return repositoryRepository
        .findById(repositoryId)
        .orElseThrow(() -> CodeGraphNotFoundException.of("Repository", repositoryId));
  }
}
