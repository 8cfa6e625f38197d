package com.aiadvent.codegraph.flow;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.enrichment.EnrichmentCallExecutor;
import com.aiadvent.codegraph.entrypoint.EntryPointService;
import com.aiadvent.codegraph.entrypoint.domain.EntryPoint;
import com.aiadvent.codegraph.flow.domain.CodeSnippet;
import com.aiadvent.codegraph.flow.domain.EntryPointFlow;
import com.aiadvent.codegraph.flow.domain.FlowStep;
import com.aiadvent.codegraph.flow.persistence.EntryPointFlowRepository;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.job.JobQueuePort;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/** Builds, stores and serves the narrated execution flow of an entry point. */
@Service
public class FlowService {

  private static final Logger log = LoggerFactory.getLogger(FlowService.class);
  private static final String NARRATE_OPERATION = "flow-narration";

  private final EntryPointService entryPointService;
  private final CodeSymbolRepository symbolRepository;
  private final EntryPointFlowRepository flowRepository;
  private final FlowTraversalEngine traversalEngine;
  private final FlowNarrator narrator;
  private final EnrichmentCallExecutor enrichmentCallExecutor;
  private final FlowStore flowStore;
  private final JobQueuePort jobQueue;
  private final ObjectMapper objectMapper;

  public FlowService(
      EntryPointService entryPointService,
      CodeSymbolRepository symbolRepository,
      EntryPointFlowRepository flowRepository,
      FlowTraversalEngine traversalEngine,
      FlowNarrator narrator,
      EnrichmentCallExecutor enrichmentCallExecutor,
      FlowStore flowStore,
      JobQueuePort jobQueue,
      ObjectMapper objectMapper) {
    this.entryPointService = entryPointService;
    this.symbolRepository = symbolRepository;
    this.flowRepository = flowRepository;
    this.traversalEngine = traversalEngine;
    this.narrator = narrator;
    this.enrichmentCallExecutor = enrichmentCallExecutor;
    this.flowStore = flowStore;
    this.jobQueue = jobQueue;
    this.objectMapper = objectMapper;
  }

  /** Validates the entry point and queues flow generation for it. */
  @Transactional
  public IndexJob generateFlow(UUID repositoryId, Long entryPointId) {
    EntryPoint entryPoint = entryPointService.getEntryPoint(repositoryId, entryPointId);
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("entryPointId", entryPoint.getId());
    return jobQueue.enqueue(repositoryId, JobType.GENERATE_FLOW, payload);
  }

  public EntryPointFlow buildFlow(UUID repositoryId, Long entryPointId) {
    EntryPoint entryPoint = entryPointService.getEntryPoint(repositoryId, entryPointId);
    CodeSymbol root =
        symbolRepository
            .findByIdAndRepositoryId(entryPoint.getSymbolId(), repositoryId)
            .orElseThrow(() -> CodeGraphNotFoundException.of("Symbol", entryPoint.getSymbolId()));
    FlowTraversal traversal = traversalEngine.traverse(root);

    Map<String, FlowEvidence> evidenceByName = new LinkedHashMap<>();
    FlowNarration narration = null;
    List<NarratedStep> previousSteps = List.of();
    for (int i = 0; i < traversal.iterations().size(); i++) {
      List<FlowEvidence> evidence = traversal.iterations().get(i);
      evidence.forEach(item -> evidenceByName.putIfAbsent(item.qualifiedName(), item));
      FlowNarrationRequest request =
          new FlowNarrationRequest(
              entryPoint.getName(),
              entryPoint.getType(),
              entryPoint.getFramework(),
              root.getQualifiedName(),
              root.getFilePath(),
              i + 1,
              evidence,
              previousSteps);
      narration = enrichmentCallExecutor.call(NARRATE_OPERATION, () -> narrator.narrate(request));
      if (narration == null || narration.steps().isEmpty()) {
        throw new IllegalStateException(
            "Flow narration returned no steps for entry point " + entryPointId);
      }
      previousSteps = narration.steps();
    }
    if (narration == null) {
      throw new IllegalStateException("Flow traversal produced no evidence for " + entryPointId);
    }

    List<FlowStep> steps = new ArrayList<>(narration.steps().size());
    for (int i = 0; i < narration.steps().size(); i++) {
      steps.add(toStep(i + 1, narration.steps().get(i), evidenceByName));
    }
    EntryPointFlow flow =
        new EntryPointFlow(
            repositoryId,
            entryPoint.getId(),
            StringUtils.hasText(narration.flowName()) ? narration.flowName() : entryPoint.getName(),
            narration.technicalSummary(),
            steps,
            traversal.maxDepthAnalyzed(),
            traversal.iterationsCompleted(),
            traversal.symbolIds(),
            traversal.filePaths());
    EntryPointFlow saved = flowStore.replace(flow);
    log.info(
        "Flow generated (repositoryId={}, entryPointId={}, steps={}, symbols={}, iterations={})",
        repositoryId,
        entryPointId,
        steps.size(),
        traversal.symbolIds().size(),
        traversal.iterationsCompleted());
    return saved;
  }

  @Transactional(readOnly = true)
  public EntryPointFlow getFlow(UUID repositoryId, Long entryPointId) {
    if (entryPointId == null) {
      throw new IllegalArgumentException("Entry point id must not be null");
    }
    return flowRepository
        .findByRepositoryIdAndEntryPointId(repositoryId, entryPointId)
        .orElseThrow(() -> CodeGraphNotFoundException.of("Flow for entry point", entryPointId));
  }

  private static FlowStep toStep(
      int stepNumber, NarratedStep step, Map<String, FlowEvidence> evidenceByName) {
    List<CodeSnippet> snippets = new ArrayList<>();
    List<String> logLines = new ArrayList<>(step.logLines());
    for (String qualifiedName : step.qualifiedNames()) {
      FlowEvidence evidence = evidenceByName.get(qualifiedName);
      if (evidence == null) {
        continue;
      }
      snippets.add(
          new CodeSnippet(
              evidence.name(),
              evidence.qualifiedName(),
              evidence.filePath(),
              evidence.startLine(),
              evidence.endLine(),
              evidence.snippet()));
      if (step.logLines().isEmpty()) {
        logLines.addAll(evidence.logLines());
      }
    }
    String filePath = step.filePath();
    if (!StringUtils.hasText(filePath) && !snippets.isEmpty()) {
      filePath = snippets.get(0).filePath();
    }
    return new FlowStep(stepNumber, step.title(), step.description(), filePath, logLines, snippets);
  }
}
