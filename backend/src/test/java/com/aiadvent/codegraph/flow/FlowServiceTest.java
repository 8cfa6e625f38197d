package com.aiadvent.codegraph.flow;

import static com.aiadvent.codegraph.support.TestSymbols.REPOSITORY_ID;
import static com.aiadvent.codegraph.support.TestSymbols.symbol;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.enrichment.EnrichmentCallExecutor;
import com.aiadvent.codegraph.enrichment.HeuristicFlowNarrator;
import com.aiadvent.codegraph.entrypoint.EntryPointService;
import com.aiadvent.codegraph.entrypoint.domain.EntryPoint;
import com.aiadvent.codegraph.entrypoint.domain.EntryPointCandidate;
import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import com.aiadvent.codegraph.flow.domain.EntryPointFlow;
import com.aiadvent.codegraph.flow.domain.FlowStep;
import com.aiadvent.codegraph.flow.persistence.EntryPointFlowRepository;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.job.JobQueuePort;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class FlowServiceTest {

  private static final String CONTROLLER = "src/main/java/shop/OrderController.java";
  private static final String SERVICE = "src/main/java/shop/OrderService.java";
  private static final String STORE = "src/main/java/shop/OrderStore.java";

  @Mock private EntryPointService entryPointService;
  @Mock private CodeSymbolRepository symbolRepository;
  @Mock private EntryPointFlowRepository flowRepository;
  @Mock private FlowTraversalEngine traversalEngine;
  @Mock private EnrichmentCallExecutor enrichmentCallExecutor;
  @Mock private FlowStore flowStore;
  @Mock private JobQueuePort jobQueue;

  private EntryPoint entryPoint;
  private CodeSymbol handler;

  @BeforeEach
  void setUp() {
    EntryPointCandidate candidate =
        new EntryPointCandidate(
            REPOSITORY_ID,
            1L,
            10L,
            UUID.randomUUID(),
            EntryPointType.HTTP,
            "spring-boot",
            "spring_request_mapping",
            Map.of("path", "/orders", "method", "POST"),
            0.95d);
    entryPoint = new EntryPoint(candidate, "POST /orders", "creates orders");
    ReflectionTestUtils.setField(entryPoint, "id", 7L);
    handler = symbol(1, CONTROLLER, SymbolKind.METHOD, "shop.OrderController.create");
  }

  @Test
  void buildFlowNarratesEveryIterationAndAttachesSnippets() {
    when(entryPointService.getEntryPoint(REPOSITORY_ID, 7L)).thenReturn(entryPoint);
    when(symbolRepository.findByIdAndRepositoryId(1L, REPOSITORY_ID))
        .thenReturn(Optional.of(handler));
    when(traversalEngine.traverse(handler)).thenReturn(traversal());
    givenEnrichmentRunsInline();
    when(flowStore.replace(any(EntryPointFlow.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    EntryPointFlow flow = service(new HeuristicFlowNarrator()).buildFlow(REPOSITORY_ID, 7L);

    assertThat(flow.getEntryPointId()).isEqualTo(7L);
    assertThat(flow.getFlowName()).isEqualTo("POST /orders");
    assertThat(flow.getTechnicalSummary())
        .isEqualTo(
            "spring-boot HTTP entry point shop.OrderController.create reaches 3 symbols"
                + " across 3 files");
    assertThat(flow.getIterationsCompleted()).isEqualTo(2);
    assertThat(flow.getMaxDepthAnalyzed()).isEqualTo(2);
    assertThat(flow.getSymbolIdsAnalyzed()).containsExactly(1L, 2L, 3L);

    List<FlowStep> steps = flow.getSteps();
    assertThat(steps).extracting(FlowStep::stepNumber).containsExactly(1, 2, 3);
    assertThat(steps)
        .extracting(FlowStep::title)
        .containsExactly("Enter POST /orders", "Depth 1: place", "Depth 2: save");
    assertThat(steps.get(0).logLines()).containsExactly("21: log.info(\"create\");");
    assertThat(steps.get(0).snippets()).hasSize(1);
    assertThat(steps.get(0).snippets().get(0).code()).contains("log.info");
    assertThat(steps.get(2).filePath()).isEqualTo(STORE);
    assertThat(steps.get(2).snippets().get(0).qualifiedName()).isEqualTo("shop.OrderStore.save");
  }

  @Test
  void buildFlowFailsWhenNarrationIsEmpty() {
    when(entryPointService.getEntryPoint(REPOSITORY_ID, 7L)).thenReturn(entryPoint);
    when(symbolRepository.findByIdAndRepositoryId(1L, REPOSITORY_ID))
        .thenReturn(Optional.of(handler));
    when(traversalEngine.traverse(handler)).thenReturn(traversal());
    givenEnrichmentRunsInline();
    FlowNarrator silent = request -> new FlowNarration("empty", "nothing", List.of());

    assertThatThrownBy(() -> service(silent).buildFlow(REPOSITORY_ID, 7L))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("no steps");
    verify(flowStore, never()).replace(any());
  }

  @Test
  void buildFlowFailsWhenEntryPointSymbolIsGone() {
    when(entryPointService.getEntryPoint(REPOSITORY_ID, 7L)).thenReturn(entryPoint);
    when(symbolRepository.findByIdAndRepositoryId(1L, REPOSITORY_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service(new HeuristicFlowNarrator()).buildFlow(REPOSITORY_ID, 7L))
        .isInstanceOf(CodeGraphNotFoundException.class)
        .hasMessageContaining("Symbol");
  }

  @Test
  void generateFlowQueuesJobForEntryPoint() {
    when(entryPointService.getEntryPoint(REPOSITORY_ID, 7L)).thenReturn(entryPoint);

    service(new HeuristicFlowNarrator()).generateFlow(REPOSITORY_ID, 7L);

    ArgumentCaptor<JsonNode> payload = ArgumentCaptor.forClass(JsonNode.class);
    verify(jobQueue).enqueue(eq(REPOSITORY_ID), eq(JobType.GENERATE_FLOW), payload.capture());
    assertThat(payload.getValue().get("entryPointId").asLong()).isEqualTo(7L);
  }

  @Test
  void getFlowReportsMissingFlow() {
    when(flowRepository.findByRepositoryIdAndEntryPointId(REPOSITORY_ID, 7L))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service(new HeuristicFlowNarrator()).getFlow(REPOSITORY_ID, 7L))
        .isInstanceOf(CodeGraphNotFoundException.class)
        .hasMessageContaining("Flow for entry point");
  }

  private FlowService service(FlowNarrator narrator) {
    return new FlowService(
        entryPointService,
        symbolRepository,
        flowRepository,
        traversalEngine,
        narrator,
        enrichmentCallExecutor,
        flowStore,
        jobQueue,
        new ObjectMapper());
  }

  private void givenEnrichmentRunsInline() {
    when(enrichmentCallExecutor.call(eq("flow-narration"), any()))
        .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());
  }

  private static FlowTraversal traversal() {
    FlowEvidence root =
        new FlowEvidence(
            0,
            1L,
            "create",
            "shop.OrderController.create",
            SymbolKind.METHOD,
            CONTROLLER,
            20,
            23,
            null,
            "Order create() {\n  log.info(\"create\");\n}",
            List.of("21: log.info(\"create\");"));
    FlowEvidence place =
        new FlowEvidence(
            1, 2L, "place", "shop.OrderService.place", SymbolKind.METHOD, SERVICE, 5, 9, "CALL",
            "void place() {}", List.of());
    FlowEvidence save =
        new FlowEvidence(
            2, 3L, "save", "shop.OrderStore.save", SymbolKind.METHOD, STORE, 3, 4, "CALL",
            "void save() {}", List.of());
    return new FlowTraversal(
        List.of(List.of(root, place), List.of(save)),
        2,
        List.of(1L, 2L, 3L),
        List.of(CONTROLLER, SERVICE, STORE));
  }
}
