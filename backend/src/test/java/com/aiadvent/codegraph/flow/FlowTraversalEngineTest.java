package com.aiadvent.codegraph.flow;

import static com.aiadvent.codegraph.support.TestSymbols.REPOSITORY_ID;
import static com.aiadvent.codegraph.support.TestSymbols.symbol;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.domain.ReferenceType;
import com.aiadvent.codegraph.graph.domain.SymbolReference;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.graph.persistence.SymbolReferenceRepository;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FlowTraversalEngineTest {

  @Mock private CodeSymbolRepository symbolRepository;
  @Mock private SymbolReferenceRepository referenceRepository;

  private CodeGraphProperties properties;
  private FlowTraversalEngine engine;

  private CodeSymbol handler;
  private CodeSymbol service;
  private CodeSymbol repository;

  @BeforeEach
  void setUp() {
    properties = new CodeGraphProperties();
    properties.getFlow().setDepthPerIteration(1);
    engine =
        new FlowTraversalEngine(
            symbolRepository, referenceRepository, new LogLineScanner(), properties);

    handler =
        symbol(1, "src/main/java/shop/OrderController.java", SymbolKind.METHOD,
            "shop.OrderController.create");
    handler.setSpan(20, 3, 24, 3);
    handler.setSourceText(
        "public Order create(OrderRequest request) {\n"
            + "  log.info(\"Creating order {}\", request.id());\n"
            + "  return orderService.place(request);\n"
            + "}");
    service =
        symbol(2, "src/main/java/shop/OrderService.java", SymbolKind.METHOD,
            "shop.OrderService.place");
    repository =
        symbol(3, "src/main/java/shop/OrderStore.java", SymbolKind.METHOD,
            "shop.OrderStore.save");
  }

  @Test
  void walksOneLevelPerIterationUntilFrontierIsEmpty() {
    when(referenceRepository.findBySourceSymbolIdInOrderByIdAsc(List.of(1L)))
        .thenReturn(List.of(call(1L, "shop.OrderService.place"), importEdge(1L)));
    when(referenceRepository.findBySourceSymbolIdInOrderByIdAsc(List.of(2L)))
        .thenReturn(List.of(call(2L, "shop.OrderStore.save"), unresolved(2L, "println")));
    when(referenceRepository.findBySourceSymbolIdInOrderByIdAsc(List.of(3L)))
        .thenReturn(List.of(call(3L, "shop.OrderController.create")));
    when(symbolRepository.findByRepositoryIdAndQualifiedNameIn(
            eq(REPOSITORY_ID), eq(Set.of("shop.OrderService.place"))))
        .thenReturn(List.of(service));
    when(symbolRepository.findByRepositoryIdAndQualifiedNameIn(
            eq(REPOSITORY_ID), eq(Set.of("shop.OrderStore.save"))))
        .thenReturn(List.of(repository));
    when(symbolRepository.findByRepositoryIdAndQualifiedNameIn(
            eq(REPOSITORY_ID), eq(Set.of("shop.OrderController.create"))))
        .thenReturn(List.of(handler));

    FlowTraversal traversal = engine.traverse(handler);

    assertThat(traversal.iterationsCompleted()).isEqualTo(2);
    assertThat(traversal.iterations().get(0))
        .extracting(FlowEvidence::qualifiedName)
        .containsExactly("shop.OrderController.create", "shop.OrderService.place");
    assertThat(traversal.iterations().get(1))
        .extracting(FlowEvidence::qualifiedName)
        .containsExactly("shop.OrderStore.save");
    assertThat(traversal.symbolIds()).containsExactly(1L, 2L, 3L);
    assertThat(traversal.filePaths())
        .containsExactly(
            "src/main/java/shop/OrderController.java",
            "src/main/java/shop/OrderService.java",
            "src/main/java/shop/OrderStore.java");
    assertThat(traversal.maxDepthAnalyzed()).isEqualTo(3);

    FlowEvidence root = traversal.iterations().get(0).get(0);
    assertThat(root.depth()).isZero();
    assertThat(root.via()).isNull();
    assertThat(root.logLines())
        .containsExactly("21: log.info(\"Creating order {}\", request.id());");
    assertThat(traversal.iterations().get(0).get(1).via()).isEqualTo("CALL");
  }

  @Test
  void stopsAtMaxDepth() {
    properties.getFlow().setMaxDepth(1);
    when(referenceRepository.findBySourceSymbolIdInOrderByIdAsc(List.of(1L)))
        .thenReturn(List.of(call(1L, "shop.OrderService.place")));
    when(symbolRepository.findByRepositoryIdAndQualifiedNameIn(
            eq(REPOSITORY_ID), eq(Set.of("shop.OrderService.place"))))
        .thenReturn(List.of(service));

    FlowTraversal traversal = engine.traverse(handler);

    assertThat(traversal.iterationsCompleted()).isEqualTo(1);
    assertThat(traversal.symbolIds()).containsExactly(1L, 2L);
    assertThat(traversal.maxDepthAnalyzed()).isEqualTo(1);
  }

  @Test
  void truncateKeepsLeadingLines() {
    assertThat(FlowTraversalEngine.truncate("a\nb\nc", 2)).isEqualTo("a\nb");
    assertThat(FlowTraversalEngine.truncate("a\nb", 5)).isEqualTo("a\nb");
    assertThat(FlowTraversalEngine.truncate(null, 5)).isEmpty();
  }

  private static SymbolReference call(Long sourceId, String target) {
    SymbolReference reference =
        new SymbolReference(REPOSITORY_ID, sourceId, sourceId * 10, ReferenceType.CALL, target, 1);
    reference.bindTarget(target, "src/main/java/shop/Target.java");
    return reference;
  }

  private static SymbolReference importEdge(Long sourceId) {
    SymbolReference reference =
        new SymbolReference(
            REPOSITORY_ID, sourceId, sourceId * 10, ReferenceType.IMPORT, "shop.Audit", 1);
    reference.bindTarget("shop.Audit", "src/main/java/shop/Audit.java");
    return reference;
  }

  private static SymbolReference unresolved(Long sourceId, String target) {
    SymbolReference reference =
        new SymbolReference(REPOSITORY_ID, sourceId, sourceId * 10, ReferenceType.CALL, target, 2);
    reference.setExternal(true);
    return reference;
  }
}
