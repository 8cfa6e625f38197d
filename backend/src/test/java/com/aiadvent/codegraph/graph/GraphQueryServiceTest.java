package com.aiadvent.codegraph.graph;

import static com.aiadvent.codegraph.support.TestSymbols.REPOSITORY_ID;
import static com.aiadvent.codegraph.support.TestSymbols.symbol;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.graph.GraphQueryResult.Direction;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.domain.ReferenceType;
import com.aiadvent.codegraph.graph.domain.SymbolReference;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.graph.persistence.SymbolReferenceRepository;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GraphQueryServiceTest {

  @Mock private CodeSymbolRepository symbolRepository;
  @Mock private SymbolReferenceRepository referenceRepository;

  private GraphQueryService queryService;

  private final CodeSymbol run = symbol(1, "shop/a.py", SymbolKind.FUNCTION, "shop.a.run");
  private final CodeSymbol handle = symbol(2, "shop/b.py", SymbolKind.FUNCTION, "shop.b.handle");
  private final CodeSymbol save = symbol(3, "shop/c.py", SymbolKind.FUNCTION, "shop.c.save");

  // run -> handle -> save -> run, plus run -> println (external)
  private final List<SymbolReference> references =
      List.of(
          call(1, "shop.b.handle"),
          external(1, "println"),
          call(2, "shop.c.save"),
          call(3, "shop.a.run"));

  @BeforeEach
  void setUp() {
    queryService =
        new GraphQueryService(symbolRepository, referenceRepository, new CodeGraphProperties());
  }

  @Test
  void downstreamVisitsEachSymbolOnceAndStopsOnCycle() {
    givenSymbol(run);
    givenDownstreamGraph();

    GraphQueryResult result = queryService.downstream(REPOSITORY_ID, 1L, 5);

    assertThat(result.direction()).isEqualTo(Direction.DOWNSTREAM);
    assertThat(result.root().qualifiedName()).isEqualTo("shop.a.run");
    assertThat(result.nodes())
        .extracting(GraphNode::name, GraphNode::depth, GraphNode::external)
        .containsExactly(
            tuple("handle", 1, false), tuple("println", 1, true), tuple("save", 2, false));
    assertThat(result.byDepth()).containsOnlyKeys(1, 2);
    assertThat(result.totalNodes()).isEqualTo(3);
  }

  @Test
  void downstreamRespectsDepthLimit() {
    givenSymbol(run);
    givenDownstreamGraph();

    GraphQueryResult result = queryService.downstream(REPOSITORY_ID, 1L, 1);

    assertThat(result.maxDepth()).isEqualTo(1);
    assertThat(result.nodes()).extracting(GraphNode::name).containsExactly("handle", "println");
  }

  @Test
  void upstreamWalksCallersBreadthFirst() {
    givenSymbol(save);
    Map<String, List<SymbolReference>> byTarget =
        Map.of(
            "shop.c.save", List.of(references.get(2)),
            "shop.b.handle", List.of(references.get(0)),
            "shop.a.run", List.of(references.get(3)));
    when(referenceRepository.findByRepositoryIdAndTargetQualifiedNameInOrderByIdAsc(
            eq(REPOSITORY_ID), anyCollection()))
        .thenAnswer(
            invocation -> {
              Collection<String> names = invocation.getArgument(1);
              List<SymbolReference> found = new ArrayList<>();
              names.forEach(name -> found.addAll(byTarget.getOrDefault(name, List.of())));
              return found;
            });
    when(symbolRepository.findAllById(any()))
        .thenAnswer(
            invocation -> {
              Iterable<Long> ids = invocation.getArgument(0);
              List<CodeSymbol> found = new ArrayList<>();
              ids.forEach(id -> found.add(List.of(run, handle, save).get((int) (id - 1))));
              return found;
            });

    GraphQueryResult result = queryService.upstream(REPOSITORY_ID, 3L, null);

    assertThat(result.maxDepth()).isEqualTo(5);
    assertThat(result.nodes())
        .extracting(GraphNode::qualifiedName, GraphNode::depth, GraphNode::viaReference)
        .containsExactly(
            tuple("shop.b.handle", 1, ReferenceType.CALL),
            tuple("shop.a.run", 2, ReferenceType.CALL));
  }

  @Test
  void unknownSymbolIsNotFound() {
    when(symbolRepository.findByIdAndRepositoryId(42L, REPOSITORY_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> queryService.downstream(REPOSITORY_ID, 42L, 3))
        .isInstanceOf(CodeGraphNotFoundException.class);
    assertThatThrownBy(() -> queryService.getSymbol(REPOSITORY_ID, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void searchRejectsBlankQueryAndBadLimits() {
    assertThatThrownBy(() -> queryService.searchSymbols(REPOSITORY_ID, " ", 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> queryService.listSymbols(REPOSITORY_ID, null, 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> queryService.listSymbols(REPOSITORY_ID, null, 10, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void searchMatchesWildcardCharactersLiterally() {
    when(symbolRepository.search(eq(REPOSITORY_ID), eq("get\\_order\\%\\\\x"), any()))
        .thenReturn(List.of(run));

    assertThat(queryService.searchSymbols(REPOSITORY_ID, " get_order%\\x ", 10))
        .containsExactly(run);
    assertThat(GraphQueryService.escapeLike("plain.Name")).isEqualTo("plain.Name");
  }

  @Test
  void listSymbolsAppliesOffsetWindow() {
    when(symbolRepository.findByRepositoryIdOrderByQualifiedNameAsc(eq(REPOSITORY_ID), any()))
        .thenReturn(List.of(run, handle, save));

    assertThat(queryService.listSymbols(REPOSITORY_ID, null, 2, 1))
        .extracting(CodeSymbol::getQualifiedName)
        .containsExactly("shop.b.handle", "shop.c.save");
  }

  private void givenSymbol(CodeSymbol symbol) {
    when(symbolRepository.findByIdAndRepositoryId(symbol.getId(), REPOSITORY_ID))
        .thenReturn(Optional.of(symbol));
  }

  private void givenDownstreamGraph() {
    when(referenceRepository.findBySourceSymbolIdInOrderByIdAsc(anyCollection()))
        .thenAnswer(
            invocation -> {
              Collection<Long> ids = invocation.getArgument(0);
              return references.stream()
                  .filter(reference -> ids.contains(reference.getSourceSymbolId()))
                  .toList();
            });
    when(symbolRepository.findByRepositoryIdAndQualifiedNameIn(eq(REPOSITORY_ID), anyCollection()))
        .thenAnswer(
            invocation -> {
              Collection<String> names = invocation.getArgument(1);
              return List.of(run, handle, save).stream()
                  .filter(symbol -> names.contains(symbol.getQualifiedName()))
                  .toList();
            });
  }

  private static SymbolReference call(long sourceId, String target) {
    SymbolReference reference =
        new SymbolReference(
            REPOSITORY_ID,
            sourceId,
            sourceId * 10,
            ReferenceType.CALL,
            target.substring(target.lastIndexOf('.') + 1),
            3);
    reference.bindTarget(target, target.replace('.', '/') + ".py");
    return reference;
  }

  private static SymbolReference external(long sourceId, String name) {
    SymbolReference reference =
        new SymbolReference(REPOSITORY_ID, sourceId, sourceId * 10, ReferenceType.CALL, name, 4);
    reference.setExternal(true);
    return reference;
  }
}
