package com.aiadvent.codegraph.graph;

import static com.aiadvent.codegraph.support.TestSymbols.REPOSITORY_ID;
import static com.aiadvent.codegraph.support.TestSymbols.symbol;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.graph.SymbolLookupService.LookupMatch;
import com.aiadvent.codegraph.graph.SymbolLookupService.LookupResult;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SymbolLookupServiceTest {

  @Mock private CodeSymbolRepository symbolRepository;
  @Mock private GraphQueryService graphQueryService;

  private SymbolLookupService lookupService;

  private final CodeSymbol ordersHandle =
      symbol(1, "shop/orders.py", SymbolKind.METHOD, "shop.orders.Orders.handle");
  private final CodeSymbol paymentsHandle =
      symbol(2, "shop/payments.py", SymbolKind.FUNCTION, "shop.payments.handle");
  private final CodeSymbol otherHandle =
      symbol(3, "tools/cli.py", SymbolKind.FUNCTION, "tools.cli.handle");

  @BeforeEach
  void setUp() {
    CodeGraphProperties properties = new CodeGraphProperties();
    lookupService = new SymbolLookupService(symbolRepository, graphQueryService, properties);
  }

  @Test
  void keepsEveryCollisionUnderThePrefix() {
    givenThreeHandles();
    LookupResult result = lookupService.lookupByQualifiedPath(REPOSITORY_ID, "shop", "handle", 0);

    assertThat(result.totalMatches()).isEqualTo(2);
    assertThat(result.matches())
        .extracting(match -> match.symbol().qualifiedName())
        .containsExactly("shop.orders.Orders.handle", "shop.payments.handle");
    assertThat(result.matches()).allSatisfy(match -> assertThat(match.upstream()).isEmpty());
    verifyNoInteractions(graphQueryService);
  }

  @Test
  void filePathPrefixMatchesToo() {
    givenThreeHandles();
    LookupResult result =
        lookupService.lookupByQualifiedPath(REPOSITORY_ID, "tools/", "handle", 0);

    assertThat(result.matches())
        .extracting(match -> match.symbol().filePath())
        .containsExactly("tools/cli.py");
  }

  @Test
  void attachesCallContextWithDefaultDepth() {
    givenThreeHandles();
    GraphNode caller =
        GraphNode.root(symbol(9, "shop/api.py", SymbolKind.FUNCTION, "shop.api.create"));
    when(graphQueryService.walkUpstream(paymentsHandle, 5)).thenReturn(List.of(caller));
    when(graphQueryService.walkDownstream(paymentsHandle, 5)).thenReturn(List.of());

    LookupResult result =
        lookupService.lookupByQualifiedPath(REPOSITORY_ID, "shop.payments", "handle", null);

    assertThat(result.totalMatches()).isEqualTo(1);
    LookupMatch match = result.matches().get(0);
    assertThat(match.upstream()).extracting(GraphNode::name).containsExactly("create");
    verify(graphQueryService).walkDownstream(paymentsHandle, 5);
  }

  @Test
  void blankNameIsRejected() {
    assertThatThrownBy(() -> lookupService.lookupByQualifiedPath(REPOSITORY_ID, "shop", " ", 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private void givenThreeHandles() {
    when(symbolRepository.findByRepositoryIdAndNameOrderByQualifiedNameAsc(REPOSITORY_ID, "handle"))
        .thenReturn(List.of(ordersHandle, paymentsHandle, otherHandle));
  }
}
