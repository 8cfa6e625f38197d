package com.aiadvent.codegraph.flow;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.domain.ReferenceType;
import com.aiadvent.codegraph.graph.domain.SymbolReference;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.graph.persistence.SymbolReferenceRepository;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Bounded breadth-first walk down the call graph from an entry point. Each iteration advances
 * {@code depthPerIteration} levels; the walk stops at {@code maxIterations}, at {@code maxDepth}
 * or when no unvisited internal symbol is left.
 */
@Component
public class FlowTraversalEngine {

  private static final Logger log = LoggerFactory.getLogger(FlowTraversalEngine.class);

  private final CodeSymbolRepository symbolRepository;
  private final SymbolReferenceRepository referenceRepository;
  private final LogLineScanner logLineScanner;
  private final CodeGraphProperties properties;

  public FlowTraversalEngine(
      CodeSymbolRepository symbolRepository,
      SymbolReferenceRepository referenceRepository,
      LogLineScanner logLineScanner,
      CodeGraphProperties properties) {
    this.symbolRepository = symbolRepository;
    this.referenceRepository = referenceRepository;
    this.logLineScanner = logLineScanner;
    this.properties = properties;
  }

  @Transactional(readOnly = true)
  public FlowTraversal traverse(CodeSymbol root) {
    CodeGraphProperties.Flow limits = properties.getFlow();
    UUID repositoryId = root.getRepositoryId();
    Set<Long> visited = new LinkedHashSet<>();
    Set<String> filePaths = new LinkedHashSet<>();
    List<List<FlowEvidence>> iterations = new ArrayList<>();

    visited.add(root.getId());
    filePaths.add(root.getFilePath());
    List<FlowEvidence> current = new ArrayList<>();
    current.add(toEvidence(root, 0, null));
    List<CodeSymbol> frontier = List.of(root);
    int depth = 0;

    for (int iteration = 1; iteration <= limits.getMaxIterations(); iteration++) {
      int levelLimit = Math.min(depth + limits.getDepthPerIteration(), limits.getMaxDepth());
      while (depth < levelLimit && !frontier.isEmpty()) {
        depth++;
        List<CodeSymbol> next = new ArrayList<>();
        for (Reached reached : expand(repositoryId, frontier)) {
          if (!visited.add(reached.symbol().getId())) {
            continue;
          }
          next.add(reached.symbol());
          filePaths.add(reached.symbol().getFilePath());
          current.add(toEvidence(reached.symbol(), depth, reached.via()));
        }
        frontier = next;
      }
      if (!current.isEmpty()) {
        iterations.add(current);
      }
      current = new ArrayList<>();
      if (frontier.isEmpty() || depth >= limits.getMaxDepth()) {
        break;
      }
    }

    log.debug(
        "Flow traversal finished (root={}, iterations={}, depth={}, symbols={})",
        root.getQualifiedName(),
        iterations.size(),
        depth,
        visited.size());
    return new FlowTraversal(
        iterations, depth, new ArrayList<>(visited), new ArrayList<>(filePaths));
  }

  private List<Reached> expand(UUID repositoryId, List<CodeSymbol> frontier) {
    List<Long> sourceIds = frontier.stream().map(CodeSymbol::getId).toList();
    List<SymbolReference> edges =
        referenceRepository.findBySourceSymbolIdInOrderByIdAsc(sourceIds).stream()
            .filter(edge -> edge.getReferenceType() != ReferenceType.IMPORT)
            .filter(edge -> !edge.isExternal() && edge.getTargetQualifiedName() != null)
            .toList();
    if (edges.isEmpty()) {
      return List.of();
    }
    Set<String> targetNames =
        edges.stream()
            .map(SymbolReference::getTargetQualifiedName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    Map<String, CodeSymbol> targets =
        symbolRepository.findByRepositoryIdAndQualifiedNameIn(repositoryId, targetNames).stream()
            .collect(
                Collectors.toMap(
                    CodeSymbol::getQualifiedName, Function.identity(), (left, right) -> left));
    Map<Long, Reached> reached = new LinkedHashMap<>();
    for (SymbolReference edge : edges) {
      CodeSymbol target = targets.get(edge.getTargetQualifiedName());
      if (target != null) {
        reached.putIfAbsent(
            target.getId(), new Reached(target, edge.getReferenceType().name()));
      }
    }
    return new ArrayList<>(reached.values());
  }

  private FlowEvidence toEvidence(CodeSymbol symbol, int depth, String via) {
    String source = symbol.getSourceText();
    return new FlowEvidence(
        depth,
        symbol.getId(),
        symbol.getName(),
        symbol.getQualifiedName(),
        symbol.getKind(),
        symbol.getFilePath(),
        symbol.getStartLine(),
        symbol.getEndLine(),
        via,
        truncate(source, properties.getFlow().getMaxSnippetLines()),
        logLineScanner.scan(source, symbol.getStartLine()));
  }

  static String truncate(String source, int maxLines) {
    if (source == null) {
      return "";
    }
    String[] lines = source.split("\\R", -1);
    if (lines.length <= maxLines) {
      return source;
    }
    return String.join("\n", Arrays.asList(lines).subList(0, maxLines));
  }

  private record Reached(CodeSymbol symbol, String via) {}
}
