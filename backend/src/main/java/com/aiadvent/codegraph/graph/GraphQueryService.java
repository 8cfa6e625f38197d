package com.aiadvent.codegraph.graph;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.graph.GraphQueryResult.Direction;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.domain.SymbolReference;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.graph.persistence.SymbolReferenceRepository;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Symbol lookups and breadth-first traversal of the reference graph. Every symbol id is emitted at
 * most once, at the depth where it was first reached; external and dangling targets are leaves.
 */
@Service
@Transactional(readOnly = true)
public class GraphQueryService {

  private static final Logger log = LoggerFactory.getLogger(GraphQueryService.class);
  private static final int MAX_PAGE_SIZE = 500;

  private final CodeSymbolRepository symbolRepository;
  private final SymbolReferenceRepository referenceRepository;
  private final CodeGraphProperties properties;

  public GraphQueryService(
      CodeSymbolRepository symbolRepository,
      SymbolReferenceRepository referenceRepository,
      CodeGraphProperties properties) {
    this.symbolRepository = symbolRepository;
    this.referenceRepository = referenceRepository;
    this.properties = properties;
  }

  public CodeSymbol getSymbol(UUID repositoryId, Long symbolId) {
    if (symbolId == null) {
      throw new IllegalArgumentException("symbolId must not be null");
    }
    return symbolRepository
        .findByIdAndRepositoryId(symbolId, repositoryId)
        .orElseThrow(() -> CodeGraphNotFoundException.of("Symbol", symbolId));
  }

  public List<CodeSymbol> searchSymbols(UUID repositoryId, String query, int limit) {
    if (!StringUtils.hasText(query)) {
      throw new IllegalArgumentException("query must not be blank");
    }
    return symbolRepository.search(
        repositoryId, escapeLike(query.trim()), PageRequest.of(0, pageSize(limit)));
  }

  /** Escapes LIKE wildcards and the backslash escape character so they match literally. */
  static String escapeLike(String text) {
    StringBuilder escaped = new StringBuilder(text.length());
    for (char c : text.toCharArray()) {
      if (c == '\\' || c == '%' || c == '_') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  public List<CodeSymbol> listSymbols(UUID repositoryId, SymbolKind kind, int limit, int offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    int size = pageSize(limit);
    Pageable window = PageRequest.of(0, offset + size);
    List<CodeSymbol> symbols =
        kind == null
            ? symbolRepository.findByRepositoryIdOrderByQualifiedNameAsc(repositoryId, window)
            : symbolRepository.findByRepositoryIdAndKindOrderByQualifiedNameAsc(
                repositoryId, kind, window);
    if (offset >= symbols.size()) {
      return List.of();
    }
    return List.copyOf(symbols.subList(offset, Math.min(symbols.size(), offset + size)));
  }

  public GraphQueryResult downstream(UUID repositoryId, Long symbolId, Integer maxDepth) {
    CodeSymbol root = getSymbol(repositoryId, symbolId);
    int depth = properties.getGraph().effectiveDepth(maxDepth);
    return GraphQueryResult.of(
        GraphNode.root(root), Direction.DOWNSTREAM, depth, walkDownstream(root, depth));
  }

  public GraphQueryResult upstream(UUID repositoryId, Long symbolId, Integer maxDepth) {
    CodeSymbol root = getSymbol(repositoryId, symbolId);
    int depth = properties.getGraph().effectiveDepth(maxDepth);
    return GraphQueryResult.of(
        GraphNode.root(root), Direction.UPSTREAM, depth, walkUpstream(root, depth));
  }

  public List<GraphNode> walkDownstream(CodeSymbol root, int maxDepth) {
    Set<Long> seen = new HashSet<>();
    Set<String> seenExternal = new HashSet<>();
    seen.add(root.getId());
    List<GraphNode> nodes = new ArrayList<>();
    List<CodeSymbol> frontier = List.of(root);
    for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
      List<Long> sourceIds = frontier.stream().map(CodeSymbol::getId).toList();
      List<SymbolReference> references =
          referenceRepository.findBySourceSymbolIdInOrderByIdAsc(sourceIds);
      Set<String> targetNames = new LinkedHashSet<>();
      for (SymbolReference reference : references) {
        if (!reference.isExternal() && reference.getTargetQualifiedName() != null) {
          targetNames.add(reference.getTargetQualifiedName());
        }
      }
      Map<String, CodeSymbol> targets = new HashMap<>();
      if (!targetNames.isEmpty()) {
        symbolRepository
            .findByRepositoryIdAndQualifiedNameIn(root.getRepositoryId(), targetNames)
            .forEach(symbol -> targets.put(symbol.getQualifiedName(), symbol));
      }
      List<CodeSymbol> next = new ArrayList<>();
      for (SymbolReference reference : references) {
        CodeSymbol target =
            reference.isExternal() ? null : targets.get(reference.getTargetQualifiedName());
        if (target == null) {
          String key = reference.getTargetName() + "|" + reference.getReferenceType();
          if (seenExternal.add(key)) {
            nodes.add(GraphNode.externalLeaf(reference, depth));
          }
          continue;
        }
        if (seen.add(target.getId())) {
          nodes.add(
              GraphNode.of(target, depth, reference.getReferenceType(), reference.isAmbiguous()));
          next.add(target);
        }
      }
      frontier = next;
    }
    log.debug(
        "Downstream traversal (symbolId={}, maxDepth={}, nodes={})",
        root.getId(),
        maxDepth,
        nodes.size());
    return nodes;
  }

  public List<GraphNode> walkUpstream(CodeSymbol root, int maxDepth) {
    Set<Long> seen = new HashSet<>();
    seen.add(root.getId());
    List<GraphNode> nodes = new ArrayList<>();
    List<CodeSymbol> frontier = List.of(root);
    for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
      List<String> names = frontier.stream().map(CodeSymbol::getQualifiedName).toList();
      List<SymbolReference> references =
          referenceRepository.findByRepositoryIdAndTargetQualifiedNameInOrderByIdAsc(
              root.getRepositoryId(), names);
      Set<Long> sourceIds = new LinkedHashSet<>();
      references.forEach(reference -> sourceIds.add(reference.getSourceSymbolId()));
      Map<Long, CodeSymbol> sources = new HashMap<>();
      if (!sourceIds.isEmpty()) {
        symbolRepository
            .findAllById(sourceIds)
            .forEach(symbol -> sources.put(symbol.getId(), symbol));
      }
      List<CodeSymbol> next = new ArrayList<>();
      for (SymbolReference reference : references) {
        CodeSymbol source = sources.get(reference.getSourceSymbolId());
        if (source != null && seen.add(source.getId())) {
          nodes.add(
              GraphNode.of(source, depth, reference.getReferenceType(), reference.isAmbiguous()));
          next.add(source);
        }
      }
      frontier = next;
    }
    log.debug(
        "Upstream traversal (symbolId={}, maxDepth={}, nodes={})",
        root.getId(),
        maxDepth,
        nodes.size());
    return nodes;
  }

  private int pageSize(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return Math.min(limit, MAX_PAGE_SIZE);
  }
}
