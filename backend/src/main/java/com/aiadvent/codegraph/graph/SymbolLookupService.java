package com.aiadvent.codegraph.graph;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Finds every symbol with a given bare name under a path prefix and attaches its call context.
 * Bare-name collisions are never collapsed.
 */
@Service
@Transactional(readOnly = true)
public class SymbolLookupService {

  private final CodeSymbolRepository symbolRepository;
  private final GraphQueryService graphQueryService;
  private final CodeGraphProperties properties;

  public SymbolLookupService(
      CodeSymbolRepository symbolRepository,
      GraphQueryService graphQueryService,
      CodeGraphProperties properties) {
    this.symbolRepository = symbolRepository;
    this.graphQueryService = graphQueryService;
    this.properties = properties;
  }

  public LookupResult lookupByQualifiedPath(
      UUID repositoryId, String pathPrefix, String name, Integer depth) {
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("name must not be blank");
    }
    int contextDepth =
        depth == null ? properties.getGraph().getDefaultMaxDepth() : Math.max(0, depth);
    contextDepth = Math.min(contextDepth, properties.getGraph().getMaxAllowedDepth());
    String prefix = pathPrefix == null ? "" : pathPrefix.trim();
    String filePrefix = prefix.contains("/") ? prefix : prefix.replace('.', '/');

    List<CodeSymbol> candidates =
        symbolRepository.findByRepositoryIdAndNameOrderByQualifiedNameAsc(
            repositoryId, name.trim());
    int effectiveDepth = contextDepth;
    List<LookupMatch> matches =
        candidates.stream()
            .filter(
                symbol ->
                    prefix.isEmpty()
                        || symbol.getFilePath().startsWith(filePrefix)
                        || symbol.getQualifiedName().startsWith(prefix))
            .map(symbol -> match(symbol, effectiveDepth))
            .toList();
    return new LookupResult(matches.size(), matches);
  }

  private LookupMatch match(CodeSymbol symbol, int depth) {
    if (depth == 0) {
      return new LookupMatch(GraphNode.root(symbol), List.of(), List.of());
    }
    return new LookupMatch(
        GraphNode.root(symbol),
        graphQueryService.walkUpstream(symbol, depth),
        graphQueryService.walkDownstream(symbol, depth));
  }

  public record LookupResult(int totalMatches, List<LookupMatch> matches) {}

  public record LookupMatch(
      GraphNode symbol, List<GraphNode> upstream, List<GraphNode> downstream) {}
}
