package com.aiadvent.codegraph.graph;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public record GraphQueryResult(
    GraphNode root,
    Direction direction,
    int maxDepth,
    List<GraphNode> nodes,
    int totalNodes,
    Map<Integer, List<GraphNode>> byDepth) {

  public enum Direction {
    UPSTREAM,
    DOWNSTREAM
  }

  public static GraphQueryResult of(
      GraphNode root, Direction direction, int maxDepth, List<GraphNode> nodes) {
    Map<Integer, List<GraphNode>> byDepth =
        nodes.stream()
            .collect(Collectors.groupingBy(GraphNode::depth, TreeMap::new, Collectors.toList()));
    return new GraphQueryResult(
        root, direction, maxDepth, List.copyOf(nodes), nodes.size(), byDepth);
  }
}
