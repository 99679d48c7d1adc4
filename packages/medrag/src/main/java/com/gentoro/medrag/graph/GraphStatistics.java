package com.gentoro.medrag.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts and structure figures reported by {@link GraphStore#statistics()}.
 *
 * <p>Degrees are undirected: every edge adds one to each endpoint. {@code umlsCoveragePercent} is
 * the share of non-concept nodes carrying at least one concept link. {@code topSemanticTypes} is
 * ordered by count, highest first.
 */
public record GraphStatistics(
    Map<String, Long> nodesByLabel,
    Map<String, Long> relationshipsByType,
    long totalNodes,
    long totalRelationships,
    long conceptNodes,
    long nodesWithConcepts,
    double umlsCoveragePercent,
    double averageDegree,
    long isolatedNodes,
    Map<String, Long> topSemanticTypes,
    List<ConnectedNode> mostConnectedNodes) {

  public static final int TOP_SEMANTIC_TYPES = 10;
  public static final int MOST_CONNECTED = 5;

  private static final Comparator<Map.Entry<String, Long>> BY_COUNT =
      Map.Entry.<String, Long>comparingByValue()
          .reversed()
          .thenComparing(Map.Entry.<String, Long>comparingByKey());

  /** A node and its number of incident edges. */
  public record ConnectedNode(String id, String name, long degree) {}

  public GraphStatistics {
    nodesByLabel =
        nodesByLabel == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(nodesByLabel));
    relationshipsByType =
        relationshipsByType == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(relationshipsByType));
    topSemanticTypes =
        topSemanticTypes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(topSemanticTypes));
    mostConnectedNodes = mostConnectedNodes == null ? List.of() : List.copyOf(mostConnectedNodes);
  }

  /** Highest-count labels first; ties by name. */
  public List<Map.Entry<String, Long>> topLabels(int limit) {
    return top(nodesByLabel, limit);
  }

  /** Highest-count relationship types first; ties by name. */
  public List<Map.Entry<String, Long>> topRelationshipTypes(int limit) {
    return top(relationshipsByType, limit);
  }

  /** Percentage of non-concept nodes linked to a concept, 0 when there are none. */
  public static double coveragePercent(long totalNodes, long conceptNodes, long nodesWithConcepts) {
    long candidates = totalNodes - conceptNodes;
    return candidates <= 0 ? 0.0 : nodesWithConcepts * 100.0 / candidates;
  }

  public static double averageDegree(long totalNodes, long degreeSum) {
    return totalNodes <= 0 ? 0.0 : (double) degreeSum / totalNodes;
  }

  /** Sorts counts highest first and keeps at most {@code limit} entries. */
  public static Map<String, Long> ranked(Map<String, Long> counts, int limit) {
    Map<String, Long> out = new LinkedHashMap<>();
    for (Map.Entry<String, Long> e : top(counts, limit)) out.put(e.getKey(), e.getValue());
    return out;
  }

  private static List<Map.Entry<String, Long>> top(Map<String, Long> counts, int limit) {
    List<Map.Entry<String, Long>> entries = new ArrayList<>();
    for (Map.Entry<String, Long> e : counts.entrySet()) {
      entries.add(Map.entry(e.getKey(), e.getValue()));
    }
    entries.sort(BY_COUNT);
    return entries.subList(0, Math.min(Math.max(limit, 0), entries.size()));
  }
}
