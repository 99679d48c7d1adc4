package com.gentoro.medrag.graph.driver.memory;

import com.gentoro.medrag.concept.ConceptDetails;
import com.gentoro.medrag.exception.GraphConnectionClosedException;
import com.gentoro.medrag.exception.ValidationException;
import com.gentoro.medrag.graph.GraphNodeRecord;
import com.gentoro.medrag.graph.GraphSchema;
import com.gentoro.medrag.graph.GraphStatistics;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.graph.QueryTokens;
import com.gentoro.medrag.graph.RetrievedEntity;
import com.gentoro.medrag.graph.RetrievedFact;
import com.gentoro.medrag.graph.SearchOutcome;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Process-local {@link GraphStore}. Applies the same identity and merge rules as the database
 * drivers and is safe for concurrent use; all state is guarded by the instance monitor.
 */
public class InMemoryGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(InMemoryGraphStore.class);

  private final Clock clock;
  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private final Map<String, Edge> edges = new LinkedHashMap<>();
  private boolean open;
  private boolean closed;

  public InMemoryGraphStore() {
    this(Clock.systemUTC());
  }

  public InMemoryGraphStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized void initialize() {
    ensureNotClosed();
    if (!open) {
      open = true;
      log.info("In-memory graph store initialized");
    }
  }

  @Override
  public synchronized boolean isOpen() {
    return open && !closed;
  }

  @Override
  public String name() {
    return "in-memory";
  }

  @Override
  public synchronized String upsertDocument(
      String name, String content, String sourceDescription, Instant referenceTime) {
    ensureOpen();
    Map<String, Object> props = new LinkedHashMap<>();
    props.put("content", content == null ? "" : content);
    props.put("sourceDescription", sourceDescription == null ? "" : sourceDescription);
    props.put("referenceTime", referenceTime == null ? clock.instant() : referenceTime);
    Node n =
        new Node(
            GraphSchema.newNodeId(), name, Set.of(GraphSchema.DOCUMENT), props, clock.instant());
    nodes.put(n.uuid, n);
    return n.uuid;
  }

  @Override
  public synchronized String upsertConcept(String conceptId, ConceptDetails details) {
    ensureOpen();
    requireText(conceptId, "conceptId");
    String id = GraphSchema.conceptNodeId(conceptId);
    Node node = nodes.get(id);
    if (node == null) {
      node =
          new Node(
              id,
              GraphSchema.conceptNodeName(conceptId),
              Set.of(GraphSchema.CONCEPT),
              new LinkedHashMap<>(),
              clock.instant());
      nodes.put(id, node);
    }
    node.props.put("conceptId", conceptId);
    if (details != null) {
      node.props.put("canonicalName", details.canonicalName());
      node.props.put("semanticTypes", details.semanticCategories());
      node.props.put("definitions", details.definitions());
      node.props.put("attributes", details.attributes());
      if (!details.definitions().isEmpty()) {
        node.props.put("summary", details.definitions().get(0));
      }
    }
    node.props.put("updatedAt", clock.instant());
    return id;
  }

  @Override
  public synchronized boolean linkConceptToNode(
      String nodeId, String conceptId, Map<String, Object> relationProps) {
    ensureOpen();
    String conceptNodeId = GraphSchema.conceptNodeId(conceptId);
    if (!nodes.containsKey(nodeId) || !nodes.containsKey(conceptNodeId)) {
      log.warn("Cannot link {} to concept {}: endpoint missing", nodeId, conceptId);
      return false;
    }
    mergeEdge(nodeId, GraphSchema.HAS_CONCEPT, conceptNodeId, relationProps);
    return true;
  }

  @Override
  public synchronized boolean linkConceptHierarchy(String parentConceptId, String childConceptId) {
    ensureOpen();
    String parent = GraphSchema.conceptNodeId(parentConceptId);
    String child = GraphSchema.conceptNodeId(childConceptId);
    if (!nodes.containsKey(parent) || !nodes.containsKey(child)) {
      log.warn(
          "Cannot link hierarchy {} -> {}: concept node missing", parentConceptId, childConceptId);
      return false;
    }
    mergeEdge(parent, GraphSchema.BROADER_THAN, child, Map.of());
    mergeEdge(child, GraphSchema.NARROWER_THAN, parent, Map.of());
    return true;
  }

  @Override
  public synchronized SearchOutcome<RetrievedFact> searchFacts(String query, int limit) {
    ensureOpen();
    List<String> tokens = QueryTokens.tokenize(query);
    if (tokens.isEmpty() || limit <= 0) return SearchOutcome.ok(List.of());

    List<Scored<Edge>> hits = new ArrayList<>();
    for (Edge e : edges.values()) {
      if (!GraphSchema.RELATES_TO.equals(e.type)) continue;
      Node s = nodes.get(e.from);
      Node t = nodes.get(e.to);
      String hay =
          String.join(
              " ",
              String.valueOf(e.props.getOrDefault("fact", "")),
              s == null ? "" : s.name,
              t == null ? "" : t.name);
      int score = QueryTokens.score(tokens, hay);
      if (score > 0) hits.add(new Scored<>(e, score, e.createdAt, e.id));
    }
    hits.sort(Scored.RANKING);

    List<RetrievedFact> out = new ArrayList<>();
    for (Scored<Edge> hit : hits.subList(0, Math.min(limit, hits.size()))) {
      Edge e = hit.item;
      Node s = nodes.get(e.from);
      Node t = nodes.get(e.to);
      out.add(
          new RetrievedFact(
              e.id,
              (String) e.props.get("fact"),
              e.from,
              e.to,
              s == null ? null : s.name,
              t == null ? null : t.name,
              (Instant) e.props.get("validFrom"),
              (Instant) e.props.get("validUntil")));
    }
    return SearchOutcome.ok(out);
  }

  @Override
  public synchronized SearchOutcome<RetrievedEntity> searchEntities(String query, int limit) {
    ensureOpen();
    List<String> tokens = QueryTokens.tokenize(query);
    if (tokens.isEmpty() || limit <= 0) return SearchOutcome.ok(List.of());

    List<Scored<Node>> hits = new ArrayList<>();
    for (Node n : nodes.values()) {
      if (n.labels.contains(GraphSchema.CONCEPT)) continue;
      int score = QueryTokens.score(tokens, n.name + " " + summaryOf(n));
      if (score > 0) hits.add(new Scored<>(n, score, n.createdAt, n.uuid));
    }
    hits.sort(Scored.RANKING);

    List<RetrievedEntity> out = new ArrayList<>();
    for (Scored<Node> hit : hits.subList(0, Math.min(limit, hits.size()))) {
      Node n = hit.item;
      Map<String, Object> attrs = new LinkedHashMap<>(n.props);
      attrs.remove("summary");
      out.add(new RetrievedEntity(n.uuid, n.name, summaryOf(n), n.labels, n.createdAt, attrs));
    }
    return SearchOutcome.ok(out);
  }

  @Override
  public synchronized String addEntity(
      String name, String summary, List<String> labels, Map<String, Object> attributes) {
    ensureOpen();
    requireText(name, "name");
    Set<String> allLabels = new LinkedHashSet<>();
    allLabels.add(GraphSchema.ENTITY);
    if (labels != null) allLabels.addAll(labels);
    Map<String, Object> props = new LinkedHashMap<>();
    if (attributes != null) props.putAll(attributes);
    props.put("summary", summary == null ? "" : summary);
    Node n = new Node(GraphSchema.newNodeId(), name, allLabels, props, clock.instant());
    nodes.put(n.uuid, n);
    return n.uuid;
  }

  @Override
  public synchronized String addFact(
      String sourceNodeId,
      String targetNodeId,
      String fact,
      Instant validFrom,
      Instant validUntil) {
    ensureOpen();
    if (!nodes.containsKey(sourceNodeId) || !nodes.containsKey(targetNodeId)) {
      throw new ValidationException(
          "Fact endpoints must exist: %s -> %s".formatted(sourceNodeId, targetNodeId));
    }
    Map<String, Object> props = new LinkedHashMap<>();
    props.put("fact", fact == null ? "" : fact);
    if (validFrom != null) props.put("validFrom", validFrom);
    if (validUntil != null) props.put("validUntil", validUntil);
    String id = GraphSchema.newNodeId();
    edges.put(
        id,
        new Edge(
            id, sourceNodeId, GraphSchema.RELATES_TO, targetNodeId, props, clock.instant()));
    return id;
  }

  @Override
  public synchronized Optional<GraphNodeRecord> getNode(String nodeId) {
    ensureOpen();
    Node n = nodes.get(nodeId);
    return n == null ? Optional.empty() : Optional.of(n.toRecord());
  }

  @Override
  public synchronized List<GraphNodeRecord> listNodes(String label, int limit) {
    ensureOpen();
    List<GraphNodeRecord> out = new ArrayList<>();
    for (Node n : nodes.values()) {
      if (label != null && !n.labels.contains(label)) continue;
      out.add(n.toRecord());
      if (limit > 0 && out.size() >= limit) break;
    }
    return out;
  }

  @Override
  public synchronized void clearAll() {
    ensureOpen();
    nodes.clear();
    edges.clear();
    log.info("In-memory graph store cleared");
  }

  @Override
  public synchronized GraphStatistics statistics() {
    ensureOpen();
    Map<String, Long> byLabel = new TreeMap<>();
    Map<String, Long> semanticTypes = new HashMap<>();
    for (Node n : nodes.values()) {
      for (String l : n.labels) byLabel.merge(l, 1L, Long::sum);
      if (n.labels.contains(GraphSchema.CONCEPT)
          && n.props.get("semanticTypes") instanceof List<?> types) {
        for (Object t : types) semanticTypes.merge(String.valueOf(t), 1L, Long::sum);
      }
    }
    Map<String, Long> byType = new TreeMap<>();
    Map<String, Long> degrees = new HashMap<>();
    Set<String> withConcepts = new HashSet<>();
    for (Edge e : edges.values()) {
      byType.merge(e.type, 1L, Long::sum);
      degrees.merge(e.from, 1L, Long::sum);
      degrees.merge(e.to, 1L, Long::sum);
      if (GraphSchema.HAS_CONCEPT.equals(e.type)) withConcepts.add(e.from);
    }

    long degreeSum = 0;
    long isolated = 0;
    List<GraphStatistics.ConnectedNode> connected = new ArrayList<>();
    for (Node n : nodes.values()) {
      long degree = degrees.getOrDefault(n.uuid, 0L);
      degreeSum += degree;
      if (degree == 0) {
        isolated++;
      } else {
        connected.add(new GraphStatistics.ConnectedNode(n.uuid, n.name, degree));
      }
    }
    connected.sort(
        Comparator.comparingLong(GraphStatistics.ConnectedNode::degree)
            .reversed()
            .thenComparing(GraphStatistics.ConnectedNode::id));

    long conceptNodes = byLabel.getOrDefault(GraphSchema.CONCEPT, 0L);
    return new GraphStatistics(
        byLabel,
        byType,
        nodes.size(),
        edges.size(),
        conceptNodes,
        withConcepts.size(),
        GraphStatistics.coveragePercent(nodes.size(), conceptNodes, withConcepts.size()),
        GraphStatistics.averageDegree(nodes.size(), degreeSum),
        isolated,
        GraphStatistics.ranked(semanticTypes, GraphStatistics.TOP_SEMANTIC_TYPES),
        connected.subList(0, Math.min(GraphStatistics.MOST_CONNECTED, connected.size())));
  }

  @Override
  public synchronized void close() {
    if (closed) return;
    closed = true;
    open = false;
    log.info("In-memory graph store closed ({} nodes, {} edges)", nodes.size(), edges.size());
  }

  /** Edges currently stored, for inspection. */
  public synchronized int edgeCount() {
    return edges.size();
  }

  public synchronized int nodeCount() {
    return nodes.size();
  }

  private void mergeEdge(String from, String type, String to, Map<String, Object> props) {
    String id = GraphSchema.edgeId(from, type, to);
    Edge e = edges.get(id);
    if (e == null) {
      Map<String, Object> copy = new LinkedHashMap<>(props == null ? Map.of() : props);
      edges.put(id, new Edge(id, from, type, to, copy, clock.instant()));
    } else if (props != null) {
      e.props.putAll(props);
    }
  }

  private static String summaryOf(Node n) {
    Object summary = n.props.get("summary");
    if (summary instanceof String s && !s.isBlank()) return s;
    Object content = n.props.get("content");
    return content instanceof String c ? c : "";
  }

  private void ensureOpen() {
    ensureNotClosed();
    if (!open) {
      throw new com.gentoro.medrag.exception.StateException(
          "Graph store '%s' is not initialized".formatted(name()));
    }
  }

  private void ensureNotClosed() {
    if (closed) throw new GraphConnectionClosedException(name());
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " must not be blank");
    }
  }

  private static final class Node {
    final String uuid;
    final String name;
    final Set<String> labels;
    final Map<String, Object> props;
    final Instant createdAt;

    Node(
        String uuid,
        String name,
        Set<String> labels,
        Map<String, Object> props,
        Instant createdAt) {
      this.uuid = uuid;
      this.name = name == null ? "" : name;
      this.labels = new LinkedHashSet<>(labels);
      this.props = props;
      this.createdAt = createdAt;
    }

    GraphNodeRecord toRecord() {
      return new GraphNodeRecord(uuid, name, labels, props, createdAt);
    }
  }

  private static final class Edge {
    final String id;
    final String from;
    final String type;
    final String to;
    final Map<String, Object> props;
    final Instant createdAt;

    Edge(
        String id,
        String from,
        String type,
        String to,
        Map<String, Object> props,
        Instant createdAt) {
      this.id = id;
      this.from = from;
      this.type = type;
      this.to = to;
      this.props = props;
      this.createdAt = createdAt;
    }
  }

  private record Scored<T>(T item, int score, Instant createdAt, String id) {
    static final Comparator<Scored<?>> RANKING =
        Comparator.<Scored<?>>comparingInt(Scored::score)
            .reversed()
            .thenComparing(Scored::createdAt, Comparator.reverseOrder())
            .thenComparing(Scored::id);
  }
}
