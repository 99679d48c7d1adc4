package com.gentoro.medrag.graph.driver.arangodb;

import com.arangodb.ArangoCursor;
import com.arangodb.ArangoDB;
import com.arangodb.ArangoDatabase;
import com.arangodb.entity.CollectionType;
import com.arangodb.model.AqlQueryOptions;
import com.arangodb.model.CollectionCreateOptions;
import com.gentoro.medrag.concept.ConceptDetails;
import com.gentoro.medrag.config.MedRagSettings.GraphSettings;
import com.gentoro.medrag.exception.GraphConnectionClosedException;
import com.gentoro.medrag.exception.GraphException;
import com.gentoro.medrag.exception.StateException;
import com.gentoro.medrag.exception.ValidationException;
import com.gentoro.medrag.graph.GraphNodeRecord;
import com.gentoro.medrag.graph.GraphSchema;
import com.gentoro.medrag.graph.GraphStatistics;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.graph.QueryTokens;
import com.gentoro.medrag.graph.RetrievedEntity;
import com.gentoro.medrag.graph.RetrievedFact;
import com.gentoro.medrag.graph.SearchOutcome;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * ArangoDB implementation of {@link GraphStore}.
 *
 * <p>Layout inside one database: document collections {@code documents}, {@code entities} and
 * {@code concepts}; edge collections {@code facts}, {@code hasConcept} and {@code
 * conceptHierarchy}. Node ids are document keys. Every value reaches the server as a bind
 * variable; collection names are constants of this class.
 */
public class ArangoGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(ArangoGraphStore.class);

  static final String COLLECTION_DOCUMENTS = "documents";
  static final String COLLECTION_ENTITIES = "entities";
  static final String COLLECTION_CONCEPTS = "concepts";
  static final String COLLECTION_FACTS = "facts";
  static final String COLLECTION_HAS_CONCEPT = "hasConcept";
  static final String COLLECTION_HIERARCHY = "conceptHierarchy";

  private static final List<String> NODE_COLLECTIONS =
      List.of(COLLECTION_DOCUMENTS, COLLECTION_ENTITIES, COLLECTION_CONCEPTS);
  private static final Pattern VALID_KEY = Pattern.compile("[A-Za-z0-9_\\-:.@()+,=;$!*'%]{1,254}");

  private static final String AQL_UPSERT_CONCEPT =
      "UPSERT { _key: @key } "
          + "INSERT MERGE(@doc, { _key: @key, createdAt: @now }) "
          + "REPLACE MERGE(@doc, { _key: @key, createdAt: OLD.createdAt, updatedAt: @now }) "
          + "IN concepts RETURN NEW._key";

  private static final String AQL_MERGE_EDGE =
      "UPSERT { _key: @key } "
          + "INSERT MERGE(@props, "
          + "{ _key: @key, _from: @from, _to: @to, type: @type, createdAt: @now }) "
          + "UPDATE @props "
          + "IN @@edges RETURN NEW._key";

  private static final String AQL_RESOLVE_NODE =
      "FOR id IN @ids LET d = DOCUMENT(id) FILTER d != null LIMIT 1 RETURN d._id";

  private static final String AQL_SEARCH_FACTS =
      "FOR f IN facts "
          + "LET s = DOCUMENT(f._from) LET t = DOCUMENT(f._to) "
          + "LET hay = LOWER(CONCAT_SEPARATOR(' ', f.fact, s.name, t.name)) "
          + "LET score = LENGTH(FOR tok IN @tokens FILTER CONTAINS(hay, tok) RETURN 1) "
          + "FILTER score > 0 "
          + "SORT score DESC, f.createdAt DESC, f._key ASC "
          + "LIMIT @limit "
          + "RETURN { uuid: f._key, fact: f.fact, sourceId: s._key, targetId: t._key, "
          + "sourceName: s.name, targetName: t.name, validFrom: f.validFrom, "
          + "validUntil: f.validUntil }";

  private static final String AQL_SEARCH_ENTITIES =
      "FOR n IN UNION((FOR e IN entities RETURN e), (FOR d IN documents RETURN d)) "
          + "LET hay = LOWER(CONCAT_SEPARATOR(' ', n.name, n.summary, n.content)) "
          + "LET score = LENGTH(FOR tok IN @tokens FILTER CONTAINS(hay, tok) RETURN 1) "
          + "FILTER score > 0 "
          + "SORT score DESC, n.createdAt DESC, n._key ASC "
          + "LIMIT @limit "
          + "RETURN n";

  private static final String AQL_LIST_NODES =
      "FOR n IN UNION((FOR d IN documents RETURN d), (FOR e IN entities RETURN e), "
          + "(FOR c IN concepts RETURN c)) "
          + "FILTER @label == null OR @label IN n.labels "
          + "SORT n.createdAt ASC, n._key ASC "
          + "LIMIT @limit "
          + "RETURN n";

  private static final String AQL_STATISTICS =
      "LET allEdges = UNION("
          + "(FOR e IN facts RETURN e), (FOR e IN hasConcept RETURN e), "
          + "(FOR e IN conceptHierarchy RETURN e)) "
          + "LET degrees = (FOR id IN FLATTEN((FOR e IN allEdges RETURN [e._from, e._to])) "
          + "COLLECT nodeId = id WITH COUNT INTO degree "
          + "SORT degree DESC, nodeId ASC RETURN { nodeId, degree }) "
          + "RETURN { "
          + "documents: LENGTH(documents), entities: LENGTH(entities), concepts: LENGTH(concepts), "
          + "facts: LENGTH(facts), hasConcept: LENGTH(hasConcept), "
          + "hierarchy: (FOR h IN conceptHierarchy COLLECT type = h.type WITH COUNT INTO n "
          + "RETURN { type, n }), "
          + "nodesWithConcepts: LENGTH(FOR e IN hasConcept COLLECT from = e._from RETURN 1), "
          + "connectedNodes: LENGTH(degrees), "
          + "degreeSum: SUM(degrees[*].degree), "
          + "mostConnected: (FOR d IN degrees LIMIT @topNodes LET node = DOCUMENT(d.nodeId) "
          + "RETURN { id: node._key, name: node.name, degree: d.degree }), "
          + "semanticTypes: (FOR c IN concepts FOR t IN NOT_NULL(c.semanticTypes, []) "
          + "COLLECT type = t WITH COUNT INTO n SORT n DESC, type ASC LIMIT @topTypes "
          + "RETURN { type, n }) }";

  private final GraphSettings settings;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ArangoDB arango;
  private ArangoDatabase db;

  public ArangoGraphStore(GraphSettings settings) {
    this.settings = settings;
  }

  /** Use an already connected database handle. */
  ArangoGraphStore(GraphSettings settings, ArangoDatabase database) {
    this.settings = settings;
    this.db = database;
  }

  @Override
  public synchronized void initialize() {
    if (closed.get()) throw new GraphConnectionClosedException(name());
    if (initialized.get()) return;
    try {
      if (db == null) {
        arango =
            new ArangoDB.Builder()
                .host(settings.host(), settings.port())
                .user(settings.user())
                .password(settings.password())
                .build();
        Collection<String> databases = arango.getDatabases();
        if (!databases.contains(settings.database())) {
          arango.createDatabase(settings.database());
        }
        db = arango.db(settings.database());
      }
      createCollectionIfNeeded(COLLECTION_DOCUMENTS, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_ENTITIES, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_CONCEPTS, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_FACTS, CollectionType.EDGES);
      createCollectionIfNeeded(COLLECTION_HAS_CONCEPT, CollectionType.EDGES);
      createCollectionIfNeeded(COLLECTION_HIERARCHY, CollectionType.EDGES);
    } catch (RuntimeException e) {
      throw new GraphException(
          "Failed to connect to ArangoDB at %s:%d".formatted(settings.host(), settings.port()), e);
    }
    initialized.set(true);
    log.info(
        "ArangoGraphStore initialized database '{}' at {}:{}",
        settings.database(),
        settings.host(),
        settings.port());
  }

  private void createCollectionIfNeeded(String name, CollectionType type) {
    if (!db.collection(name).exists()) {
      db.createCollection(name, new CollectionCreateOptions().type(type));
      log.debug("Created {} collection '{}'", type, name);
    }
  }

  @Override
  public boolean isOpen() {
    return initialized.get() && !closed.get();
  }

  @Override
  public String name() {
    return "arangodb";
  }

  @Override
  public String upsertDocument(
      String name, String content, String sourceDescription, Instant referenceTime) {
    ensureOpen();
    String key = GraphSchema.newNodeId();
    String now = Instant.now().toString();
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("_key", key);
    doc.put("name", name == null ? "" : name);
    doc.put("labels", List.of(GraphSchema.DOCUMENT));
    doc.put("content", content == null ? "" : content);
    doc.put("sourceDescription", sourceDescription == null ? "" : sourceDescription);
    doc.put("referenceTime", (referenceTime == null ? Instant.now() : referenceTime).toString());
    doc.put("createdAt", now);
    query("INSERT @doc INTO documents RETURN NEW._key", Map.of("doc", doc));
    return key;
  }

  @Override
  public String upsertConcept(String conceptId, ConceptDetails details) {
    ensureOpen();
    if (conceptId == null || conceptId.isBlank()) {
      throw new ValidationException("conceptId must not be blank");
    }
    String key = GraphSchema.conceptNodeId(conceptId);
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("name", GraphSchema.conceptNodeName(conceptId));
    doc.put("labels", List.of(GraphSchema.CONCEPT));
    doc.put("conceptId", conceptId);
    if (details != null) {
      doc.put("canonicalName", details.canonicalName());
      doc.put("semanticTypes", details.semanticCategories());
      doc.put("definitions", details.definitions());
      doc.put("attributes", details.attributes());
      if (!details.definitions().isEmpty()) doc.put("summary", details.definitions().get(0));
    }
    Map<String, Object> bind = new HashMap<>();
    bind.put("key", key);
    bind.put("doc", doc);
    bind.put("now", Instant.now().toString());
    query(AQL_UPSERT_CONCEPT, bind);
    return key;
  }

  @Override
  public boolean linkConceptToNode(
      String nodeId, String conceptId, Map<String, Object> relationProps) {
    ensureOpen();
    Optional<String> from = resolveNodeId(nodeId);
    String conceptKey = GraphSchema.conceptNodeId(conceptId);
    Optional<String> to = resolveNodeId(conceptKey);
    if (from.isEmpty() || to.isEmpty()) {
      log.warn("Cannot link {} to concept {}: endpoint missing", nodeId, conceptId);
      return false;
    }
    mergeEdge(
        COLLECTION_HAS_CONCEPT,
        nodeId,
        from.get(),
        GraphSchema.HAS_CONCEPT,
        conceptKey,
        to.get(),
        relationProps);
    return true;
  }

  @Override
  public boolean linkConceptHierarchy(String parentConceptId, String childConceptId) {
    ensureOpen();
    String parentKey = GraphSchema.conceptNodeId(parentConceptId);
    String childKey = GraphSchema.conceptNodeId(childConceptId);
    Optional<String> parent = resolveNodeId(parentKey);
    Optional<String> child = resolveNodeId(childKey);
    if (parent.isEmpty() || child.isEmpty()) {
      log.warn(
          "Cannot link hierarchy {} -> {}: concept node missing", parentConceptId, childConceptId);
      return false;
    }
    mergeEdge(
        COLLECTION_HIERARCHY,
        parentKey,
        parent.get(),
        GraphSchema.BROADER_THAN,
        childKey,
        child.get(),
        Map.of());
    mergeEdge(
        COLLECTION_HIERARCHY,
        childKey,
        child.get(),
        GraphSchema.NARROWER_THAN,
        parentKey,
        parent.get(),
        Map.of());
    return true;
  }

  @Override
  public SearchOutcome<RetrievedFact> searchFacts(String query, int limit) {
    ensureOpen();
    List<String> tokens = QueryTokens.tokenize(query);
    if (tokens.isEmpty() || limit <= 0) return SearchOutcome.ok(List.of());
    try {
      List<RetrievedFact> out = new ArrayList<>();
      for (Map<String, Object> row :
          query(AQL_SEARCH_FACTS, Map.of("tokens", tokens, "limit", limit))) {
        out.add(
            new RetrievedFact(
                str(row.get("uuid")),
                str(row.get("fact")),
                str(row.get("sourceId")),
                str(row.get("targetId")),
                str(row.get("sourceName")),
                str(row.get("targetName")),
                instant(row.get("validFrom")),
                instant(row.get("validUntil"))));
      }
      return SearchOutcome.ok(out);
    } catch (GraphException e) {
      log.warn("Fact search degraded: {}", e.getMessage(), e);
      return SearchOutcome.degraded(e.getMessage());
    }
  }

  @Override
  public SearchOutcome<RetrievedEntity> searchEntities(String query, int limit) {
    ensureOpen();
    List<String> tokens = QueryTokens.tokenize(query);
    if (tokens.isEmpty() || limit <= 0) return SearchOutcome.ok(List.of());
    try {
      List<RetrievedEntity> out = new ArrayList<>();
      for (Map<String, Object> row :
          query(AQL_SEARCH_ENTITIES, Map.of("tokens", tokens, "limit", limit))) {
        GraphNodeRecord n = toRecord(row);
        String summary = n.stringProperty("summary");
        if (summary == null || summary.isBlank()) summary = n.stringProperty("content");
        Map<String, Object> attributes = new LinkedHashMap<>(n.properties());
        attributes.remove("summary");
        out.add(
            new RetrievedEntity(
                n.uuid(), n.name(), summary, n.labels(), n.createdAt(), attributes));
      }
      return SearchOutcome.ok(out);
    } catch (GraphException e) {
      log.warn("Entity search degraded: {}", e.getMessage(), e);
      return SearchOutcome.degraded(e.getMessage());
    }
  }

  @Override
  public String addEntity(
      String name, String summary, List<String> labels, Map<String, Object> attributes) {
    ensureOpen();
    if (name == null || name.isBlank()) throw new ValidationException("name must not be blank");
    Set<String> allLabels = new LinkedHashSet<>();
    allLabels.add(GraphSchema.ENTITY);
    if (labels != null) allLabels.addAll(labels);
    String key = GraphSchema.newNodeId();
    Map<String, Object> doc = new LinkedHashMap<>();
    if (attributes != null) doc.putAll(attributes);
    doc.put("_key", key);
    doc.put("name", name);
    doc.put("labels", new ArrayList<>(allLabels));
    doc.put("summary", summary == null ? "" : summary);
    doc.put("createdAt", Instant.now().toString());
    query("INSERT @doc INTO entities RETURN NEW._key", Map.of("doc", doc));
    return key;
  }

  @Override
  public String addFact(
      String sourceNodeId,
      String targetNodeId,
      String fact,
      Instant validFrom,
      Instant validUntil) {
    ensureOpen();
    Optional<String> from = resolveNodeId(sourceNodeId);
    Optional<String> to = resolveNodeId(targetNodeId);
    if (from.isEmpty() || to.isEmpty()) {
      throw new ValidationException(
          "Fact endpoints must exist: %s -> %s".formatted(sourceNodeId, targetNodeId));
    }
    String key = GraphSchema.newNodeId();
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("_key", key);
    doc.put("_from", from.get());
    doc.put("_to", to.get());
    doc.put("type", GraphSchema.RELATES_TO);
    doc.put("fact", fact == null ? "" : fact);
    doc.put("validFrom", validFrom == null ? null : validFrom.toString());
    doc.put("validUntil", validUntil == null ? null : validUntil.toString());
    doc.put("createdAt", Instant.now().toString());
    query("INSERT @doc INTO facts RETURN NEW._key", Map.of("doc", doc));
    return key;
  }

  @Override
  public Optional<GraphNodeRecord> getNode(String nodeId) {
    ensureOpen();
    if (!isValidKey(nodeId)) return Optional.empty();
    List<Map<String, Object>> rows =
        query(
            "FOR id IN @ids LET d = DOCUMENT(id) FILTER d != null LIMIT 1 RETURN d",
            Map.of("ids", candidateIds(nodeId)));
    return rows.isEmpty() ? Optional.empty() : Optional.of(toRecord(rows.get(0)));
  }

  @Override
  public List<GraphNodeRecord> listNodes(String label, int limit) {
    ensureOpen();
    Map<String, Object> bind = new HashMap<>();
    bind.put("label", label);
    bind.put("limit", limit > 0 ? limit : Integer.MAX_VALUE);
    List<GraphNodeRecord> out = new ArrayList<>();
    for (Map<String, Object> row : query(AQL_LIST_NODES, bind)) {
      out.add(toRecord(row));
    }
    return out;
  }

  @Override
  public void clearAll() {
    ensureOpen();
    try {
      for (String c :
          List.of(
              COLLECTION_DOCUMENTS,
              COLLECTION_ENTITIES,
              COLLECTION_CONCEPTS,
              COLLECTION_FACTS,
              COLLECTION_HAS_CONCEPT,
              COLLECTION_HIERARCHY)) {
        db.collection(c).truncate();
      }
    } catch (RuntimeException e) {
      throw new GraphException("Failed to clear graph database " + settings.database(), e);
    }
    log.info("Cleared all collections in '{}'", settings.database());
  }

  @Override
  public GraphStatistics statistics() {
    ensureOpen();
    Map<String, Object> bind = new HashMap<>();
    bind.put("topNodes", GraphStatistics.MOST_CONNECTED);
    bind.put("topTypes", GraphStatistics.TOP_SEMANTIC_TYPES);
    List<Map<String, Object>> rows = query(AQL_STATISTICS, bind);
    if (rows.isEmpty()) {
      throw new GraphException("Statistics query returned no result");
    }
    Map<String, Object> row = rows.get(0);
    Map<String, Long> byLabel = new TreeMap<>();
    byLabel.put(GraphSchema.DOCUMENT, num(row.get("documents")));
    byLabel.put(GraphSchema.ENTITY, num(row.get("entities")));
    byLabel.put(GraphSchema.CONCEPT, num(row.get("concepts")));
    Map<String, Long> byType = new TreeMap<>();
    byType.put(GraphSchema.RELATES_TO, num(row.get("facts")));
    byType.put(GraphSchema.HAS_CONCEPT, num(row.get("hasConcept")));
    byType.putAll(typeCounts(row.get("hierarchy")));
    long totalNodes = byLabel.values().stream().mapToLong(Long::longValue).sum();
    long totalEdges = byType.values().stream().mapToLong(Long::longValue).sum();
    long conceptNodes = byLabel.get(GraphSchema.CONCEPT);
    long nodesWithConcepts = num(row.get("nodesWithConcepts"));

    List<GraphStatistics.ConnectedNode> mostConnected = new ArrayList<>();
    if (row.get("mostConnected") instanceof List<?> list) {
      for (Object o : list) {
        if (o instanceof Map<?, ?> m && m.get("id") != null) {
          mostConnected.add(
              new GraphStatistics.ConnectedNode(
                  str(m.get("id")), str(m.get("name")), num(m.get("degree"))));
        }
      }
    }
    return new GraphStatistics(
        byLabel,
        byType,
        totalNodes,
        totalEdges,
        conceptNodes,
        nodesWithConcepts,
        GraphStatistics.coveragePercent(totalNodes, conceptNodes, nodesWithConcepts),
        GraphStatistics.averageDegree(totalNodes, num(row.get("degreeSum"))),
        Math.max(0, totalNodes - num(row.get("connectedNodes"))),
        typeCounts(row.get("semanticTypes")),
        mostConnected);
  }

  /** Reads {@code [{ type, n }]} rows, keeping their order. */
  private static Map<String, Long> typeCounts(Object rows) {
    Map<String, Long> out = new LinkedHashMap<>();
    if (rows instanceof List<?> list) {
      for (Object o : list) {
        if (o instanceof Map<?, ?> m && m.get("type") != null) {
          out.put(String.valueOf(m.get("type")), num(m.get("n")));
        }
      }
    }
    return out;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    initialized.set(false);
    if (arango != null) {
      try {
        arango.shutdown();
      } catch (RuntimeException e) {
        log.warn("Error while shutting down ArangoDB connection: {}", e.getMessage(), e);
      }
    }
    log.info("ArangoGraphStore closed");
  }

  private void mergeEdge(
      String collection,
      String fromKey,
      String fromId,
      String type,
      String toKey,
      String toId,
      Map<String, Object> props) {
    Map<String, Object> bind = new HashMap<>();
    bind.put("@edges", collection);
    bind.put("key", GraphSchema.edgeId(fromKey, type, toKey));
    bind.put("from", fromId);
    bind.put("to", toId);
    bind.put("type", type);
    bind.put("props", props == null ? Map.of() : props);
    bind.put("now", Instant.now().toString());
    query(AQL_MERGE_EDGE, bind);
  }

  /** Full document id ({@code collection/key}) of a node, looked up across node collections. */
  private Optional<String> resolveNodeId(String key) {
    if (!isValidKey(key)) return Optional.empty();
    List<String> ids = run(AQL_RESOLVE_NODE, String.class, Map.of("ids", candidateIds(key)));
    return ids.isEmpty() ? Optional.empty() : Optional.ofNullable(ids.get(0));
  }

  private static List<String> candidateIds(String key) {
    List<String> ids = new ArrayList<>();
    for (String c : NODE_COLLECTIONS) ids.add(c + "/" + key);
    return ids;
  }

  static boolean isValidKey(String key) {
    return key != null && VALID_KEY.matcher(key).matches();
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private List<Map<String, Object>> query(String aql, Map<String, Object> bind) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map m : run(aql, Map.class, bind)) {
      if (m != null) out.add((Map<String, Object>) m);
    }
    return out;
  }

  private <T> List<T> run(String aql, Class<T> type, Map<String, Object> bind) {
    log.trace("AQL: {} bind: {}", aql, bind.keySet());
    try (ArangoCursor<T> cursor = db.query(aql, type, bind, new AqlQueryOptions())) {
      return cursor.asListRemaining();
    } catch (Exception e) {
      throw new GraphException("AQL query failed: " + e.getMessage(), e);
    }
  }

  private static GraphNodeRecord toRecord(Map<String, Object> doc) {
    Map<String, Object> props = new LinkedHashMap<>();
    Set<String> labels = new LinkedHashSet<>();
    for (Map.Entry<String, Object> e : doc.entrySet()) {
      String k = e.getKey();
      if (k.startsWith("_") || k.equals("name") || k.equals("createdAt")) continue;
      if (k.equals("labels") && e.getValue() instanceof List<?> list) {
        for (Object l : list) labels.add(String.valueOf(l));
        continue;
      }
      props.put(k, e.getValue());
    }
    return new GraphNodeRecord(
        str(doc.get("_key")), str(doc.get("name")), labels, props, instant(doc.get("createdAt")));
  }

  private static String str(Object o) {
    return o == null ? null : String.valueOf(o);
  }

  private static long num(Object o) {
    return o instanceof Number n ? n.longValue() : 0L;
  }

  private static Instant instant(Object o) {
    if (o == null) return null;
    try {
      return Instant.parse(String.valueOf(o));
    } catch (DateTimeParseException e) {
      log.debug("Ignoring unparsable timestamp '{}'", o);
      return null;
    }
  }

  private void ensureOpen() {
    if (closed.get()) throw new GraphConnectionClosedException(name());
    if (!initialized.get() || db == null) {
      throw new StateException("Graph store '%s' is not initialized".formatted(name()));
    }
  }
}
