package com.gentoro.medrag.graph;

import com.gentoro.medrag.concept.ConceptDetails;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage contract used by enrichment, retrieval and ingest.
 *
 * <p>Implementations own one live connection, opened by {@link #initialize()} and released by
 * {@link #close()}. Every operation invoked after close, search included, fails with {@link
 * com.gentoro.medrag.exception.GraphConnectionClosedException}.
 *
 * <p>Identity rules shared by all drivers:
 *
 * <ul>
 *   <li>document and entity nodes get a random UUID per call;
 *   <li>a concept node id is {@link GraphSchema#conceptNodeId(String)}, a pure function of the
 *       concept id;
 *   <li>an edge is identified by {@code (source, type, target)}; merging an existing edge updates
 *       its properties and never adds a second one.
 * </ul>
 *
 * <p>Queries are always parameterized; no identifier or user text is spliced into query text.
 */
public interface GraphStore extends AutoCloseable {

  /** Open the connection and create missing collections. Idempotent. */
  void initialize();

  boolean isOpen();

  /** Driver id, used in logs and error messages. */
  String name();

  /** Create a new document node. Each call creates a node; identity is not derived from content. */
  String upsertDocument(
      String name, String content, String sourceDescription, Instant referenceTime);

  /**
   * Create or update the concept node for {@code conceptId}. Repeated calls return the same id and
   * replace stored attributes instead of accumulating them.
   */
  String upsertConcept(String conceptId, ConceptDetails details);

  /**
   * Merge a {@link GraphSchema#HAS_CONCEPT} edge from {@code nodeId} to the concept node.
   *
   * @return false when either endpoint does not exist
   */
  boolean linkConceptToNode(String nodeId, String conceptId, Map<String, Object> relationProps);

  /**
   * Merge the {@code parent-BROADER_THAN->child} and {@code child-NARROWER_THAN->parent} edges.
   *
   * @return false when either concept node does not exist
   */
  boolean linkConceptHierarchy(String parentConceptId, String childConceptId);

  /** Relevance-ranked facts, at most {@code limit}. Internal failures yield a degraded result. */
  SearchOutcome<RetrievedFact> searchFacts(String query, int limit);

  /**
   * Relevance-ranked entities, at most {@code limit}. Internal failures yield a degraded result.
   */
  SearchOutcome<RetrievedEntity> searchEntities(String query, int limit);

  /** Create an entity node; used by loaders that bring their own extracted entities. */
  String addEntity(
      String name, String summary, List<String> labels, Map<String, Object> attributes);

  /** Create a fact edge between two existing entity nodes. */
  String addFact(
      String sourceNodeId,
      String targetNodeId,
      String fact,
      Instant validFrom,
      Instant validUntil);

  Optional<GraphNodeRecord> getNode(String nodeId);

  /**
   * Nodes in creation order.
   *
   * @param label restrict to nodes carrying this label, or null for all
   * @param limit maximum number of nodes, or a non-positive value for no limit
   */
  List<GraphNodeRecord> listNodes(String label, int limit);

  void clearAll();

  GraphStatistics statistics();

  @Override
  void close();
}
