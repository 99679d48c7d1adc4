package com.gentoro.medrag.enrichment;

import com.gentoro.medrag.concept.ConceptDetails;
import com.gentoro.medrag.concept.ConceptKnowledgeClient;
import com.gentoro.medrag.concept.ConceptLookupSession;
import com.gentoro.medrag.concept.ConceptMatcherAdapter;
import com.gentoro.medrag.concept.ConceptRelation;
import com.gentoro.medrag.concept.Mention;
import com.gentoro.medrag.exception.AuthenticationException;
import com.gentoro.medrag.exception.GraphConnectionClosedException;
import com.gentoro.medrag.exception.NotFoundException;
import com.gentoro.medrag.exception.ValidationException;
import com.gentoro.medrag.graph.GraphNodeRecord;
import com.gentoro.medrag.graph.GraphSchema;
import com.gentoro.medrag.graph.GraphStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Links graph nodes to canonical concepts and expands the concept hierarchy.
 *
 * <p>Per-concept problems never abort a call: absent details are counted as skipped, errors as
 * failed. Rejected credentials and a closed graph connection do abort, since every following call
 * would fail the same way. Everything written before such an abort stays in the graph.
 */
public class EnrichmentEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(EnrichmentEngine.class);

  static final String SIMILARITY = "similarity";
  static final String SURFACE_FORM = "surfaceForm";

  private final ConceptMatcherAdapter matcher;
  private final ConceptKnowledgeClient knowledge;
  private final GraphStore graph;

  public EnrichmentEngine(
      ConceptMatcherAdapter matcher, ConceptKnowledgeClient knowledge, GraphStore graph) {
    this.matcher = matcher;
    this.knowledge = knowledge;
    this.graph = graph;
  }

  /** Start a lookup scope; memoization and the credential short-circuit last as long as it does. */
  public ConceptLookupSession newLookupSession() {
    return new ConceptLookupSession(knowledge);
  }

  public EnrichmentReport enrich(String nodeId, String text) {
    return enrich(nodeId, text, newLookupSession());
  }

  public EnrichmentReport enrich(String nodeId, String text, ConceptLookupSession lookups) {
    List<Mention> mentions = matcher.match(text);
    if (mentions.isEmpty()) {
      log.debug("No concept mentions in node {}", nodeId);
      return EnrichmentReport.noOp(nodeId);
    }

    Map<String, Mention> distinct = distinctByConcept(mentions);
    int linked = 0;
    int skipped = 0;
    int failed = 0;
    for (Mention m : distinct.values()) {
      String conceptId = m.conceptId();
      try {
        Optional<ConceptDetails> details = lookups.details(conceptId);
        if (details.isEmpty()) {
          log.debug("No details for concept {} ('{}'), skipping", conceptId, m.surfaceForm());
          skipped++;
          continue;
        }
        graph.upsertConcept(conceptId, details.get());
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(SIMILARITY, m.confidence());
        props.put(SURFACE_FORM, m.surfaceForm());
        if (graph.linkConceptToNode(nodeId, conceptId, props)) {
          linked++;
        } else {
          failed++;
        }
      } catch (AuthenticationException | GraphConnectionClosedException e) {
        throw e;
      } catch (RuntimeException e) {
        failed++;
        log.warn("Failed to link concept {} to node {}: {}", conceptId, nodeId, e.getMessage(), e);
      }
    }

    log.info(
        "Enriched node {}: {} linked, {} skipped, {} failed", nodeId, linked, skipped, failed);
    return new EnrichmentReport(
        nodeId, EnrichmentReport.Status.COMPLETED, distinct.size(), linked, skipped, failed);
  }

  /** Enrich a stored node from its own text. */
  public EnrichmentReport enrichNode(String nodeId) {
    GraphNodeRecord node =
        graph.getNode(nodeId).orElseThrow(() -> new NotFoundException("Node not found: " + nodeId));
    return enrich(nodeId, NodeTextExtractor.extract(node));
  }

  /**
   * Enrich every stored node, optionally restricted to one label. Concept nodes are never enriched
   * themselves. One lookup scope serves the whole batch.
   */
  public BatchEnrichmentReport enrichAll(String label, int limit) {
    List<GraphNodeRecord> nodes = graph.listNodes(label, limit);
    log.info("Enriching {} nodes{}", nodes.size(), label == null ? "" : " labeled " + label);
    ConceptLookupSession lookups = newLookupSession();
    BatchEnrichmentReport total = BatchEnrichmentReport.empty();
    int i = 0;
    for (GraphNodeRecord node : nodes) {
      i++;
      if (node.hasLabel(GraphSchema.CONCEPT)) continue;
      String text = NodeTextExtractor.extract(node);
      try {
        total =
            text.isBlank()
                ? total.plus(EnrichmentReport.noOp(node.uuid()))
                : total.plus(enrich(node.uuid(), text, lookups));
      } catch (AuthenticationException | GraphConnectionClosedException e) {
        log.error(
            "Stopping batch enrichment at node {}/{} ({}): {}",
            i,
            nodes.size(),
            node.uuid(),
            e.getMessage());
        throw e;
      } catch (RuntimeException e) {
        log.warn("Failed to enrich node {}: {}", node.uuid(), e.getMessage(), e);
        total = total.plusFailedNode();
      }
      if (i % 10 == 0) {
        log.info("Processed {}/{} nodes", i, nodes.size());
      }
    }
    log.info("Batch enrichment finished: {}", total);
    return total;
  }

  /**
   * Annotate free text with concepts without touching the graph. Mentions keep text order; a
   * concept appearing more than once is annotated at its first occurrence.
   *
   * @throws AuthenticationException when the terminology service rejects the credentials
   */
  public List<ConceptAnnotation> annotate(String text, ConceptLookupSession lookups) {
    List<ConceptAnnotation> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Mention m : matcher.match(text)) {
      if (!seen.add(m.conceptId())) continue;
      ConceptDetails details = null;
      try {
        details = lookups.details(m.conceptId()).orElse(null);
      } catch (AuthenticationException e) {
        throw e;
      } catch (RuntimeException e) {
        log.warn("Concept lookup failed for {}: {}", m.conceptId(), e.getMessage(), e);
      }
      out.add(new ConceptAnnotation(m, details));
    }
    return out;
  }

  /**
   * Breadth-first walk over hierarchy relations starting at {@code conceptId}, up to {@code depth}
   * levels. Every concept id is looked up at most once per call, so cyclic relations terminate.
   */
  public HierarchyExpansionReport expandHierarchy(String conceptId, int depth) {
    if (conceptId == null || conceptId.isBlank()) {
      throw new ValidationException("conceptId must not be blank");
    }
    if (depth < 1) {
      throw new ValidationException("depth must be at least 1: " + depth);
    }
    ConceptLookupSession lookups = newLookupSession();

    Optional<ConceptDetails> root = lookups.details(conceptId);
    if (root.isEmpty()) {
      log.warn("No details for concept {}, hierarchy not expanded", conceptId);
      return HierarchyExpansionReport.rootMissing(conceptId);
    }
    graph.upsertConcept(conceptId, root.get());

    Set<String> visited = new LinkedHashSet<>();
    Set<String> stored = new HashSet<>();
    visited.add(conceptId);
    stored.add(conceptId);
    int upserted = 1;
    int edges = 0;
    int skipped = 0;

    Deque<Frontier> queue = new ArrayDeque<>();
    queue.add(new Frontier(conceptId, 0));
    while (!queue.isEmpty()) {
      Frontier current = queue.poll();
      if (current.level() >= depth) continue;

      for (ConceptRelation rel : lookups.relations(current.conceptId())) {
        String other =
            rel.sourceConceptId().equals(current.conceptId())
                ? rel.targetConceptId()
                : rel.sourceConceptId();
        try {
          if (visited.add(other)) {
            Optional<ConceptDetails> details = lookups.details(other);
            if (details.isEmpty()) {
              skipped++;
              continue;
            }
            graph.upsertConcept(other, details.get());
            stored.add(other);
            upserted++;
            queue.add(new Frontier(other, current.level() + 1));
          } else if (!stored.contains(other)) {
            skipped++;
            continue;
          }
          if (graph.linkConceptHierarchy(rel.parentConceptId(), rel.childConceptId())) {
            edges += 2;
          } else {
            skipped++;
          }
        } catch (AuthenticationException | GraphConnectionClosedException e) {
          throw e;
        } catch (RuntimeException e) {
          skipped++;
          log.warn(
              "Failed to expand relation {} -> {}: {}",
              rel.sourceConceptId(),
              rel.targetConceptId(),
              e.getMessage(),
              e);
        }
      }
    }

    log.info(
        "Expanded hierarchy of {} to depth {}: {} concepts visited, {} upserted, {} edges",
        conceptId,
        depth,
        visited.size(),
        upserted,
        edges);
    return new HierarchyExpansionReport(
        conceptId, true, new ArrayList<>(visited), upserted, edges, skipped);
  }

  /** Highest-confidence mention per concept; on equal confidence the earlier mention wins. */
  static Map<String, Mention> distinctByConcept(List<Mention> mentions) {
    Map<String, Mention> out = new LinkedHashMap<>();
    for (Mention m : mentions) {
      Mention prev = out.get(m.conceptId());
      if (prev == null || m.confidence() > prev.confidence()) {
        out.put(m.conceptId(), m);
      }
    }
    return out;
  }

  private record Frontier(String conceptId, int level) {}
}
