package com.gentoro.medrag.enrichment;

import java.util.List;

/**
 * Outcome of {@link EnrichmentEngine#expandHierarchy(String, int)}.
 *
 * @param visited concept ids whose details were requested, in visiting order
 * @param conceptsUpserted concept nodes written, root included
 * @param edgesMerged directed hierarchy edges merged (two per linked pair)
 * @param skippedRelations relations dropped because the related concept had no details or failed
 */
public record HierarchyExpansionReport(
    String rootConceptId,
    boolean rootFound,
    List<String> visited,
    int conceptsUpserted,
    int edgesMerged,
    int skippedRelations) {

  public HierarchyExpansionReport {
    visited = visited == null ? List.of() : List.copyOf(visited);
  }

  static HierarchyExpansionReport rootMissing(String rootConceptId) {
    return new HierarchyExpansionReport(rootConceptId, false, List.of(rootConceptId), 0, 0, 0);
  }
}
