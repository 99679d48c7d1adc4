package com.gentoro.medrag.retrieval;

import com.gentoro.medrag.concept.ConceptDetails;
import com.gentoro.medrag.enrichment.ConceptAnnotation;
import com.gentoro.medrag.graph.RetrievedEntity;
import com.gentoro.medrag.graph.RetrievedFact;
import com.gentoro.medrag.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Text rendering of retrieval results. Never reorders or drops items; limits are the search's
 * business.
 */
public class ContextFormatter {
  static final String FACTS_HEADER = "Relevant Facts from Knowledge Graph:";
  static final String ENTITIES_HEADER = "Relevant Entity Summaries:";
  static final String CONCEPTS_HEADER = "Medical Terms and Concepts:";
  static final String UNKNOWN_ENTITY_PREFIX = "Entity_";
  static final int UNKNOWN_ENTITY_ID_CHARS = 8;

  private final int summaryMaxChars;

  public ContextFormatter(int summaryMaxChars) {
    this.summaryMaxChars = summaryMaxChars;
  }

  /** {@code "<fact> (Source: <name>; Target: <name>)"}. */
  public String formatFact(RetrievedFact fact) {
    return "%s (Source: %s; Target: %s)"
        .formatted(
            fact.text(),
            nameOrId(fact.sourceName(), fact.sourceNodeId()),
            nameOrId(fact.targetName(), fact.targetNodeId()));
  }

  /** {@code "<name>: <summary>"}, summary cut to the configured length. */
  public String formatEntity(RetrievedEntity entity) {
    return entity.name() + ": " + StringUtility.truncate(entity.summary(), summaryMaxChars);
  }

  /**
   * Sections in fixed order: facts, entity summaries, concepts. Empty sections are left out
   * entirely, header included.
   */
  public String render(
      List<String> facts, List<String> entitySummaries, List<ConceptAnnotation> concepts) {
    List<String> lines = new ArrayList<>();
    appendNumbered(lines, FACTS_HEADER, facts);
    appendNumbered(lines, ENTITIES_HEADER, entitySummaries);
    String conceptSection = formatConcepts(concepts);
    if (!conceptSection.isEmpty()) {
      lines.add(conceptSection);
      lines.add("");
    }
    return String.join("\n", lines);
  }

  /** Concept annotation block, or an empty string when there are no annotations. */
  public String formatConcepts(List<ConceptAnnotation> concepts) {
    if (concepts == null || concepts.isEmpty()) return "";
    List<String> lines = new ArrayList<>();
    lines.add(CONCEPTS_HEADER);
    for (ConceptAnnotation a : concepts) {
      lines.add("");
      lines.add(
          "- Term: %s (CUI: %s)".formatted(a.mention().surfaceForm(), a.mention().conceptId()));
      ConceptDetails d = a.details();
      if (d == null) continue;
      if (!d.semanticCategories().isEmpty()) {
        lines.add("  Types: " + String.join(", ", d.semanticCategories()));
      }
      if (!d.definitions().isEmpty()) {
        String definition = StringUtility.truncate(d.definitions().get(0), summaryMaxChars);
        lines.add("  Definition: " + definition);
      }
    }
    return String.join("\n", lines);
  }

  private static void appendNumbered(List<String> lines, String header, List<String> items) {
    if (items == null || items.isEmpty()) return;
    lines.add(header);
    for (int i = 0; i < items.size(); i++) {
      lines.add((i + 1) + ". " + items.get(i));
    }
    lines.add("");
  }

  private static String nameOrId(String name, String nodeId) {
    if (name != null && !name.isBlank()) return name;
    return UNKNOWN_ENTITY_PREFIX + StringUtility.head(nodeId, UNKNOWN_ENTITY_ID_CHARS);
  }
}
