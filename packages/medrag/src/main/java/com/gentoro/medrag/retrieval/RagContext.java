package com.gentoro.medrag.retrieval;

import com.gentoro.medrag.enrichment.ConceptAnnotation;
import java.util.List;
import java.util.Objects;

/**
 * Assembled retrieval context for one query. Built once by {@link ContextAssembler} and never
 * changed afterwards.
 *
 * @param facts formatted facts, in relevance order
 * @param entitySummaries formatted entity summaries, in relevance order
 * @param concepts concept annotations of the query text, in text order
 * @param renderedText the sections above rendered for the generator
 * @param factsDegraded fact search failed and was replaced by an empty result
 * @param entitiesDegraded entity search failed and was replaced by an empty result
 * @param conceptsDegraded concept annotation was requested but could not run
 */
public record RagContext(
    String query,
    List<String> facts,
    List<String> entitySummaries,
    List<ConceptAnnotation> concepts,
    String renderedText,
    boolean factsDegraded,
    boolean entitiesDegraded,
    boolean conceptsDegraded) {

  public RagContext {
    Objects.requireNonNull(query, "query");
    facts = List.copyOf(facts);
    entitySummaries = List.copyOf(entitySummaries);
    concepts = List.copyOf(concepts);
    renderedText = renderedText == null ? "" : renderedText;
  }

  public boolean isDegraded() {
    return factsDegraded || entitiesDegraded || conceptsDegraded;
  }
}
