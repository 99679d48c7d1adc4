package com.gentoro.medrag.pipeline;

import java.util.List;

/**
 * Answer to one question, with what was used to produce it.
 *
 * @param sample the first few facts and concept terms of the context, for display
 */
public record QaResponse(String query, String answer, Metadata metadata, Sample sample) {

  public record Metadata(
      int numFacts,
      int numEntities,
      int numConcepts,
      String model,
      boolean factsDegraded,
      boolean entitiesDegraded,
      boolean conceptsDegraded,
      String error) {}

  public record Sample(List<String> facts, List<String> concepts) {
    public Sample {
      facts = facts == null ? List.of() : List.copyOf(facts);
      concepts = concepts == null ? List.of() : List.copyOf(concepts);
    }
  }
}
