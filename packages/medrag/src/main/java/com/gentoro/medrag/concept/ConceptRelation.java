package com.gentoro.medrag.concept;

import java.util.Objects;

/** A hierarchy relation between two concepts. */
public record ConceptRelation(String sourceConceptId, String targetConceptId, RelationKind kind) {
  public ConceptRelation {
    Objects.requireNonNull(sourceConceptId, "sourceConceptId");
    Objects.requireNonNull(targetConceptId, "targetConceptId");
    Objects.requireNonNull(kind, "kind");
  }

  /** The broader concept of the pair. */
  public String parentConceptId() {
    return kind == RelationKind.BROADER ? targetConceptId : sourceConceptId;
  }

  /** The narrower concept of the pair. */
  public String childConceptId() {
    return kind == RelationKind.BROADER ? sourceConceptId : targetConceptId;
  }
}
