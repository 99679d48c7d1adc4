package com.gentoro.medrag.concept;

/** Hierarchy direction of a {@link ConceptRelation}, seen from its source concept. */
public enum RelationKind {
  /** The target concept is broader than the source. */
  BROADER,
  /** The target concept is narrower than the source. */
  NARROWER
}
