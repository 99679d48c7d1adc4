package com.gentoro.medrag.concept;

import java.util.List;

/**
 * Seam for the dictionary/approximate-string matcher. Implementations report every candidate they
 * find, overlapping ones included; selection policy lives in {@link ConceptMatcherAdapter}.
 */
public interface ConceptMatcher {

  /** @return false when the matcher could not be set up (e.g. dictionary missing). */
  default boolean isAvailable() {
    return true;
  }

  List<CandidateMatch> candidates(String text);
}
