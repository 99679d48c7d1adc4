package com.gentoro.medrag.concept;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns raw matcher candidates into {@link Mention}s.
 *
 * <p>Candidates below the confidence threshold are dropped first. The rest are taken best first
 * (highest similarity, then longest surface form, then lexicographically lowest concept id) and a
 * candidate is kept only when its span overlaps no span kept before it. Mentions come back in text
 * order.
 *
 * <p>An unavailable or failing matcher yields an empty result and a capability warning; "no
 * mentions" is a valid answer for every caller.
 */
public class ConceptMatcherAdapter {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(ConceptMatcherAdapter.class);

  static final Comparator<CandidateMatch> BEST_FIRST =
      Comparator.comparingDouble(CandidateMatch::similarity)
          .reversed()
          .thenComparing(
              Comparator.comparingInt((CandidateMatch c) -> c.end() - c.start()).reversed())
          .thenComparing(CandidateMatch::conceptId)
          .thenComparingInt(CandidateMatch::start);

  private final ConceptMatcher matcher;
  private final double confidenceThreshold;

  public ConceptMatcherAdapter(ConceptMatcher matcher, double confidenceThreshold) {
    this.matcher = matcher;
    this.confidenceThreshold = confidenceThreshold;
  }

  public boolean isAvailable() {
    return matcher != null && matcher.isAvailable();
  }

  public List<Mention> match(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    if (!isAvailable()) {
      log.warn("Concept matcher unavailable, skipping concept extraction (capability degraded)");
      return List.of();
    }

    List<CandidateMatch> candidates;
    try {
      candidates = matcher.candidates(text);
    } catch (RuntimeException e) {
      log.warn(
          "Concept matcher failed, returning no mentions (capability degraded): {}",
          e.getMessage(),
          e);
      return List.of();
    }

    List<CandidateMatch> kept = new ArrayList<>();
    for (CandidateMatch c : candidates) {
      if (c.similarity() >= confidenceThreshold && c.similarity() <= 1.0) {
        kept.add(c);
      }
    }
    kept.sort(BEST_FIRST);

    List<CandidateMatch> accepted = new ArrayList<>();
    for (CandidateMatch c : kept) {
      if (accepted.stream().noneMatch(a -> overlaps(a, c))) {
        accepted.add(c);
      }
    }
    accepted.sort(Comparator.comparingInt(CandidateMatch::start));

    List<Mention> mentions = new ArrayList<>();
    for (CandidateMatch c : accepted) {
      mentions.add(new Mention(c.ngram(), c.conceptId(), c.similarity(), c.start(), c.end()));
    }

    log.debug("Extracted {} mentions from {} candidates", mentions.size(), candidates.size());
    return mentions;
  }

  private static boolean overlaps(CandidateMatch a, CandidateMatch b) {
    return a.start() < b.end() && b.start() < a.end();
  }
}
