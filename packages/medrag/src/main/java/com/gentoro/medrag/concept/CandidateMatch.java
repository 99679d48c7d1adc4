package com.gentoro.medrag.concept;

/**
 * Raw candidate produced by a {@link ConceptMatcher} before best-match selection.
 *
 * @param start inclusive character offset of the matched n-gram
 * @param end exclusive character offset of the matched n-gram
 * @param ngram text of the n-gram as it appears in the input
 * @param term dictionary term the n-gram was matched against
 * @param conceptId concept the dictionary term belongs to
 * @param similarity matcher similarity in [0, 1]
 */
public record CandidateMatch(
    int start, int end, String ngram, String term, String conceptId, double similarity) {}
