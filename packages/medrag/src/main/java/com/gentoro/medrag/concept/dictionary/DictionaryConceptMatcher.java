package com.gentoro.medrag.concept.dictionary;

import com.gentoro.medrag.concept.CandidateMatch;
import com.gentoro.medrag.concept.ConceptMatcher;
import com.gentoro.medrag.config.MedRagSettings.MatcherSettings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dictionary-backed {@link ConceptMatcher}: enumerates word n-grams of the input and scores them
 * against dictionary terms by character-trigram Jaccard similarity. An exact normalized match
 * scores 1.0.
 */
public class DictionaryConceptMatcher implements ConceptMatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(DictionaryConceptMatcher.class);

  private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['\\-][\\p{L}\\p{N}]+)*");
  private static final int MIN_NGRAM_CHARS = 3;

  private final ConceptDictionary dictionary;
  private final double minSimilarity;
  private final int maxNgram;

  public DictionaryConceptMatcher(
      ConceptDictionary dictionary, double minSimilarity, int maxNgram) {
    this.dictionary = dictionary;
    this.minSimilarity = minSimilarity;
    this.maxNgram = Math.max(1, maxNgram);
  }

  /**
   * Builds a matcher from settings. Returns a matcher that reports itself unavailable when no
   * dictionary is configured or it cannot be read.
   */
  public static ConceptMatcher fromSettings(MatcherSettings settings) {
    String location = settings.dictionaryPath();
    if (location == null || location.isBlank()) {
      log.warn("matcher.dictionaryPath not configured, concept matching disabled");
      return Unavailable.INSTANCE;
    }
    Path path = Path.of(location);
    if (!Files.isReadable(path)) {
      log.warn("Concept dictionary {} is not readable, concept matching disabled", path);
      return Unavailable.INSTANCE;
    }
    try {
      return new DictionaryConceptMatcher(
          ConceptDictionary.load(path), settings.minSimilarity(), settings.maxNgram());
    } catch (RuntimeException e) {
      log.error("Error initializing concept dictionary from {}: {}", path, e.getMessage(), e);
      return Unavailable.INSTANCE;
    }
  }

  @Override
  public boolean isAvailable() {
    return dictionary.size() > 0;
  }

  @Override
  public List<CandidateMatch> candidates(String text) {
    List<int[]> tokens = new ArrayList<>();
    Matcher m = WORD.matcher(text);
    while (m.find()) {
      tokens.add(new int[] {m.start(), m.end()});
    }

    List<CandidateMatch> out = new ArrayList<>();
    for (int i = 0; i < tokens.size(); i++) {
      for (int j = i; j < tokens.size() && j - i < maxNgram; j++) {
        int start = tokens.get(i)[0];
        int end = tokens.get(j)[1];
        String ngram = text.substring(start, end);
        String normalized = ConceptDictionary.normalize(ngram);
        if (normalized.length() < MIN_NGRAM_CHARS) continue;
        collect(out, start, end, ngram, normalized);
      }
    }
    return out;
  }

  private void collect(List<CandidateMatch> out, int start, int end, String ngram, String norm) {
    List<ConceptDictionary.Entry> exact = dictionary.exact(norm);
    for (ConceptDictionary.Entry e : exact) {
      out.add(new CandidateMatch(start, end, ngram, e.term(), e.conceptId(), 1.0));
    }
    if (!exact.isEmpty() || minSimilarity >= 1.0) return;

    Set<String> grams = ConceptDictionary.trigrams(norm);
    for (Map.Entry<String, Integer> shared : dictionary.sharedTrigrams(grams).entrySet()) {
      int both = shared.getValue();
      int union = grams.size() + dictionary.trigramCount(shared.getKey()) - both;
      double similarity = union == 0 ? 0.0 : (double) both / union;
      if (similarity < minSimilarity) continue;
      for (ConceptDictionary.Entry e : dictionary.exact(shared.getKey())) {
        out.add(new CandidateMatch(start, end, ngram, e.term(), e.conceptId(), similarity));
      }
    }
  }

  private enum Unavailable implements ConceptMatcher {
    INSTANCE;

    @Override
    public boolean isAvailable() {
      return false;
    }

    @Override
    public List<CandidateMatch> candidates(String text) {
      return List.of();
    }
  }
}
