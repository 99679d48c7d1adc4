package com.gentoro.medrag.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Keyword extraction shared by the drivers' text search. */
public final class QueryTokens {
  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "and", "for", "are", "was", "were", "what", "which", "who", "whom", "how", "why",
          "when", "where", "with", "from", "that", "this", "these", "those", "does", "did", "can",
          "could", "should", "would", "has", "have", "had", "its", "into", "about", "there",
          "their", "than", "then", "been", "being", "not", "any", "all");

  private QueryTokens() {}

  /** Lower-cased distinct keywords of three or more characters, in query order. */
  public static List<String> tokenize(String query) {
    if (query == null || query.isBlank()) return List.of();
    Set<String> out = new LinkedHashSet<>();
    for (String raw : query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (raw.length() < 3 || STOP_WORDS.contains(raw)) continue;
      out.add(raw);
    }
    return new ArrayList<>(out);
  }

  /** Number of tokens contained in {@code haystack}, case-insensitive. */
  public static int score(List<String> tokens, String haystack) {
    if (haystack == null || haystack.isEmpty()) return 0;
    String lower = haystack.toLowerCase(Locale.ROOT);
    int score = 0;
    for (String t : tokens) {
      if (lower.contains(t)) score++;
    }
    return score;
  }
}
