package com.gentoro.medrag.concept.dictionary;

import com.gentoro.medrag.exception.ConfigException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * In-memory term dictionary with an exact index and a character-trigram index.
 *
 * <p>Source format is one entry per line, {@code conceptId<TAB>term}; blank lines and lines
 * starting with {@code #} are ignored.
 */
public final class ConceptDictionary {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(ConceptDictionary.class);

  /** A dictionary term and the concept it names. */
  public record Entry(String conceptId, String term) {}

  private final Map<String, List<Entry>> byNormalizedTerm = new LinkedHashMap<>();
  private final Map<String, Set<String>> termsByTrigram = new HashMap<>();
  private final Map<String, Integer> trigramCounts = new HashMap<>();

  public static ConceptDictionary load(Path path) {
    ConceptDictionary dictionary = new ConceptDictionary();
    int lineNo = 0;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNo++;
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
        int tab = trimmed.indexOf('\t');
        if (tab <= 0 || tab == trimmed.length() - 1) {
          log.debug("Skipping malformed dictionary line {} in {}", lineNo, path);
          continue;
        }
        dictionary.add(trimmed.substring(0, tab).strip(), trimmed.substring(tab + 1).strip());
      }
    } catch (IOException e) {
      throw new ConfigException("Failed to read concept dictionary: " + path, e);
    }
    log.info("Loaded {} dictionary terms from {}", dictionary.size(), path);
    return dictionary;
  }

  public void add(String conceptId, String term) {
    String normalized = normalize(term);
    if (normalized.isEmpty()) return;
    List<Entry> entries = byNormalizedTerm.computeIfAbsent(normalized, k -> new ArrayList<>());
    Entry entry = new Entry(conceptId, term);
    if (entries.contains(entry)) return;
    entries.add(entry);
    if (entries.size() == 1) {
      Set<String> grams = trigrams(normalized);
      trigramCounts.put(normalized, grams.size());
      for (String g : grams) {
        termsByTrigram.computeIfAbsent(g, k -> new HashSet<>()).add(normalized);
      }
    }
  }

  public int size() {
    return byNormalizedTerm.size();
  }

  List<Entry> exact(String normalized) {
    return byNormalizedTerm.getOrDefault(normalized, Collections.emptyList());
  }

  /** Normalized terms sharing at least one trigram with {@code grams}, with the shared count. */
  Map<String, Integer> sharedTrigrams(Set<String> grams) {
    Map<String, Integer> shared = new HashMap<>();
    for (String g : grams) {
      for (String term : termsByTrigram.getOrDefault(g, Collections.emptySet())) {
        shared.merge(term, 1, Integer::sum);
      }
    }
    return shared;
  }

  int trigramCount(String normalized) {
    return trigramCounts.getOrDefault(normalized, 0);
  }

  static String normalize(String text) {
    return text == null
        ? ""
        : text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").strip();
  }

  static Set<String> trigrams(String normalized) {
    String padded = " " + normalized + " ";
    Set<String> grams = new HashSet<>();
    for (int i = 0; i + 3 <= padded.length(); i++) {
      grams.add(padded.substring(i, i + 3));
    }
    return grams;
  }
}
