package com.gentoro.medrag.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable settings for every pipeline component, read once from the application configuration.
 *
 * <p>Components receive the slice they need at construction time and never consult the raw
 * {@link Configuration} themselves. Key layout (YAML):
 *
 * <pre>
 * graph:      driver, arangodb.{host, port, user, password, database}
 * umls:       baseUrl, apiKey, connectTimeoutMs, readTimeoutMs, broaderLabels, narrowerLabels
 * matcher:    dictionaryPath, minSimilarity, confidenceThreshold, maxNgram
 * retrieval:  maxFacts, maxEntities, includeConcepts, timeoutMs, summaryMaxChars, searchThreads
 * generation: promptId
 * import:     corpusPath, minTextLength, maxTextLength, clearOnImport
 * </pre>
 */
public record MedRagSettings(
    GraphSettings graph,
    UmlsSettings umls,
    MatcherSettings matcher,
    RetrievalSettings retrieval,
    GenerationSettings generation,
    ImportSettings ingest) {

  public MedRagSettings {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(umls, "umls");
    Objects.requireNonNull(matcher, "matcher");
    Objects.requireNonNull(retrieval, "retrieval");
    Objects.requireNonNull(generation, "generation");
    Objects.requireNonNull(ingest, "ingest");
  }

  public static MedRagSettings from(Configuration cfg) {
    return new MedRagSettings(
        GraphSettings.from(cfg),
        UmlsSettings.from(cfg),
        MatcherSettings.from(cfg),
        RetrievalSettings.from(cfg),
        GenerationSettings.from(cfg),
        ImportSettings.from(cfg));
  }

  /** Settings with every default applied, as if the configuration were empty. */
  public static MedRagSettings defaults() {
    return from(new org.apache.commons.configuration2.BaseConfiguration());
  }

  /**
   * Reports configuration problems. Missing concept capabilities are reported but do not prevent
   * the pipeline from running; they put the matching component in its degraded mode.
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if ("arangodb".equals(graph.driver()) && graph.password().isEmpty()) {
      errors.add("graph.arangodb.password is required for the arangodb driver");
    }
    if (umls.apiKey().isBlank()) {
      errors.add("umls.apiKey is not set; concept details will be unavailable");
    }
    if (matcher.dictionaryPath().isBlank()) {
      errors.add("matcher.dictionaryPath is not set; concept matching will be unavailable");
    } else if (!java.nio.file.Files.exists(java.nio.file.Path.of(matcher.dictionaryPath()))) {
      errors.add("matcher.dictionaryPath does not exist: " + matcher.dictionaryPath());
    }
    return errors;
  }

  public record GraphSettings(
      String driver, String host, int port, String user, String password, String database) {
    static GraphSettings from(Configuration cfg) {
      String host = cfg.getString("graph.arangodb.host", "").trim();
      String driver = cfg.getString("graph.driver", "").trim().toLowerCase();
      if (driver.isEmpty()) {
        driver = host.isEmpty() ? "in-memory" : "arangodb";
      }
      return new GraphSettings(
          driver,
          host.isEmpty() ? "localhost" : host,
          cfg.getInt("graph.arangodb.port", 8529),
          cfg.getString("graph.arangodb.user", "root"),
          cfg.getString("graph.arangodb.password", ""),
          cfg.getString("graph.arangodb.database", "medrag"));
    }
  }

  public record UmlsSettings(
      String baseUrl,
      String apiKey,
      Duration connectTimeout,
      Duration readTimeout,
      Set<String> broaderLabels,
      Set<String> narrowerLabels) {
    static UmlsSettings from(Configuration cfg) {
      return new UmlsSettings(
          cfg.getString("umls.baseUrl", "https://uts-ws.nlm.nih.gov/rest"),
          cfg.getString("umls.apiKey", ""),
          Duration.ofMillis(cfg.getLong("umls.connectTimeoutMs", 10_000L)),
          Duration.ofMillis(cfg.getLong("umls.readTimeoutMs", 20_000L)),
          labels(cfg, "umls.broaderLabels", "RB"),
          labels(cfg, "umls.narrowerLabels", "RN"));
    }

    private static Set<String> labels(Configuration cfg, String key, String... defaults) {
      List<String> values = cfg.getList(String.class, key, Arrays.asList(defaults));
      return values.stream()
          .map(String::trim)
          .filter(v -> !v.isEmpty())
          .map(String::toUpperCase)
          .collect(Collectors.toCollection(LinkedHashSet::new));
    }
  }

  public record MatcherSettings(
      String dictionaryPath, double minSimilarity, double confidenceThreshold, int maxNgram) {
    static MatcherSettings from(Configuration cfg) {
      return new MatcherSettings(
          cfg.getString("matcher.dictionaryPath", ""),
          cfg.getDouble("matcher.minSimilarity", 0.7),
          cfg.getDouble("matcher.confidenceThreshold", 0.8),
          cfg.getInt("matcher.maxNgram", 6));
    }
  }

  public record RetrievalSettings(
      int maxFacts,
      int maxEntities,
      boolean includeConcepts,
      Duration timeout,
      int summaryMaxChars,
      int searchThreads) {
    static RetrievalSettings from(Configuration cfg) {
      return new RetrievalSettings(
          cfg.getInt("retrieval.maxFacts", 10),
          cfg.getInt("retrieval.maxEntities", 5),
          cfg.getBoolean("retrieval.includeConcepts", true),
          Duration.ofMillis(cfg.getLong("retrieval.timeoutMs", 30_000L)),
          cfg.getInt("retrieval.summaryMaxChars", 200),
          cfg.getInt("retrieval.searchThreads", 3));
    }
  }

  public record GenerationSettings(String promptId, String promptBasePath) {
    static GenerationSettings from(Configuration cfg) {
      return new GenerationSettings(
          cfg.getString("generation.promptId", "medical-answer"),
          cfg.getString("generation.promptBasePath", "prompts"));
    }
  }

  public record ImportSettings(
      String corpusPath, int minTextLength, int maxTextLength, boolean clearOnImport) {
    static ImportSettings from(Configuration cfg) {
      return new ImportSettings(
          cfg.getString("import.corpusPath", "data/pubmed/pubmed_corpus.json"),
          cfg.getInt("import.minTextLength", 100),
          cfg.getInt("import.maxTextLength", 4096),
          cfg.getBoolean("import.clearOnImport", true));
    }
  }
}
