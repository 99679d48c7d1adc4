package com.gentoro.medrag;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.gentoro.medrag.concept.ConceptMatcher;
import com.gentoro.medrag.concept.dictionary.DictionaryConceptMatcher;
import com.gentoro.medrag.concept.umls.UmlsKnowledgeClient;
import com.gentoro.medrag.config.ConfigurationProvider;
import com.gentoro.medrag.config.MedRagSettings;
import com.gentoro.medrag.enrichment.BatchEnrichmentReport;
import com.gentoro.medrag.enrichment.HierarchyExpansionReport;
import com.gentoro.medrag.exception.ExceptionUtil;
import com.gentoro.medrag.exception.StateException;
import com.gentoro.medrag.generation.LlmClientFactory;
import com.gentoro.medrag.generation.LlmGenerationInvoker;
import com.gentoro.medrag.generation.prompt.impl.ClasspathPromptRepository;
import com.gentoro.medrag.graph.GraphStatistics;
import com.gentoro.medrag.graph.GraphStoreFactory;
import com.gentoro.medrag.http.OkHttpFactory;
import com.gentoro.medrag.ingest.ImportReport;
import com.gentoro.medrag.pipeline.MedRagSession;
import com.gentoro.medrag.pipeline.QaResponse;
import com.gentoro.medrag.pipeline.QueryOptions;
import com.gentoro.medrag.utility.JacksonUtility;
import java.io.File;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/** Application context: loads configuration, opens pipeline sessions and runs the chosen mode. */
public class MedRag {

  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(MedRag.class);

  private final StartupParameters startupParameters;
  private final PrintStream out;
  private ConfigurationProvider configurationProvider;
  private MedRagSettings settings;

  public MedRag(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), System.out);
  }

  MedRag(StartupParameters startupParameters, PrintStream out) {
    this.startupParameters = startupParameters;
    this.out = out;
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    String mode = startupParameters.mode();
    if ("help".equals(mode)) {
      printHelp();
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.medrag.logging.LoggingService.applyConfiguration(configuration());
    this.settings = MedRagSettings.from(configuration());
    validationWarnings().forEach(w -> log.warn("Configuration: {}", w));

    if ("interactive".equals(mode)) {
      configureFileOnlyLogging();
    }

    try (MedRagSession session = openSession()) {
      switch (mode) {
        case "query" -> runQuery(session);
        case "import" -> runImport(session);
        case "enrich" -> runEnrich(session);
        case "expand" -> runExpand(session);
        case "stats" -> runStats(session);
        case "interactive" -> enterInteractiveMode(session);
        default -> throw new IllegalArgumentException("Invalid mode: " + mode);
      }
    }
  }

  /** Configuration problems, including the LLM credentials the answer generator needs. */
  List<String> validationWarnings() {
    List<String> warnings = new java.util.ArrayList<>(settings().validate());
    String profile = configuration().getString("llm.active-profile", null);
    if (profile == null || profile.isBlank()) {
      warnings.add("llm.active-profile is not set; answers cannot be generated");
    } else if (configuration().getString("llm." + profile + ".apiKey", "").isBlank()) {
      warnings.add("llm." + profile + ".apiKey is not set; answers cannot be generated");
    }
    return warnings;
  }

  /** Build a pipeline session over the configured graph store and concept services. */
  public MedRagSession openSession() {
    MedRagSettings s = settings();
    ConceptMatcher matcher = DictionaryConceptMatcher.fromSettings(s.matcher());
    UmlsKnowledgeClient knowledge =
        new UmlsKnowledgeClient(
            s.umls(), OkHttpFactory.create(s.umls().connectTimeout(), s.umls().readTimeout()));
    return new MedRagSession(
        s,
        GraphStoreFactory.create(s.graph()),
        matcher,
        knowledge,
        () ->
            new LlmGenerationInvoker(
                LlmClientFactory.createProvider(configuration()),
                new ClasspathPromptRepository(s.generation().promptBasePath())
                    .get(s.generation().promptId())));
  }

  void runQuery(MedRagSession session) {
    String query = startupParameters.getParameter("query", String.class);
    QueryOptions options =
        session
            .defaultOptions()
            .withIncludeConcepts(!startupParameters.isParameterPresent("no-concepts"));
    printResponse(session.answer(query, options));
  }

  void runImport(MedRagSession session) {
    String path =
        startupParameters
            .getOptionalParameter("pubmed-path", String.class)
            .orElse(settings().ingest().corpusPath());
    boolean clear =
        settings().ingest().clearOnImport() && !startupParameters.isParameterPresent("keep-graph");
    ImportReport report = session.importer().importFromJson(Path.of(path), clear);
    out.printf(
        "Imported %d of %d papers (%d failed)%n",
        report.imported(), report.total(), report.failed());
    if (!report.failedPaperIds().isEmpty()) {
      out.println("Failed papers: " + String.join(", ", report.failedPaperIds()));
    }
  }

  void runEnrich(MedRagSession session) {
    String label = startupParameters.getOptionalParameter("label", String.class).orElse(null);
    int limit = startupParameters.intParameter("limit", 0);
    BatchEnrichmentReport report = session.enrichmentEngine().enrichAll(label, limit);
    out.printf(
        "Processed %d nodes: %d enriched, %d without concepts, %d failed%n",
        report.processed(), report.enriched(), report.noOp(), report.failedNodes());
    out.printf(
        "Concept links: %d created, %d skipped, %d failed%n",
        report.linked(), report.skipped(), report.failed());
  }

  void runExpand(MedRagSession session) {
    String conceptId = startupParameters.getParameter("concept", String.class);
    int depth = startupParameters.intParameter("depth", 1);
    HierarchyExpansionReport report = session.enrichmentEngine().expandHierarchy(conceptId, depth);
    if (!report.rootFound()) {
      out.println("No details found for concept " + conceptId);
      return;
    }
    out.printf(
        "Visited %d concepts, upserted %d, merged %d hierarchy edges, skipped %d relations%n",
        report.visited().size(),
        report.conceptsUpserted(),
        report.edgesMerged(),
        report.skippedRelations());
  }

  void runStats(MedRagSession session) {
    GraphStatistics stats = session.graph().statistics();
    if (startupParameters.isParameterPresent("json")) {
      out.println(JacksonUtility.toJson(stats));
      return;
    }
    out.printf("Total nodes: %d%n", stats.totalNodes());
    out.printf("Total relationships: %d%n", stats.totalRelationships());
    out.println("Top node labels:");
    stats.topLabels(3).forEach(e -> out.printf("  - %s: %d%n", e.getKey(), e.getValue()));
    out.println("Top relationship types:");
    stats
        .topRelationshipTypes(3)
        .forEach(e -> out.printf("  - %s: %d%n", e.getKey(), e.getValue()));
    out.printf("Average node degree: %.2f%n", stats.averageDegree());
    out.printf("Isolated nodes: %d%n", stats.isolatedNodes());
    if (!stats.mostConnectedNodes().isEmpty()) {
      out.println("Most connected nodes:");
      stats
          .mostConnectedNodes()
          .forEach(n -> out.printf("  - %s (%s): %d%n", n.name(), n.id(), n.degree()));
    }
    out.printf("UMLS concept nodes: %d%n", stats.conceptNodes());
    out.printf("Nodes with UMLS enrichment: %d%n", stats.nodesWithConcepts());
    out.printf("UMLS coverage: %.1f%%%n", stats.umlsCoveragePercent());
    if (!stats.topSemanticTypes().isEmpty()) {
      out.println("Top semantic types:");
      stats.topSemanticTypes().forEach((t, n) -> out.printf("  - %s: %d%n", t, n));
    }
  }

  void enterInteractiveMode(MedRagSession session) {
    Scanner scanner = new Scanner(System.in);
    QueryOptions options = session.defaultOptions();

    out.println("Medical question answering. Type a question (or 'exit' to quit):");
    while (true) {
      out.print("> ");

      // Check if there's input available (avoid blocking on EOF)
      if (!scanner.hasNextLine()) {
        break;
      }

      String input = scanner.nextLine().trim();
      if (input.equalsIgnoreCase("exit") || input.equalsIgnoreCase("quit")) {
        out.println("Goodbye!");
        break;
      }
      if (input.isEmpty()) {
        out.println("Please enter a question.");
        continue;
      }

      try {
        printResponse(session.answer(input, options));
      } catch (RuntimeException e) {
        log.error("Error handling question", e);
        out.println("An error occurred: " + ExceptionUtil.describe(e));
      }
    }
  }

  private void printResponse(QaResponse response) {
    QaResponse.Metadata meta = response.metadata();
    out.println();
    out.println("Answer:");
    out.println(response.answer());
    out.println();
    out.printf(
        "Facts used: %d, entities used: %d, concepts: %d, model: %s%n",
        meta.numFacts(), meta.numEntities(), meta.numConcepts(), meta.model());
    if (meta.factsDegraded() || meta.entitiesDegraded() || meta.conceptsDegraded()) {
      out.printf(
          "Degraded sources: facts=%s, entities=%s, concepts=%s%n",
          meta.factsDegraded(), meta.entitiesDegraded(), meta.conceptsDegraded());
    }
    if (!response.sample().concepts().isEmpty()) {
      out.println("Sample concepts identified:");
      response.sample().concepts().forEach(c -> out.println("  - " + c));
    }
  }

  void printHelp() {
    out.println(
        String.join(
            System.lineSeparator(),
            "Usage: medrag --mode <mode> [options]",
            "",
            "Modes:",
            "  query        answer one question (--query <text> [--no-concepts])",
            "  import       load a PubMed JSON corpus (--pubmed-path <file> [--keep-graph])",
            "  enrich       link stored nodes to concepts ([--label <label>] [--limit <n>])",
            "  expand       store the concept hierarchy around a concept (--concept <CUI>"
                + " [--depth <n>])",
            "  stats        print graph statistics ([--json])",
            "  interactive  ask questions from the console (default)",
            "  help         print this message",
            "",
            "Options:",
            "  --config-file <location>  classpath:<resource> or a file path"
                + " (default classpath:application.yaml)"));
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("MedRag not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public MedRagSettings settings() {
    if (settings == null) {
      throw new StateException("MedRag not initialized. Call initialize() first.");
    }
    return settings;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  /**
   * Reconfigure Logback to disable console output and enable only file-based logging, so log lines
   * do not interleave with the console conversation.
   */
  private void configureFileOnlyLogging() {
    LoggerContext context = (LoggerContext) org.slf4j.LoggerFactory.getILoggerFactory();
    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    for (java.util.Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders();
        it.hasNext(); ) {
      Appender<ILoggingEvent> app = it.next();
      if (app instanceof ConsoleAppender) {
        root.detachAppender(app);
      }
    }

    File logsDir = new File(configuration().getString("logging.dir", "logs"));
    if (!logsDir.exists() && !logsDir.mkdirs()) {
      log.warn("Could not create log directory {}", logsDir.getAbsolutePath());
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "medrag.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(new File(logsDir, "medrag.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info(
        "Interactive mode: console logging disabled; file logging enabled at {}",
        new File(logsDir, "medrag.log").getPath());
  }
}
