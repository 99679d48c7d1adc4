package com.gentoro.medrag.pipeline;

import com.gentoro.medrag.concept.ConceptKnowledgeClient;
import com.gentoro.medrag.concept.ConceptMatcher;
import com.gentoro.medrag.concept.ConceptMatcherAdapter;
import com.gentoro.medrag.config.MedRagSettings;
import com.gentoro.medrag.enrichment.EnrichmentEngine;
import com.gentoro.medrag.exception.LlmException;
import com.gentoro.medrag.exception.StateException;
import com.gentoro.medrag.generation.GenerationInvoker;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.ingest.PubMedImporter;
import com.gentoro.medrag.retrieval.ContextAssembler;
import com.gentoro.medrag.retrieval.RagContext;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Owns the graph connection and the search workers for one run of the pipeline, and wires the
 * components that share them.
 *
 * <p>The generator is created on first use, so import and enrichment runs never need LLM
 * credentials. Closing the session stops the search workers and releases the graph connection.
 */
public class MedRagSession implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(MedRagSession.class);

  private final MedRagSettings settings;
  private final GraphStore graph;
  private final ExecutorService searchExecutor;
  private final EnrichmentEngine enrichmentEngine;
  private final ContextAssembler contextAssembler;
  private final Supplier<GenerationInvoker> generatorSupplier;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile MedicalQaService qaService;

  public MedRagSession(
      MedRagSettings settings,
      GraphStore graph,
      ConceptMatcher matcher,
      ConceptKnowledgeClient knowledge,
      Supplier<GenerationInvoker> generatorSupplier) {
    this.settings = settings;
    this.graph = graph;
    this.generatorSupplier = generatorSupplier;

    try {
      graph.initialize();
    } catch (RuntimeException e) {
      graph.close();
      throw e;
    }

    this.searchExecutor =
        Executors.newFixedThreadPool(
            Math.max(1, settings.retrieval().searchThreads()), new SearchThreadFactory());
    this.enrichmentEngine =
        new EnrichmentEngine(
            new ConceptMatcherAdapter(matcher, settings.matcher().confidenceThreshold()),
            knowledge,
            graph);
    this.contextAssembler =
        new ContextAssembler(graph, enrichmentEngine, searchExecutor, settings.retrieval());
    log.info("Session opened on graph store '{}'", graph.name());
  }

  public GraphStore graph() {
    return graph;
  }

  public EnrichmentEngine enrichmentEngine() {
    return enrichmentEngine;
  }

  public ContextAssembler contextAssembler() {
    return contextAssembler;
  }

  public PubMedImporter importer() {
    ensureOpen();
    return new PubMedImporter(graph, settings.ingest());
  }

  /**
   * The question answering service; builds the generator on first call. A generator that cannot be
   * built is replaced, once and for the rest of the session, by one that always fails, so answers
   * carry the generation fallback.
   */
  public MedicalQaService qaService() {
    ensureOpen();
    MedicalQaService service = qaService;
    if (service == null) {
      synchronized (this) {
        if (qaService == null) {
          qaService = new MedicalQaService(contextAssembler, createGenerator());
        }
        service = qaService;
      }
    }
    return service;
  }

  public QaResponse answer(String query, QueryOptions options) {
    return qaService().answer(query, options);
  }

  public QueryOptions defaultOptions() {
    return QueryOptions.defaults(settings.retrieval());
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      searchExecutor.shutdownNow();
    } finally {
      graph.close();
      log.info("Session closed");
    }
  }

  private GenerationInvoker createGenerator() {
    try {
      return generatorSupplier.get();
    } catch (RuntimeException e) {
      // Retrieval still runs; each answer then carries the generation fallback.
      log.error("Answer generator unavailable: {}", e.getMessage(), e);
      return new UnavailableGenerator(e);
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new StateException("Session is closed");
    }
  }

  private record UnavailableGenerator(RuntimeException cause) implements GenerationInvoker {
    @Override
    public String generate(RagContext context) {
      throw new LlmException("Answer generator is not configured: " + cause.getMessage(), cause);
    }

    @Override
    public String modelId() {
      return "unavailable";
    }
  }

  private static final class SearchThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "medrag-search-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
