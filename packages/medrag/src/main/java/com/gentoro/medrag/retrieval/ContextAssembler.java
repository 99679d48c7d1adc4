package com.gentoro.medrag.retrieval;

import com.gentoro.medrag.config.MedRagSettings.RetrievalSettings;
import com.gentoro.medrag.enrichment.ConceptAnnotation;
import com.gentoro.medrag.enrichment.EnrichmentEngine;
import com.gentoro.medrag.exception.AuthenticationException;
import com.gentoro.medrag.exception.GraphConnectionClosedException;
import com.gentoro.medrag.exception.RequestCancelledException;
import com.gentoro.medrag.exception.ValidationException;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.graph.RetrievedEntity;
import com.gentoro.medrag.graph.RetrievedFact;
import com.gentoro.medrag.graph.SearchOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds a {@link RagContext} for a query.
 *
 * <p>Fact search, entity search and concept annotation of the query text run concurrently on the
 * session executor. All three must finish or degrade before the context is assembled. When the
 * request deadline passes or the caller is interrupted, every pending task is cancelled and
 * {@link RequestCancelledException} is thrown; no partial context is returned.
 */
public class ContextAssembler {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(ContextAssembler.class);

  private final GraphStore graph;
  private final EnrichmentEngine engine;
  private final ExecutorService executor;
  private final RetrievalSettings settings;
  private final ContextFormatter formatter;

  public ContextAssembler(
      GraphStore graph,
      EnrichmentEngine engine,
      ExecutorService executor,
      RetrievalSettings settings) {
    this.graph = graph;
    this.engine = engine;
    this.executor = executor;
    this.settings = settings;
    this.formatter = new ContextFormatter(settings.summaryMaxChars());
  }

  /** Uses the configured defaults for concept inclusion and limits. */
  public RagContext buildContext(String query) {
    return buildContext(
        query, settings.includeConcepts(), settings.maxFacts(), settings.maxEntities());
  }

  public RagContext buildContext(
      String query, boolean includeConcepts, int maxFacts, int maxEntities) {
    if (query == null || query.isBlank()) {
      throw new ValidationException("query must not be blank");
    }
    long deadline = System.nanoTime() + settings.timeout().toNanos();

    Future<SearchOutcome<RetrievedFact>> factSearch =
        executor.submit(() -> graph.searchFacts(query, maxFacts));
    Future<SearchOutcome<RetrievedEntity>> entitySearch =
        executor.submit(() -> graph.searchEntities(query, maxEntities));
    Future<List<ConceptAnnotation>> annotation =
        includeConcepts
            ? executor.submit(() -> engine.annotate(query, engine.newLookupSession()))
            : CompletableFuture.completedFuture(List.of());

    try {
      SearchOutcome<RetrievedFact> facts = awaitSearch(factSearch, deadline, "fact");
      SearchOutcome<RetrievedEntity> entities = awaitSearch(entitySearch, deadline, "entity");
      List<ConceptAnnotation> concepts = List.of();
      boolean conceptsDegraded = false;
      try {
        concepts = await(annotation, deadline, "concept annotation");
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof AuthenticationException) {
          log.error("Concept annotation disabled for this query: {}", cause.getMessage());
        } else {
          log.warn("Concept annotation failed, continuing without it: {}", cause, cause);
        }
        conceptsDegraded = true;
      }

      List<String> factLines = new ArrayList<>();
      for (RetrievedFact f : facts.items()) factLines.add(formatter.formatFact(f));
      List<String> entityLines = new ArrayList<>();
      for (RetrievedEntity e : entities.items()) entityLines.add(formatter.formatEntity(e));

      RagContext context =
          new RagContext(
              query,
              factLines,
              entityLines,
              concepts,
              formatter.render(factLines, entityLines, concepts),
              facts.degraded(),
              entities.degraded(),
              conceptsDegraded);
      log.info(
          "Context for query built: {} facts, {} entities, {} concepts{}",
          factLines.size(),
          entityLines.size(),
          concepts.size(),
          context.isDegraded() ? " (degraded)" : "");
      return context;
    } finally {
      // no-op for completed searches; stops in-flight ones on every abnormal exit
      factSearch.cancel(true);
      entitySearch.cancel(true);
      annotation.cancel(true);
    }
  }

  private static <T> SearchOutcome<T> awaitSearch(
      Future<SearchOutcome<T>> search, long deadline, String kind) {
    try {
      return await(search, deadline, kind + " search");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof GraphConnectionClosedException closed) {
        throw closed;
      }
      log.warn("{} search failed, continuing without it: {}", kind, String.valueOf(cause), cause);
      return SearchOutcome.degraded(String.valueOf(cause));
    }
  }

  private static <T> T await(Future<T> task, long deadline, String what)
      throws ExecutionException {
    long remaining = deadline - System.nanoTime();
    try {
      return task.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      throw new RequestCancelledException("Request deadline exceeded waiting for " + what);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RequestCancelledException("Interrupted while waiting for " + what, e);
    }
  }
}
