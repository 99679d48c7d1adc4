package com.gentoro.medrag.retrieval;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.medrag.concept.ConceptMatcher;
import com.gentoro.medrag.concept.ConceptMatcherAdapter;
import com.gentoro.medrag.config.MedRagSettings.RetrievalSettings;
import com.gentoro.medrag.enrichment.EnrichmentEngine;
import com.gentoro.medrag.exception.GraphConnectionClosedException;
import com.gentoro.medrag.exception.RequestCancelledException;
import com.gentoro.medrag.exception.ValidationException;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.graph.RetrievedEntity;
import com.gentoro.medrag.graph.RetrievedFact;
import com.gentoro.medrag.graph.SearchOutcome;
import com.gentoro.medrag.graph.driver.memory.InMemoryGraphStore;
import com.gentoro.medrag.testing.FakeConceptMatcher;
import com.gentoro.medrag.testing.FakeKnowledgeClient;
import com.gentoro.medrag.testing.SteppingClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

  private ExecutorService executor;
  private FakeKnowledgeClient knowledge;
  private FakeConceptMatcher matcher;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(3);
    knowledge = new FakeKnowledgeClient().concept("C1265292", "MRSA", "A resistant strain.");
    matcher = new FakeConceptMatcher().term("mrsa", "C1265292");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static RetrievalSettings settings(Duration timeout) {
    return new RetrievalSettings(10, 5, true, timeout, 200, 3);
  }

  private ContextAssembler assembler(GraphStore graph, Duration timeout) {
    EnrichmentEngine engine =
        new EnrichmentEngine(new ConceptMatcherAdapter(matcher, 0.8), knowledge, graph);
    return new ContextAssembler(graph, engine, executor, settings(timeout));
  }

  @Test
  @DisplayName("Facts keep search order and respect the requested limit")
  void factsAreOrderedAndLimited() {
    // Arrange
    InMemoryGraphStore graph =
        new InMemoryGraphStore(new SteppingClock(Instant.parse("2024-01-01T00:00:00Z"), Duration.ofSeconds(1)));
    graph.initialize();
    String peptide = graph.addEntity("PEG-PR-26", "Gelatinase-responsive peptide", List.of(), Map.of());
    String mrsa = graph.addEntity("MRSA", "Resistant bacteria", List.of(), Map.of());
    graph.addFact(peptide, mrsa, "peptide shows activity", null, null);
    graph.addFact(peptide, mrsa, "peptide kills mrsa in vitro", null, null);
    graph.addFact(peptide, mrsa, "peptide kills mrsa biofilms", null, null);

    // Act
    RagContext context = assembler(graph, Duration.ofSeconds(5)).buildContext("peptide kills mrsa", true, 2, 5);

    // Assert
    assertEquals(
        List.of(
            "peptide kills mrsa biofilms (Source: PEG-PR-26; Target: MRSA)",
            "peptide kills mrsa in vitro (Source: PEG-PR-26; Target: MRSA)"),
        context.facts());
    assertEquals(1, context.concepts().size());
    assertFalse(context.isDegraded());
    assertTrue(context.renderedText().startsWith("Relevant Facts from Knowledge Graph:\n1. peptide kills mrsa biofilms"));
    assertTrue(context.renderedText().contains("- Term: mrsa (CUI: C1265292)"));
  }

  @Test
  void degradedSearchLeavesOtherSectionsIntact() {
    // Arrange
    GraphStore graph = mock(GraphStore.class);
    when(graph.searchFacts(anyString(), anyInt())).thenReturn(SearchOutcome.degraded("timeout"));
    when(graph.searchEntities(anyString(), anyInt()))
        .thenReturn(
            SearchOutcome.ok(
                List.of(new RetrievedEntity("e1", "MRSA", "Resistant bacteria", Set.of("Entity"), null, Map.of()))));

    // Act
    RagContext context = assembler(graph, Duration.ofSeconds(5)).buildContext("mrsa treatment");

    // Assert
    assertTrue(context.factsDegraded());
    assertFalse(context.entitiesDegraded());
    assertEquals(List.of("MRSA: Resistant bacteria"), context.entitySummaries());
    assertFalse(context.renderedText().contains("Relevant Facts"));
  }

  @Test
  void failingSearchTaskIsTreatedAsDegraded() {
    GraphStore graph = mock(GraphStore.class);
    when(graph.searchFacts(anyString(), anyInt())).thenThrow(new IllegalStateException("driver bug"));
    when(graph.searchEntities(anyString(), anyInt())).thenReturn(SearchOutcome.ok(List.of()));

    RagContext context = assembler(graph, Duration.ofSeconds(5)).buildContext("mrsa", false, 5, 5);

    assertTrue(context.factsDegraded());
    assertTrue(context.concepts().isEmpty());
  }

  @Test
  void closedConnectionPropagates() {
    GraphStore graph = mock(GraphStore.class);
    when(graph.searchFacts(anyString(), anyInt()))
        .thenThrow(new GraphConnectionClosedException("in-memory"));
    lenient().when(graph.searchEntities(anyString(), anyInt())).thenReturn(SearchOutcome.ok(List.of()));

    assertThrows(
        GraphConnectionClosedException.class,
        () -> assembler(graph, Duration.ofSeconds(5)).buildContext("mrsa", false, 5, 5));
  }

  @Test
  @DisplayName("Deadline expiry cancels in-flight searches")
  void deadlineCancelsSearches() throws InterruptedException {
    // Arrange
    CountDownLatch interrupted = new CountDownLatch(1);
    GraphStore graph = mock(GraphStore.class);
    when(graph.searchFacts(anyString(), anyInt()))
        .thenAnswer(
            inv -> {
              try {
                Thread.sleep(10_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
              }
              return SearchOutcome.<RetrievedFact>ok(List.of());
            });
    when(graph.searchEntities(anyString(), anyInt())).thenReturn(SearchOutcome.ok(List.of()));

    // Act
    ContextAssembler assembler = assembler(graph, Duration.ofMillis(100));

    // Assert
    assertThrows(
        RequestCancelledException.class, () -> assembler.buildContext("mrsa", false, 5, 5));
    assertTrue(interrupted.await(5, TimeUnit.SECONDS));
  }

  @Test
  @DisplayName("Slow concept annotation is bounded by the same deadline")
  void deadlineCoversConceptAnnotation() throws InterruptedException {
    // Arrange
    CountDownLatch interrupted = new CountDownLatch(1);
    ConceptMatcher slowMatcher =
        text -> {
          try {
            Thread.sleep(10_000);
          } catch (InterruptedException e) {
            interrupted.countDown();
          }
          return List.of();
        };
    InMemoryGraphStore graph = new InMemoryGraphStore();
    graph.initialize();
    EnrichmentEngine engine =
        new EnrichmentEngine(new ConceptMatcherAdapter(slowMatcher, 0.8), knowledge, graph);
    ContextAssembler assembler =
        new ContextAssembler(graph, engine, executor, settings(Duration.ofMillis(100)));

    // Act
    long started = System.nanoTime();
    assertThrows(RequestCancelledException.class, () -> assembler.buildContext("mrsa therapy"));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    // Assert
    assertTrue(elapsedMs < 5_000, "returned after " + elapsedMs + " ms");
    assertTrue(interrupted.await(5, TimeUnit.SECONDS));
  }

  @Test
  void failingAnnotationDegradesConceptsOnly() {
    InMemoryGraphStore graph = new InMemoryGraphStore();
    graph.initialize();
    EnrichmentEngine engine = mock(EnrichmentEngine.class);
    when(engine.annotate(anyString(), any())).thenThrow(new IllegalStateException("lookup bug"));

    RagContext context =
        new ContextAssembler(graph, engine, executor, settings(Duration.ofSeconds(5)))
            .buildContext("mrsa therapy");

    assertTrue(context.conceptsDegraded());
    assertFalse(context.factsDegraded());
    assertTrue(context.concepts().isEmpty());
  }

  @Test
  void rejectedCredentialsDegradeConceptsOnly() {
    knowledge.rejectCredentialsAt("C1265292");
    InMemoryGraphStore graph = new InMemoryGraphStore();
    graph.initialize();

    RagContext context = assembler(graph, Duration.ofSeconds(5)).buildContext("mrsa therapy");

    assertTrue(context.conceptsDegraded());
    assertTrue(context.concepts().isEmpty());
    assertFalse(context.factsDegraded());
  }

  @Test
  void conceptsCanBeExcluded() {
    InMemoryGraphStore graph = new InMemoryGraphStore();
    graph.initialize();

    RagContext context = assembler(graph, Duration.ofSeconds(5)).buildContext("mrsa", false, 5, 5);

    assertTrue(context.concepts().isEmpty());
    assertEquals(0, knowledge.totalCalls());
    assertEquals("", context.renderedText());
  }

  @Test
  void blankQueryIsRejected() {
    InMemoryGraphStore graph = new InMemoryGraphStore();
    graph.initialize();

    assertThrows(ValidationException.class, () -> assembler(graph, Duration.ofSeconds(5)).buildContext(" "));
  }
}
