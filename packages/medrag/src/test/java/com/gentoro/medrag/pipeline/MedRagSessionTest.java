package com.gentoro.medrag.pipeline;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.medrag.config.MedRagSettings;
import com.gentoro.medrag.exception.ConfigException;
import com.gentoro.medrag.exception.GraphException;
import com.gentoro.medrag.exception.StateException;
import com.gentoro.medrag.generation.GenerationInvoker;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.graph.driver.memory.InMemoryGraphStore;
import com.gentoro.medrag.retrieval.RagContext;
import com.gentoro.medrag.testing.FakeConceptMatcher;
import com.gentoro.medrag.testing.FakeKnowledgeClient;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class MedRagSessionTest {

  private final MedRagSettings settings = MedRagSettings.defaults();
  private final FakeConceptMatcher matcher = new FakeConceptMatcher();
  private final FakeKnowledgeClient knowledge = new FakeKnowledgeClient();

  private MedRagSession open(GraphStore graph, Supplier<GenerationInvoker> gen) {
    return new MedRagSession(settings, graph, matcher, knowledge, gen);
  }

  @Test
  void answersFromTheGraphWithTheLazyGenerator() {
    // Arrange
    InMemoryGraphStore graph = new InMemoryGraphStore();
    AtomicInteger created = new AtomicInteger();
    GenerationInvoker generator = mock(GenerationInvoker.class);
    when(generator.modelId()).thenReturn("stub-model");
    when(generator.generate(any()))
        .thenAnswer(
            inv -> "answer from " + inv.getArgument(0, RagContext.class).facts().size() + " facts");

    try (MedRagSession session =
        open(
            graph,
            () -> {
              created.incrementAndGet();
              return generator;
            })) {
      String aspirin = graph.addEntity("Aspirin", "salicylate drug", List.of("Drug"), Map.of());
      String cox = graph.addEntity("COX", "cyclooxygenase enzyme", List.of(), Map.of());
      Instant published = Instant.parse("2020-01-01T00:00:00Z");
      graph.addFact(aspirin, cox, "aspirin inhibits COX", published, null);
      assertEquals(0, created.get());

      // Act
      QaResponse first = session.answer("aspirin COX", session.defaultOptions());
      session.answer("aspirin", session.defaultOptions());

      // Assert
      assertEquals(1, created.get());
      assertEquals("stub-model", first.metadata().model());
      assertEquals(1, first.metadata().numFacts());
      assertEquals("answer from 1 facts", first.answer());
    }
  }

  @Test
  void unavailableGeneratorYieldsFallbackAnswer() {
    try (MedRagSession session =
        open(
            new InMemoryGraphStore(),
            () -> {
              throw new ConfigException("Missing llm.openai.apiKey in configuration");
            })) {

      QaResponse response = session.answer("aspirin", session.defaultOptions());

      assertEquals(MedicalQaService.GENERATION_FALLBACK, response.answer());
      assertEquals("LLM_ERROR", response.metadata().error());
      assertEquals("unavailable", response.metadata().model());
    }
  }

  @Test
  void generatorBuildFailureIsRememberedAndAnswersStillComeBack() {
    AtomicInteger attempts = new AtomicInteger();
    try (MedRagSession session =
        open(
            new InMemoryGraphStore(),
            () -> {
              attempts.incrementAndGet();
              throw new IllegalStateException("OpenAI client could not be built");
            })) {

      QaResponse first = session.answer("aspirin", session.defaultOptions());
      QaResponse second = session.answer("fever", session.defaultOptions());

      assertEquals(MedicalQaService.GENERATION_FALLBACK, first.answer());
      assertEquals(MedicalQaService.GENERATION_FALLBACK, second.answer());
      assertEquals("LLM_ERROR", first.metadata().error());
      assertEquals(1, attempts.get());
    }
  }

  @Test
  void closeIsIdempotentAndReleasesTheGraph() {
    GraphStore graph = spy(new InMemoryGraphStore());
    MedRagSession session = open(graph, () -> mock(GenerationInvoker.class));

    session.close();
    session.close();

    assertTrue(session.isClosed());
    assertFalse(graph.isOpen());
    verify(graph, times(1)).close();
    assertThrows(StateException.class, session::importer);
    assertThrows(StateException.class, session::qaService);
  }

  @Test
  void failedInitializationClosesTheGraph() {
    GraphStore graph = mock(GraphStore.class);
    doThrow(new GraphException("cannot reach arangodb")).when(graph).initialize();

    assertThrows(GraphException.class, () -> open(graph, () -> mock(GenerationInvoker.class)));
    verify(graph).close();
  }
}
