package com.gentoro.medrag.pipeline;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.medrag.concept.ConceptDetails;
import com.gentoro.medrag.concept.Mention;
import com.gentoro.medrag.enrichment.ConceptAnnotation;
import com.gentoro.medrag.exception.GraphConnectionClosedException;
import com.gentoro.medrag.exception.LlmException;
import com.gentoro.medrag.generation.GenerationInvoker;
import com.gentoro.medrag.retrieval.ContextAssembler;
import com.gentoro.medrag.retrieval.RagContext;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MedicalQaServiceTest {

  private static final String QUERY = "What treats MRSA pneumonia?";

  @Mock private ContextAssembler assembler;
  @Mock private GenerationInvoker generator;

  private MedicalQaService service;
  private final QueryOptions options = new QueryOptions(true, 10, 5);

  @BeforeEach
  void setUp() {
    service = new MedicalQaService(assembler, generator);
  }

  private static ConceptAnnotation annotation(String surface, String cui) {
    return new ConceptAnnotation(
        new Mention(surface, cui, 1.0, 0, surface.length()),
        new ConceptDetails(cui, surface, List.of("Disease"), List.of()));
  }

  private static RagContext context(boolean factsDegraded) {
    return new RagContext(
        QUERY,
        List.of("f1", "f2", "f3", "f4"),
        List.of("e1"),
        List.of(
            annotation("MRSA", "C0343401"),
            annotation("pneumonia", "C0032285"),
            annotation("lung", "C0024109"),
            annotation("infection", "C0009450")),
        "rendered",
        factsDegraded,
        false,
        false);
  }

  @Test
  void answersWithCountsAndSamples() {
    // Arrange
    when(generator.modelId()).thenReturn("gpt-4o");
    when(assembler.buildContext(QUERY, true, 10, 5)).thenReturn(context(false));
    when(generator.generate(any())).thenReturn("Vancomycin or linezolid.");

    // Act
    QaResponse response = service.answer(QUERY, options);

    // Assert
    assertEquals(QUERY, response.query());
    assertEquals("Vancomycin or linezolid.", response.answer());
    QaResponse.Metadata m = response.metadata();
    assertEquals(4, m.numFacts());
    assertEquals(1, m.numEntities());
    assertEquals(4, m.numConcepts());
    assertEquals("gpt-4o", m.model());
    assertNull(m.error());
    assertEquals(List.of("f1", "f2", "f3"), response.sample().facts());
    assertEquals(
        List.of("MRSA (C0343401)", "pneumonia (C0032285)", "lung (C0024109)"),
        response.sample().concepts());
  }

  @Test
  @DisplayName("generator failure returns the fallback answer with the real counts")
  void generatorFailureFallsBack() {
    when(generator.modelId()).thenReturn("gpt-4o");
    when(assembler.buildContext(QUERY, true, 10, 5)).thenReturn(context(true));
    when(generator.generate(any())).thenThrow(new LlmException("rate limited"));

    QaResponse response = service.answer(QUERY, options);

    assertEquals(MedicalQaService.GENERATION_FALLBACK, response.answer());
    assertEquals("LLM_ERROR", response.metadata().error());
    assertEquals(4, response.metadata().numFacts());
    assertTrue(response.metadata().factsDegraded());
  }

  @Test
  void contextFailureReturnsContextFallback() {
    when(generator.modelId()).thenReturn("gpt-4o");
    when(assembler.buildContext(anyString(), anyBoolean(), anyInt(), anyInt()))
        .thenThrow(new GraphConnectionClosedException("arangodb"));

    QaResponse response = service.answer(QUERY, options);

    assertEquals(MedicalQaService.CONTEXT_FALLBACK, response.answer());
    assertEquals(0, response.metadata().numFacts());
    assertEquals(0, response.metadata().numEntities());
    assertEquals(0, response.metadata().numConcepts());
    assertNotNull(response.metadata().error());
    assertTrue(response.sample().facts().isEmpty());
    verify(generator, never()).generate(any());
  }

  @Test
  void failingModelIdDoesNotBreakTheAnswer() {
    when(generator.modelId()).thenThrow(new LlmException("not configured"));
    when(assembler.buildContext(QUERY, false, 10, 5)).thenReturn(context(false));
    when(generator.generate(any())).thenReturn("ok");

    QaResponse response = service.answer(QUERY, options.withIncludeConcepts(false));

    assertEquals("ok", response.answer());
    assertEquals("unavailable", response.metadata().model());
  }
}
