package com.gentoro.medrag.pipeline;

import com.gentoro.medrag.enrichment.ConceptAnnotation;
import com.gentoro.medrag.exception.ExceptionUtil;
import com.gentoro.medrag.generation.GenerationInvoker;
import com.gentoro.medrag.retrieval.ContextAssembler;
import com.gentoro.medrag.retrieval.RagContext;
import java.util.List;

/**
 * Answers medical questions: assembles the retrieval context, then asks the generator.
 *
 * <p>{@link #answer} always returns a response. A failing generator yields {@link
 * #GENERATION_FALLBACK}; a context that cannot be assembled yields {@link #CONTEXT_FALLBACK} with
 * zero counts.
 */
public class MedicalQaService {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(MedicalQaService.class);

  public static final String GENERATION_FALLBACK =
      "I apologize, but I encountered an error while generating the answer. Please try again.";
  public static final String CONTEXT_FALLBACK =
      "I apologize, but I could not retrieve supporting information from the knowledge graph for"
          + " this question, so no answer was generated. Please try again later.";

  static final int SAMPLE_SIZE = 3;

  private final ContextAssembler assembler;
  private final GenerationInvoker generator;

  public MedicalQaService(ContextAssembler assembler, GenerationInvoker generator) {
    this.assembler = assembler;
    this.generator = generator;
  }

  public QaResponse answer(String query, QueryOptions options) {
    log.info("Processing query: {}", query);
    String model = modelId();

    RagContext context;
    try {
      context =
          assembler.buildContext(
              query, options.includeConcepts(), options.maxFacts(), options.maxEntities());
    } catch (RuntimeException e) {
      log.error("Could not assemble context for query: {}", e.getMessage(), e);
      return new QaResponse(
          query,
          CONTEXT_FALLBACK,
          new QaResponse.Metadata(
              0, 0, 0, model, false, false, false, ExceptionUtil.errorCode(e).name()),
          new QaResponse.Sample(List.of(), List.of()));
    }

    String answer;
    String error = null;
    try {
      answer = generator.generate(context);
    } catch (RuntimeException e) {
      log.error("Error generating answer: {}", e.getMessage(), e);
      answer = GENERATION_FALLBACK;
      error = ExceptionUtil.errorCode(e).name();
    }

    return new QaResponse(
        query,
        answer,
        new QaResponse.Metadata(
            context.facts().size(),
            context.entitySummaries().size(),
            context.concepts().size(),
            model,
            context.factsDegraded(),
            context.entitiesDegraded(),
            context.conceptsDegraded(),
            error),
        new QaResponse.Sample(
            context.facts().subList(0, Math.min(SAMPLE_SIZE, context.facts().size())),
            context.concepts().stream()
                .limit(SAMPLE_SIZE)
                .map(ConceptAnnotation::mention)
                .map(m -> m.surfaceForm() + " (" + m.conceptId() + ")")
                .toList()));
  }

  private String modelId() {
    try {
      return generator.modelId();
    } catch (RuntimeException e) {
      log.warn("Generator model unavailable: {}", e.getMessage());
      return "unavailable";
    }
  }
}
