package com.gentoro.medrag.generation;

import com.gentoro.medrag.retrieval.RagContext;

/** Turns an assembled context into answer text. */
public interface GenerationInvoker {

  /**
   * @throws com.gentoro.medrag.exception.LlmException when the model cannot produce an answer
   */
  String generate(RagContext context);

  /** Identifier of the model that answers, reported with each response. */
  String modelId();
}
