package com.gentoro.medrag.generation;

import com.gentoro.medrag.generation.prompt.PromptTemplate;
import com.gentoro.medrag.retrieval.RagContext;
import java.util.List;
import java.util.Map;

/**
 * {@link GenerationInvoker} that renders a prompt template with the query and the rendered context
 * and sends it to an {@link LlmClient}.
 *
 * <p>The template must define a {@value #QUESTION_SECTION} section taking {@code query} and {@code
 * context}; its other default sections (the system preamble) are sent unchanged.
 */
public class LlmGenerationInvoker implements GenerationInvoker {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(LlmGenerationInvoker.class);

  static final String QUESTION_SECTION = "question";

  private final LlmClient client;
  private final PromptTemplate template;

  public LlmGenerationInvoker(LlmClient client, PromptTemplate template) {
    this.client = client;
    this.template = template;
  }

  @Override
  public String generate(RagContext context) {
    List<LlmClient.Message> messages =
        template
            .newSession()
            .enable(
                QUESTION_SECTION,
                Map.of("query", context.query(), "context", context.renderedText()))
            .renderMessages();
    log.info("Generating answer with {}...", client.modelId());
    return client.chat(messages);
  }

  @Override
  public String modelId() {
    return client.modelId();
  }
}
