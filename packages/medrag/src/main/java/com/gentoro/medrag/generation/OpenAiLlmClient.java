package com.gentoro.medrag.generation;

import com.gentoro.medrag.exception.LlmException;
import com.gentoro.medrag.exception.StateException;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.completions.CompletionUsage;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/** OpenAI implementation of {@link LlmClient} using openai-java SDK (Chat Completions API). */
public class OpenAiLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(OpenAiLlmClient.class);

  static final String DEFAULT_MODEL = "gpt-4o";

  private final OpenAIClient openAIClient;

  public OpenAiLlmClient(OpenAIClient openAIClient, Configuration configuration) {
    super(configuration);
    this.openAIClient = openAIClient;
  }

  @Override
  public String modelId() {
    return configuration.getString("model", DEFAULT_MODEL);
  }

  @Override
  public String runInference(List<Message> messages) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder()
            .model(modelId())
            .temperature(configuration.getDouble("temperature", 0.2))
            .maxCompletionTokens(configuration.getLong("maxTokens", 1000L));

    for (Message message : messages) {
      switch (message.role()) {
        case SYSTEM -> builder.addSystemMessage(message.content());
        case USER -> builder.addUserMessage(message.content());
        case ASSISTANT -> builder.addAssistantMessage(message.content());
        default -> throw new StateException("Unknown message role: " + message.role());
      }
    }

    long start = System.currentTimeMillis();
    ChatCompletion chatCompletion = openAIClient.chat().completions().create(builder.build());
    if (chatCompletion.choices().isEmpty()) {
      throw new LlmException("OpenAI returned no choices for model " + modelId());
    }
    log.info(
        "[Inference] - OpenAI: {} took {} ms, total tokens {}",
        modelId(),
        System.currentTimeMillis() - start,
        chatCompletion.usage().map(CompletionUsage::totalTokens).orElse(-1L));
    return chatCompletion.choices().get(0).message().content().map(String::trim).orElse("");
  }
}
