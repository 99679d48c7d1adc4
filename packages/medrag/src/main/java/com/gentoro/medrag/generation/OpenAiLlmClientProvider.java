package com.gentoro.medrag.generation;

import com.gentoro.medrag.exception.ConfigException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for OpenAI-based {@link LlmClient} implementations. */
public final class OpenAiLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public LlmClient create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing llm.openai.apiKey in configuration");
    }
    OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder().apiKey(apiKey);
    String baseUrl = subConfiguration.getString("baseUrl", null);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    OpenAIClient client = builder.build();
    return new OpenAiLlmClient(client, subConfiguration);
  }
}
