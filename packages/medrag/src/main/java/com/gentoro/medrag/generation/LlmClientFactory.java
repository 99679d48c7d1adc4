package com.gentoro.medrag.generation;

import com.gentoro.medrag.exception.ConfigException;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Creates {@link LlmClient} instances from configuration.
 *
 * <p>Example configuration:
 *
 * <pre>
 *   llm.active-profile = openai
 *   llm.openai.provider = openai
 *   llm.openai.apiKey = sk-...
 *   llm.openai.model = gpt-4o
 * </pre>
 */
public final class LlmClientFactory {
  private LlmClientFactory() {}

  /** Creates the client named by {@code llm.active-profile}. */
  public static LlmClient createProvider(Configuration configuration) {
    return create(activeProfile(configuration));
  }

  /** The {@code llm.<profile>} subset selected by {@code llm.active-profile}. */
  public static Configuration activeProfile(Configuration configuration) {
    String namespace = configuration.getString("llm.active-profile", "default").trim();
    if (namespace.isEmpty() || !configuration.getKeys("llm.%s".formatted(namespace)).hasNext()) {
      throw new ConfigException("Missing llm.%s configuration".formatted(namespace));
    }
    return configuration.subset("llm.%s".formatted(namespace));
  }

  /** Creates a client from a provider-specific subset; {@code provider} selects the SPI. */
  public static LlmClient create(Configuration subConfig) {
    String provider = subConfig.getString("provider");
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.provider");
    }
    provider = provider.trim().toLowerCase();

    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      if (provider.equals(p.providerId())) {
        return p.create(subConfig);
      }
    }
    throw new ConfigException("Unknown llm provider: " + provider);
  }
}
