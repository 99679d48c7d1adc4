package com.gentoro.medrag.generation;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable LLM providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and identify themselves
 * with a stable {@code providerId}. Register a provider in {@code
 * META-INF/services/com.gentoro.medrag.generation.LlmClientProvider}.
 */
public interface LlmClientProvider {

  /** A stable, lowercase identifier for this provider (e.g. "openai"). */
  String providerId();

  /**
   * Creates a configured {@link LlmClient} instance.
   *
   * @param subConfiguration provider-specific configuration subset (e.g. {@code llm.openai.*}).
   * @throws com.gentoro.medrag.exception.ConfigException when required keys are missing.
   */
  LlmClient create(Configuration subConfiguration);
}
