package com.gentoro.medrag.generation;

import java.util.List;

/**
 * Chat-style access to a Large Language Model provider.
 *
 * <p>Concrete providers live behind this interface and are selected through {@link
 * LlmClientFactory} using the {@link java.util.ServiceLoader} managed SPI {@link
 * LlmClientProvider}.
 */
public interface LlmClient {

  /**
   * Run one completion over the given messages.
   *
   * @return the model's answer, trimmed
   * @throws com.gentoro.medrag.exception.LlmException on provider, network or quota failures
   */
  String chat(List<Message> messages);

  /** Model identifier reported in responses and logs. */
  String modelId();

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {}
}
