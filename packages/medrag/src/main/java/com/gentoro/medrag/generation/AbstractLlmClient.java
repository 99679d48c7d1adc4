package com.gentoro.medrag.generation;

import com.gentoro.medrag.exception.ExceptionUtil;
import com.gentoro.medrag.exception.LlmException;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link LlmClient} with the common plumbing: timing, trace logging and translation of
 * provider failures into {@link LlmException}.
 *
 * <p>Subclasses implement {@link #runInference(List)} with a concrete provider SDK.
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(AbstractLlmClient.class);
  protected final Configuration configuration;

  protected AbstractLlmClient(Configuration configuration) {
    this.configuration = configuration;
  }

  @Override
  public String chat(List<Message> messages) {
    if (messages == null || messages.isEmpty()) {
      throw new LlmException("At least one message is required");
    }
    log.trace("chat() called with {} message(s) for model {}", messages.size(), modelId());
    long start = System.currentTimeMillis();
    try {
      return runInference(messages);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          (ex) ->
              new LlmException(
                  "There was a problem while running the inference with the chosen model.", ex));
    } finally {
      log.debug("chat() took {} ms", System.currentTimeMillis() - start);
    }
  }

  public abstract String runInference(List<Message> messages);
}
