package com.gentoro.medrag.exception;

import java.util.Map;
import java.util.Objects;

/**
 * Root of every failure the pipeline raises on purpose. The {@link MedRagErrorCode} is what ends up
 * in answer metadata; {@code details} carries identifiers (concept id, endpoint, node id) that
 * appear in log lines only.
 */
public class MedRagException extends RuntimeException {
  private final MedRagErrorCode code;
  private final Map<String, Object> details;

  public MedRagException(MedRagErrorCode code, String message) {
    this(code, message, Map.of(), null);
  }

  public MedRagException(MedRagErrorCode code, String message, Throwable cause) {
    this(code, message, Map.of(), cause);
  }

  public MedRagException(MedRagErrorCode code, String message, Map<String, ?> details) {
    this(code, message, details, null);
  }

  private MedRagException(
      MedRagErrorCode code, String message, Map<String, ?> details, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.details = details == null ? Map.of() : Map.copyOf(details);
  }

  public MedRagErrorCode getCode() {
    return code;
  }

  /** Identifiers of the item that failed; empty when the failure is not tied to one. */
  public Map<String, Object> getDetails() {
    return details;
  }

  @Override
  public String toString() {
    String text = getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    return details.isEmpty() ? text : text + " " + details;
  }
}
