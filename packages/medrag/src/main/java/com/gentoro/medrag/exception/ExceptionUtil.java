package com.gentoro.medrag.exception;

import java.util.function.Function;

/** Helpers for translating arbitrary failures into pipeline errors. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /** The error code reported for {@code t}; anything not raised by the pipeline is UNKNOWN. */
  public static MedRagErrorCode errorCode(Throwable t) {
    return t instanceof MedRagException e ? e.getCode() : MedRagErrorCode.UNKNOWN;
  }

  /** Message suitable for the console; falls back to the exception type when there is none. */
  public static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }

  /**
   * Returns {@code t} when it already is a pipeline error, otherwise the exception built by {@code
   * wrapper}. Meant to be thrown by the caller: {@code throw rethrowIfUnchecked(e, ...)}.
   */
  public static MedRagException rethrowIfUnchecked(
      Throwable t, Function<Throwable, MedRagException> wrapper) {
    return t instanceof MedRagException e ? e : wrapper.apply(t);
  }
}
