package com.gentoro.medrag.exception;

/** Errors raised while interacting with an LLM provider or interpreting its responses. */
public class LlmException extends MedRagException {
  public LlmException(String message) {
    super(MedRagErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(MedRagErrorCode.LLM_ERROR, message, cause);
  }
}
