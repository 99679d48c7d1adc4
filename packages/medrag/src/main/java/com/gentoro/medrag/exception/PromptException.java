package com.gentoro.medrag.exception;

/** Prompt template could not be loaded or rendered. */
public class PromptException extends MedRagException {
  public PromptException(String message) {
    super(MedRagErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(MedRagErrorCode.PROMPT_ERROR, message, cause);
  }
}
