package com.gentoro.medrag.exception;

/** Input failed validation. */
public class ValidationException extends MedRagException {
  public ValidationException(String message) {
    super(MedRagErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(MedRagErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
