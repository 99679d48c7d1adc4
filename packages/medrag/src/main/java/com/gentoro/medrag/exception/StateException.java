package com.gentoro.medrag.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends MedRagException {
  public StateException(String message) {
    super(MedRagErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(MedRagErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
