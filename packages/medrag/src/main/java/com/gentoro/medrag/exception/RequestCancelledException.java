package com.gentoro.medrag.exception;

/** The request was cancelled (deadline exceeded or caller interruption) before completion. */
public class RequestCancelledException extends MedRagException {
  public RequestCancelledException(String message) {
    super(MedRagErrorCode.CANCELLED, message);
  }

  public RequestCancelledException(String message, Throwable cause) {
    super(MedRagErrorCode.CANCELLED, message, cause);
  }
}
