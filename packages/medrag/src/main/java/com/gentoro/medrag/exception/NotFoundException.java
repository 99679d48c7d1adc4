package com.gentoro.medrag.exception;

/** Requested resource could not be located. */
public class NotFoundException extends MedRagException {
  public NotFoundException(String message) {
    super(MedRagErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(MedRagErrorCode.NOT_FOUND, message, cause);
  }
}
