package com.gentoro.medrag.exception;

/** I/O operation failed (filesystem, classpath, network streams). */
public class IoException extends MedRagException {
  public IoException(String message) {
    super(MedRagErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(MedRagErrorCode.IO_ERROR, message, cause);
  }
}
