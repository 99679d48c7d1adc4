package com.gentoro.medrag.exception;

/** JSON/YAML (de)serialization failures. */
public class SerializationException extends MedRagException {
  public SerializationException(String message) {
    super(MedRagErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(MedRagErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
