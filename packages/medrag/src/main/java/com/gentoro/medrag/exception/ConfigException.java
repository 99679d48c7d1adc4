package com.gentoro.medrag.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends MedRagException {
  public ConfigException(String message) {
    super(MedRagErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(MedRagErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
