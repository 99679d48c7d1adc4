package com.gentoro.medrag.exception;

/** Network-level communication error (HTTP, sockets, timeouts). */
public class NetworkException extends MedRagException {
  public NetworkException(String message) {
    super(MedRagErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(MedRagErrorCode.NETWORK_ERROR, message, cause);
  }
}
