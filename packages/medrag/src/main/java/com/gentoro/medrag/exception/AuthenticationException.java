package com.gentoro.medrag.exception;

import java.util.Map;

/**
 * Credentials were rejected by a remote service. Callers must stop issuing further calls to the
 * same service within the current batch instead of retrying per item.
 */
public class AuthenticationException extends MedRagException {
  public AuthenticationException(String message) {
    super(MedRagErrorCode.UNAUTHENTICATED, message);
  }

  public AuthenticationException(String message, Map<String, ?> details) {
    super(MedRagErrorCode.UNAUTHENTICATED, message, details);
  }
}
