package com.gentoro.medrag.exception;

/**
 * Canonical error codes for the enrichment and retrieval pipeline. Codes are stable and suitable
 * for logs and response metadata. Prefer the most specific code that reflects where the failure
 * originated and whether the caller can act on it.
 */
public enum MedRagErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  UNAUTHENTICATED,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  GRAPH_ERROR,
  PROMPT_ERROR,
  LLM_ERROR,
  NETWORK_ERROR,
}
