package com.gentoro.medrag.exception;

/** Graph store operation failed. */
public class GraphException extends MedRagException {
  public GraphException(String message) {
    super(MedRagErrorCode.GRAPH_ERROR, message);
  }

  public GraphException(String message, Throwable cause) {
    super(MedRagErrorCode.GRAPH_ERROR, message, cause);
  }
}
