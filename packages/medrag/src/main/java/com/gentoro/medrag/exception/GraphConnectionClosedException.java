package com.gentoro.medrag.exception;

/** An operation was attempted on a graph store whose connection has already been closed. */
public class GraphConnectionClosedException extends StateException {
  public GraphConnectionClosedException(String storeName) {
    super("Graph connection '%s' is closed".formatted(storeName));
  }
}
