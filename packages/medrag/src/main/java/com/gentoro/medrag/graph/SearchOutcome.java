package com.gentoro.medrag.graph;

import java.util.List;

/**
 * Result of a graph search. A degraded outcome carries no items and the reason the search could
 * not complete; callers continue with what they have.
 */
public record SearchOutcome<T>(List<T> items, boolean degraded, String reason) {
  public SearchOutcome {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static <T> SearchOutcome<T> ok(List<T> items) {
    return new SearchOutcome<>(items, false, null);
  }

  public static <T> SearchOutcome<T> degraded(String reason) {
    return new SearchOutcome<>(List.of(), true, reason);
  }
}
