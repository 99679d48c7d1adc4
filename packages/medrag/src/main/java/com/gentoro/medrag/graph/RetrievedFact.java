package com.gentoro.medrag.graph;

import java.time.Instant;
import java.util.Objects;

/**
 * A fact edge returned by {@link GraphStore#searchFacts}. Names are null when the driver could not
 * resolve the endpoint node; validity bounds are null when unknown.
 */
public record RetrievedFact(
    String uuid,
    String text,
    String sourceNodeId,
    String targetNodeId,
    String sourceName,
    String targetName,
    Instant validFrom,
    Instant validUntil) {

  public RetrievedFact {
    Objects.requireNonNull(uuid, "uuid");
    text = text == null ? "" : text;
    sourceNodeId = sourceNodeId == null ? "" : sourceNodeId;
    targetNodeId = targetNodeId == null ? "" : targetNodeId;
  }
}
