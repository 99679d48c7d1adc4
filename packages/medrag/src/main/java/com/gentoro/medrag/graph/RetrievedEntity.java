package com.gentoro.medrag.graph;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** A node returned by {@link GraphStore#searchEntities}. */
public record RetrievedEntity(
    String uuid,
    String name,
    String summary,
    Set<String> labels,
    Instant createdAt,
    Map<String, Object> attributes) {

  public RetrievedEntity {
    Objects.requireNonNull(uuid, "uuid");
    name = name == null ? "" : name;
    summary = summary == null ? "" : summary;
    labels =
        labels == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(labels));
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
