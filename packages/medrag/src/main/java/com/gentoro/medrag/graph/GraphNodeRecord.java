package com.gentoro.medrag.graph;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only snapshot of a stored node: id, labels, free-text properties and creation time.
 * Properties hold driver-independent keys such as {@code content}, {@code summary} or {@code
 * conceptId}.
 */
public record GraphNodeRecord(
    String uuid,
    String name,
    Set<String> labels,
    Map<String, Object> properties,
    Instant createdAt) {

  public GraphNodeRecord {
    Objects.requireNonNull(uuid, "uuid");
    name = name == null ? "" : name;
    labels =
        labels == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(labels));
    properties =
        properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public boolean hasLabel(String label) {
    return labels.contains(label);
  }

  /** String value of a property, or null when absent or not textual. */
  public String stringProperty(String key) {
    Object v = properties.get(key);
    return v instanceof String s ? s : null;
  }
}
