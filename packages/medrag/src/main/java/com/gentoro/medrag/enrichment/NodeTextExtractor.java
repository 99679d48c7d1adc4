package com.gentoro.medrag.enrichment;

import com.gentoro.medrag.graph.GraphNodeRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Picks the text of a stored node that concept extraction runs on. */
public final class NodeTextExtractor {
  static final List<String> TEXT_FIELDS =
      List.of("summary", "content", "episode_body", "description", "text");
  static final int MIN_FALLBACK_VALUE_LENGTH = 50;

  private NodeTextExtractor() {}

  /**
   * First non-blank of the known text fields. Otherwise the node name followed by every string
   * property longer than {@value #MIN_FALLBACK_VALUE_LENGTH} characters.
   */
  public static String extract(GraphNodeRecord node) {
    for (String field : TEXT_FIELDS) {
      String v = node.stringProperty(field);
      if (v != null && !v.isBlank()) return v;
    }
    List<String> parts = new ArrayList<>();
    if (!node.name().isBlank()) parts.add(node.name());
    for (Map.Entry<String, Object> e : node.properties().entrySet()) {
      if (e.getValue() instanceof String s && s.length() > MIN_FALLBACK_VALUE_LENGTH) {
        parts.add(s);
      }
    }
    return String.join(" ", parts);
  }
}
