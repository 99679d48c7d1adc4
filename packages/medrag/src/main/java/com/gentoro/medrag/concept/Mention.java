package com.gentoro.medrag.concept;

import java.util.Objects;

/**
 * An occurrence of a concept's surface form in one text input.
 *
 * @param surfaceForm text as it appears in the input
 * @param conceptId canonical concept identifier (UMLS CUI)
 * @param confidence matcher score in [0, 1]
 * @param start inclusive character offset
 * @param end exclusive character offset
 */
public record Mention(String surfaceForm, String conceptId, double confidence, int start, int end) {
  public Mention {
    Objects.requireNonNull(surfaceForm, "surfaceForm");
    Objects.requireNonNull(conceptId, "conceptId");
    if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
      throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
    }
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("invalid span [" + start + "," + end + ")");
    }
  }

  public int length() {
    return end - start;
  }
}
