package com.gentoro.medrag.concept;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical attributes of a concept as returned by the terminology service.
 *
 * <p>{@code semanticCategories} keeps first-seen order without duplicates. {@code attributes}
 * holds informational values such as atom and relation counts.
 */
public record ConceptDetails(
    String conceptId,
    String canonicalName,
    List<String> semanticCategories,
    List<String> definitions,
    Map<String, Object> attributes) {

  public ConceptDetails {
    Objects.requireNonNull(conceptId, "conceptId");
    canonicalName = canonicalName == null || canonicalName.isBlank() ? conceptId : canonicalName;
    semanticCategories =
        semanticCategories == null
            ? List.of()
            : Collections.unmodifiableList(
                new ArrayList<>(new LinkedHashSet<>(semanticCategories)));
    definitions = definitions == null ? List.of() : List.copyOf(definitions);
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public ConceptDetails(
      String conceptId, String canonicalName, List<String> categories, List<String> definitions) {
    this(conceptId, canonicalName, categories, definitions, Map.of());
  }

  public ConceptDetails withDefinitions(List<String> newDefinitions) {
    return new ConceptDetails(
        conceptId, canonicalName, semanticCategories, newDefinitions, attributes);
  }
}
