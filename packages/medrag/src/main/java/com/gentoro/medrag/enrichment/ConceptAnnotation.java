package com.gentoro.medrag.enrichment;

import com.gentoro.medrag.concept.ConceptDetails;
import com.gentoro.medrag.concept.Mention;
import java.util.Objects;
import java.util.Optional;

/** A mention found in a query, with the concept details when the service returned them. */
public record ConceptAnnotation(Mention mention, ConceptDetails details) {
  public ConceptAnnotation {
    Objects.requireNonNull(mention, "mention");
  }

  public Optional<ConceptDetails> detailsIfPresent() {
    return Optional.ofNullable(details);
  }
}
