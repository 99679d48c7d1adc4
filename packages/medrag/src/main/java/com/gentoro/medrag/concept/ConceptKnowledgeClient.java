package com.gentoro.medrag.concept;

import java.util.List;
import java.util.Optional;

/**
 * Keyed lookup against a remote terminology service.
 *
 * <p>Both calls are independent: a failure of one does not affect the other. Transient failures
 * (timeouts, 5xx) and a missing concept come back as absent/empty. Rejected credentials are raised
 * as {@link com.gentoro.medrag.exception.AuthenticationException} so callers can stop the batch.
 */
public interface ConceptKnowledgeClient {

  Optional<ConceptDetails> getDetails(String conceptId);

  /** Hierarchy relations only; other relation kinds are filtered out by the implementation. */
  List<ConceptRelation> getRelations(String conceptId);
}
