package com.gentoro.medrag.concept;

import com.gentoro.medrag.exception.AuthenticationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Batch-scoped view over a {@link ConceptKnowledgeClient}.
 *
 * <p>Details and relations are memoized by concept id, so the number of remote calls is bounded
 * by the number of distinct concepts in the batch. Once the service has rejected the credentials,
 * every further lookup rethrows that failure without issuing another request.
 *
 * <p>Not thread-safe; one instance belongs to one batch on one thread.
 */
public class ConceptLookupSession {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(ConceptLookupSession.class);

  private final ConceptKnowledgeClient client;
  private final Map<String, Optional<ConceptDetails>> details = new HashMap<>();
  private final Map<String, List<ConceptRelation>> relations = new HashMap<>();
  private AuthenticationException authFailure;
  private int remoteCalls;

  public ConceptLookupSession(ConceptKnowledgeClient client) {
    this.client = client;
  }

  public Optional<ConceptDetails> details(String conceptId) {
    Optional<ConceptDetails> cached = details.get(conceptId);
    if (cached != null) return cached;
    ensureAuthenticated();
    Optional<ConceptDetails> value;
    try {
      remoteCalls++;
      value = client.getDetails(conceptId);
    } catch (AuthenticationException e) {
      throw recordAuthFailure(e, conceptId);
    }
    details.put(conceptId, value == null ? Optional.empty() : value);
    return details.get(conceptId);
  }

  public List<ConceptRelation> relations(String conceptId) {
    List<ConceptRelation> cached = relations.get(conceptId);
    if (cached != null) return cached;
    ensureAuthenticated();
    List<ConceptRelation> value;
    try {
      remoteCalls++;
      value = client.getRelations(conceptId);
    } catch (AuthenticationException e) {
      throw recordAuthFailure(e, conceptId);
    }
    List<ConceptRelation> copy = value == null ? List.of() : List.copyOf(value);
    relations.put(conceptId, copy);
    return copy;
  }

  public boolean isAuthenticationFailed() {
    return authFailure != null;
  }

  /** Number of calls forwarded to the underlying client. */
  public int remoteCalls() {
    return remoteCalls;
  }

  private void ensureAuthenticated() {
    if (authFailure != null) {
      throw authFailure;
    }
  }

  private AuthenticationException recordAuthFailure(AuthenticationException e, String conceptId) {
    log.error(
        "Terminology service rejected credentials while looking up {}; no further lookups in this"
            + " batch",
        conceptId);
    authFailure = e;
    return e;
  }
}
