package com.gentoro.medrag.pipeline;

import com.gentoro.medrag.config.MedRagSettings.RetrievalSettings;

/** Per-question retrieval options. */
public record QueryOptions(boolean includeConcepts, int maxFacts, int maxEntities) {

  public static QueryOptions defaults(RetrievalSettings settings) {
    return new QueryOptions(
        settings.includeConcepts(), settings.maxFacts(), settings.maxEntities());
  }

  public QueryOptions withIncludeConcepts(boolean include) {
    return new QueryOptions(include, maxFacts, maxEntities);
  }
}
