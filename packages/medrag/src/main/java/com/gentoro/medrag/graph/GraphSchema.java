package com.gentoro.medrag.graph;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/** Node labels, edge types and identity functions shared by every graph driver. */
public final class GraphSchema {
  public static final String DOCUMENT = "Document";
  public static final String ENTITY = "Entity";
  public static final String CONCEPT = "Concept";

  public static final String HAS_CONCEPT = "HAS_CONCEPT";
  public static final String BROADER_THAN = "BROADER_THAN";
  public static final String NARROWER_THAN = "NARROWER_THAN";
  public static final String RELATES_TO = "RELATES_TO";

  public static final String CONCEPT_NAME_PREFIX = "UMLS_";

  private GraphSchema() {}

  /** Deterministic node id for a concept: name-based UUID of {@code umls:<conceptId>}. */
  public static String conceptNodeId(String conceptId) {
    return nameUuid("umls:" + conceptId);
  }

  public static String conceptNodeName(String conceptId) {
    return CONCEPT_NAME_PREFIX + conceptId;
  }

  /** Deterministic edge id for the {@code (source, type, target)} triple. */
  public static String edgeId(String sourceNodeId, String type, String targetNodeId) {
    return nameUuid(sourceNodeId + "|" + type + "|" + targetNodeId);
  }

  public static String newNodeId() {
    return UUID.randomUUID().toString();
  }

  private static String nameUuid(String value) {
    return UUID.nameUUIDFromBytes(value.getBytes(StandardCharsets.UTF_8)).toString();
  }
}
