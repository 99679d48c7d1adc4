package com.gentoro.medrag.graph.driver.arangodb;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.arangodb.ArangoCollection;
import com.arangodb.ArangoCursor;
import com.arangodb.ArangoDBException;
import com.arangodb.ArangoDatabase;
import com.arangodb.model.AqlQueryOptions;
import com.gentoro.medrag.concept.ConceptDetails;
import com.gentoro.medrag.config.MedRagSettings.GraphSettings;
import com.gentoro.medrag.exception.GraphConnectionClosedException;
import com.gentoro.medrag.graph.GraphSchema;
import com.gentoro.medrag.graph.GraphStatistics;
import com.gentoro.medrag.graph.RetrievedFact;
import com.gentoro.medrag.graph.SearchOutcome;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings({"unchecked", "rawtypes"})
class ArangoGraphStoreTest {

  private static final GraphSettings SETTINGS =
      new GraphSettings("arangodb", "localhost", 8529, "root", "pw", "medrag");

  @Mock private ArangoDatabase db;
  @Mock private ArangoCollection collection;
  @Mock private ArangoCursor mapCursor;
  @Mock private ArangoCursor stringCursor;

  private ArangoGraphStore store;

  @BeforeEach
  void setUp() {
    lenient().when(db.collection(anyString())).thenReturn(collection);
    lenient().when(collection.exists()).thenReturn(true);
    store = new ArangoGraphStore(SETTINGS, db);
    store.initialize();
  }

  @Test
  void conceptUpsertSendsIdentifiersAsBindVariables() {
    // Arrange
    doReturn(mapCursor).when(db).query(anyString(), eq(Map.class), anyMap(), any(AqlQueryOptions.class));
    when(mapCursor.asListRemaining()).thenReturn(List.of());
    ArgumentCaptor<String> aql = ArgumentCaptor.forClass(String.class);
    ArgumentCaptor<Map> bind = ArgumentCaptor.forClass(Map.class);

    // Act
    String key =
        store.upsertConcept(
            "C0004057", new ConceptDetails("C0004057", "Aspirin", List.of(), List.of("Analgesic.")));

    // Assert
    verify(db).query(aql.capture(), eq(Map.class), bind.capture(), any(AqlQueryOptions.class));
    assertEquals(GraphSchema.conceptNodeId("C0004057"), key);
    assertFalse(aql.getValue().contains("C0004057"));
    assertFalse(aql.getValue().contains(key));
    assertEquals(key, bind.getValue().get("key"));
    Map<String, Object> doc = (Map<String, Object>) bind.getValue().get("doc");
    assertEquals("C0004057", doc.get("conceptId"));
    assertEquals("UMLS_C0004057", doc.get("name"));
  }

  @Test
  void conceptUpsertReplacesStoredDocumentButKeepsCreationTime() throws Exception {
    // Arrange
    doReturn(mapCursor).when(db).query(anyString(), eq(Map.class), anyMap(), any(AqlQueryOptions.class));
    when(mapCursor.asListRemaining()).thenReturn(List.of());
    ArgumentCaptor<String> aql = ArgumentCaptor.forClass(String.class);

    // Act
    store.upsertConcept("C0004057", new ConceptDetails("C0004057", "Aspirin", List.of(), List.of()));

    // Assert
    verify(db).query(aql.capture(), eq(Map.class), anyMap(), any(AqlQueryOptions.class));
    assertTrue(aql.getValue().contains("REPLACE MERGE(@doc"));
    assertTrue(aql.getValue().contains("createdAt: OLD.createdAt"));
    assertFalse(aql.getValue().contains("UPDATE"));
    verify(mapCursor).close();
  }

  @Test
  void cursorIsClosedWhenReadingFails() throws Exception {
    doReturn(mapCursor).when(db).query(anyString(), eq(Map.class), anyMap(), any(AqlQueryOptions.class));
    when(mapCursor.asListRemaining()).thenThrow(new ArangoDBException("cursor lost"));

    SearchOutcome<RetrievedFact> outcome = store.searchFacts("aspirin", 5);

    assertTrue(outcome.degraded());
    verify(mapCursor).close();
  }

  @Test
  void statisticsMapsCountsStructureAndSemanticTypes() {
    // Arrange
    doReturn(mapCursor).when(db).query(anyString(), eq(Map.class), anyMap(), any(AqlQueryOptions.class));
    Map<String, Object> row = new HashMap<>();
    row.put("documents", 3);
    row.put("entities", 1);
    row.put("concepts", 2);
    row.put("facts", 1);
    row.put("hasConcept", 3);
    row.put("hierarchy", List.of(Map.of("type", GraphSchema.BROADER_THAN, "n", 1)));
    row.put("nodesWithConcepts", 2);
    row.put("connectedNodes", 5);
    row.put("degreeSum", 10);
    row.put(
        "mostConnected",
        List.of(
            Map.of("id", "doc-1", "name", "Aspirin trial", "degree", 4),
            Map.of("id", "doc-2", "name", "Sepsis review", "degree", 2)));
    row.put(
        "semanticTypes",
        List.of(
            Map.of("type", "Pharmacologic Substance", "n", 2),
            Map.of("type", "Disease or Syndrome", "n", 1)));
    when(mapCursor.asListRemaining()).thenReturn(List.of(row));
    ArgumentCaptor<Map> bind = ArgumentCaptor.forClass(Map.class);

    // Act
    GraphStatistics stats = store.statistics();

    // Assert
    verify(db).query(anyString(), eq(Map.class), bind.capture(), any(AqlQueryOptions.class));
    assertEquals(GraphStatistics.MOST_CONNECTED, bind.getValue().get("topNodes"));
    assertEquals(6, stats.totalNodes());
    assertEquals(5, stats.totalRelationships());
    assertEquals(1, stats.isolatedNodes());
    assertEquals(10.0 / 6, stats.averageDegree(), 1e-9);
    assertEquals(50.0, stats.umlsCoveragePercent(), 1e-9);
    assertEquals(
        List.of("Pharmacologic Substance", "Disease or Syndrome"),
        List.copyOf(stats.topSemanticTypes().keySet()));
    assertEquals("doc-1", stats.mostConnectedNodes().get(0).id());
    assertEquals(4, stats.mostConnectedNodes().get(0).degree());
    assertEquals(1L, stats.relationshipsByType().get(GraphSchema.BROADER_THAN));
  }

  @Test
  void linkMergesEdgeKeyedByTriple() {
    // Arrange
    doReturn(stringCursor)
        .when(db)
        .query(anyString(), eq(String.class), anyMap(), any(AqlQueryOptions.class));
    when(stringCursor.asListRemaining())
        .thenReturn(List.of("documents/doc-1"), List.of("concepts/" + GraphSchema.conceptNodeId("C1")));
    doReturn(mapCursor).when(db).query(anyString(), eq(Map.class), anyMap(), any(AqlQueryOptions.class));
    when(mapCursor.asListRemaining()).thenReturn(List.of());
    ArgumentCaptor<Map> bind = ArgumentCaptor.forClass(Map.class);

    // Act
    boolean linked = store.linkConceptToNode("doc-1", "C1", Map.of("similarity", 0.92));

    // Assert
    assertTrue(linked);
    verify(db).query(anyString(), eq(Map.class), bind.capture(), any(AqlQueryOptions.class));
    Map<String, Object> merge = bind.getValue();
    assertEquals(ArangoGraphStore.COLLECTION_HAS_CONCEPT, merge.get("@edges"));
    assertEquals(
        GraphSchema.edgeId("doc-1", GraphSchema.HAS_CONCEPT, GraphSchema.conceptNodeId("C1")),
        merge.get("key"));
    assertEquals("documents/doc-1", merge.get("from"));
    assertEquals(Map.of("similarity", 0.92), merge.get("props"));
  }

  @Test
  void malformedNodeIdNeverReachesTheDatabase() {
    boolean linked = store.linkConceptToNode("x\" RETURN 1 //", "C1", Map.of());

    assertFalse(linked);
    verify(db, never()).query(anyString(), any(Class.class), anyMap(), any(AqlQueryOptions.class));
  }

  @Test
  void failingSearchQueryDegrades() {
    doThrow(new ArangoDBException("connection refused"))
        .when(db)
        .query(anyString(), eq(Map.class), anyMap(), any(AqlQueryOptions.class));

    SearchOutcome<RetrievedFact> outcome = store.searchFacts("aspirin dosage", 5);

    assertTrue(outcome.degraded());
    assertTrue(outcome.items().isEmpty());
    assertNotNull(outcome.reason());
  }

  @Test
  void searchRowsAreMappedInServerOrder() {
    doReturn(mapCursor).when(db).query(anyString(), eq(Map.class), anyMap(), any(AqlQueryOptions.class));
    when(mapCursor.asListRemaining())
        .thenReturn(
            List.of(
                Map.of("uuid", "f1", "fact", "aspirin reduces fever", "sourceId", "a", "targetId", "b",
                    "sourceName", "Aspirin", "targetName", "Fever", "validFrom", "2020-01-01T00:00:00Z"),
                Map.of("uuid", "f2", "fact", "aspirin thins blood", "sourceId", "a", "targetId", "c")));

    SearchOutcome<RetrievedFact> outcome = store.searchFacts("aspirin", 2);

    assertEquals(List.of("f1", "f2"), outcome.items().stream().map(RetrievedFact::uuid).toList());
    assertEquals("Fever", outcome.items().get(0).targetName());
    assertNull(outcome.items().get(1).targetName());
    assertNotNull(outcome.items().get(0).validFrom());
  }

  @Test
  void operationsAfterCloseFailWithConnectionClosed() {
    store.close();

    assertFalse(store.isOpen());
    assertThrows(GraphConnectionClosedException.class, () -> store.searchEntities("aspirin", 5));
    assertThrows(GraphConnectionClosedException.class, () -> store.upsertConcept("C1", null));
    verify(db, never()).query(anyString(), any(Class.class), anyMap(), any(AqlQueryOptions.class));
  }
}
