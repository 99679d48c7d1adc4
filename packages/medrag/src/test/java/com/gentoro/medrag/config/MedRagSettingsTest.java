package com.gentoro.medrag.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MedRagSettingsTest {

  @Test
  void defaultsApplyToEmptyConfiguration() {
    // Act
    MedRagSettings settings = MedRagSettings.defaults();

    // Assert
    assertEquals("in-memory", settings.graph().driver());
    assertEquals("localhost", settings.graph().host());
    assertEquals(10, settings.retrieval().maxFacts());
    assertEquals(5, settings.retrieval().maxEntities());
    assertTrue(settings.retrieval().includeConcepts());
    assertEquals(Duration.ofSeconds(30), settings.retrieval().timeout());
    assertEquals(200, settings.retrieval().summaryMaxChars());
    assertEquals(0.8, settings.matcher().confidenceThreshold());
    assertEquals(Set.of("RB"), settings.umls().broaderLabels());
    assertEquals(Set.of("RN"), settings.umls().narrowerLabels());
    assertEquals("medical-answer", settings.generation().promptId());
    assertEquals(100, settings.ingest().minTextLength());
    assertEquals(4096, settings.ingest().maxTextLength());
  }

  @Test
  void hostSelectsArangoDriverWhenDriverIsBlank() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("graph.driver", "");
    cfg.setProperty("graph.arangodb.host", "db.internal");
    cfg.setProperty("umls.broaderLabels", List.of("rb", " par "));

    MedRagSettings settings = MedRagSettings.from(cfg);

    assertEquals("arangodb", settings.graph().driver());
    assertEquals("db.internal", settings.graph().host());
    assertEquals(List.of("RB", "PAR"), List.copyOf(settings.umls().broaderLabels()));
  }

  @Test
  void validateReportsMissingCapabilities() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("graph.driver", "arangodb");

    List<String> problems = MedRagSettings.from(cfg).validate();

    assertEquals(3, problems.size());
    assertTrue(problems.get(0).contains("graph.arangodb.password"));
    assertTrue(problems.get(1).contains("umls.apiKey"));
    assertTrue(problems.get(2).contains("matcher.dictionaryPath"));
  }

  @Test
  void validateAcceptsCompleteConfiguration(@TempDir Path dir) throws Exception {
    Path dictionary = Files.writeString(dir.resolve("terms.tsv"), "C0032285\tpneumonia\n");
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("umls.apiKey", "key");
    cfg.setProperty("matcher.dictionaryPath", dictionary.toString());

    assertTrue(MedRagSettings.from(cfg).validate().isEmpty());
  }
}
