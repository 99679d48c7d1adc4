package com.gentoro.medrag.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.medrag.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path dir;

  @Test
  void loadsBundledApplicationYaml() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();

    assertEquals("openai", cfg.getString("llm.active-profile"));
    assertEquals(8529, cfg.getInt("graph.arangodb.port"));
    assertEquals("medical-answer", cfg.getString("generation.promptId"));
  }

  @Test
  void unsetEnvironmentVariableResolvesToEmpty() throws Exception {
    Path file = dir.resolve("medrag.yaml");
    Files.writeString(
        file,
        """
        umls:
          apiKey: ${env:MEDRAG_TEST_VARIABLE_THAT_IS_NEVER_SET}
        retrieval:
          maxFacts: 3
        """);

    Configuration cfg = new ConfigurationProvider(file.toString()).config();
    MedRagSettings settings = MedRagSettings.from(cfg);

    assertEquals("", cfg.getString("umls.apiKey"));
    assertEquals("", settings.umls().apiKey());
    assertEquals(3, settings.retrieval().maxFacts());
    assertEquals(5, settings.retrieval().maxEntities());
  }

  @Test
  void fileUriIsAccepted() throws Exception {
    Path file = dir.resolve("uri.yaml");
    Files.writeString(file, "graph:\n  driver: in-memory\n");

    Configuration cfg = new ConfigurationProvider(file.toUri().toString()).config();

    assertEquals("in-memory", cfg.getString("graph.driver"));
  }

  @Test
  void missingClasspathResourceYieldsEmptyConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:nothing-here.yaml").config();

    assertTrue(cfg.isEmpty());
  }

  @Test
  void missingFileIsConfigurationError() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }
}
