package com.gentoro.medrag;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.medrag.exception.ValidationException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToInteractiveModeWithBundledConfig() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("interactive", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
  }

  @Test
  void parsesValuesAndFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--mode", "query",
              "--query", "What is sepsis?",
              "--no-concepts",
              "--config-file", "/etc/m.yaml"
            });

    assertEquals("query", params.mode());
    assertEquals("What is sepsis?", params.getParameter("query", String.class));
    assertTrue(params.isParameterPresent("no-concepts"));
    assertTrue(params.getOptionalParameter("no-concepts", String.class).isEmpty());
    assertEquals("/etc/m.yaml", params.configFile());
  }

  @Test
  void integerParameters() {
    StartupParameters params =
        new StartupParameters(new String[] {"--mode", "enrich", "--limit", " 25 "});

    assertEquals(25, params.intParameter("limit", 0));
    assertEquals(1, params.intParameter("depth", 1));
  }

  private static void assertRejected(String... args) {
    assertThrows(ValidationException.class, () -> new StartupParameters(args));
  }

  @Test
  void rejectsInvalidInput() {
    assertRejected("--mode", "serve");
    assertRejected("--mode", "query");
    assertRejected("--mode", "expand");
    assertRejected("--mode", "expand", "--concept", "C1", "--depth", "two");
    assertRejected("--config-file", " ");
  }
}
