package com.gentoro.medrag.graph;

import com.gentoro.medrag.config.MedRagSettings.GraphSettings;
import com.gentoro.medrag.exception.ConfigException;
import com.gentoro.medrag.graph.driver.spi.GraphStoreProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/** Resolves the configured {@code graph.driver} to a {@link GraphStoreProvider}. */
public final class GraphStoreFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(GraphStoreFactory.class);

  private GraphStoreFactory() {}

  /** Create an unopened store for {@code settings.driver()}. */
  public static GraphStore create(GraphSettings settings) {
    String driver = settings.driver();
    List<String> known = new ArrayList<>();
    for (GraphStoreProvider p : ServiceLoader.load(GraphStoreProvider.class)) {
      known.add(p.id());
      if (!p.id().equalsIgnoreCase(driver)) continue;
      if (!p.isAvailable(settings)) {
        throw new ConfigException(
            "Graph driver '%s' is not available with the current settings".formatted(driver));
      }
      log.info("Using graph driver '{}'", p.id());
      return p.create(settings);
    }
    throw new ConfigException(
        "Unknown graph.driver '%s'; known drivers: %s".formatted(driver, known));
  }
}
