package com.gentoro.medrag.graph.driver.providers;

import com.gentoro.medrag.config.MedRagSettings.GraphSettings;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.graph.driver.arangodb.ArangoGraphStore;
import com.gentoro.medrag.graph.driver.spi.GraphStoreProvider;

/** Service provider for the ArangoDB driver. */
public class ArangoGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "arangodb";
  }

  @Override
  public boolean isAvailable(GraphSettings settings) {
    return settings.host() != null && !settings.host().isBlank();
  }

  @Override
  public GraphStore create(GraphSettings settings) {
    return new ArangoGraphStore(settings);
  }
}
