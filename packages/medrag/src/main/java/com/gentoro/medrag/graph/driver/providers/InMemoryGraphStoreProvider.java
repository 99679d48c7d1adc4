package com.gentoro.medrag.graph.driver.providers;

import com.gentoro.medrag.config.MedRagSettings.GraphSettings;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.graph.driver.memory.InMemoryGraphStore;
import com.gentoro.medrag.graph.driver.spi.GraphStoreProvider;

/** Service provider for the process-local driver. */
public class InMemoryGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public GraphStore create(GraphSettings settings) {
    return new InMemoryGraphStore();
  }
}
