package com.gentoro.medrag.graph.driver.spi;

import com.gentoro.medrag.config.MedRagSettings.GraphSettings;
import com.gentoro.medrag.graph.GraphStore;

/**
 * Service provider for pluggable graph drivers, discovered through {@link java.util.ServiceLoader}.
 *
 * <p>Register implementations in {@code
 * META-INF/services/com.gentoro.medrag.graph.driver.spi.GraphStoreProvider}.
 */
public interface GraphStoreProvider {

  /** Stable lowercase id matched against {@code graph.driver}. */
  String id();

  /** Whether the provider can serve the given settings, e.g. required connection details exist. */
  default boolean isAvailable(GraphSettings settings) {
    return true;
  }

  /** Create an unopened store; the caller invokes {@link GraphStore#initialize()}. */
  GraphStore create(GraphSettings settings);
}
