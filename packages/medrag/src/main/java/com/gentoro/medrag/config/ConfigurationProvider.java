package com.gentoro.medrag.config;

import com.gentoro.medrag.exception.ConfigException;
import com.gentoro.medrag.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.ConfigurationInterpolator;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath) and absolute or relative filesystem paths (e.g., "/etc/medrag.yaml" or
 * "config/local.yaml"). Values may reference {@code ${env:NAME}}; when the process environment does
 * not define the variable, a {@code .env.local} file in the working directory is consulted.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(ConfigurationProvider.class);
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      // Empty configuration lets every component fall back to its defaults.
      log.warn("Configuration resource '{}' not found on classpath, using defaults", resourceName);
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return addOns(config);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    try {
      URI uri = URI.create(loc);
      if (uri.getScheme() != null && uri.getScheme().equalsIgnoreCase("file")) {
        return loadYamlFromFile(new File(uri));
      }
    } catch (IllegalArgumentException e) {
      log.debug("Location '{}' is not a URI, treating it as a file path", loc);
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    ConfigurationInterpolator interpolator = config.getInterpolator();
    interpolator.registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  private static class FallbackEnvLookup implements Lookup {
    private volatile Map<String, String> fallback = null;

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }

      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            Path path = Paths.get(".env.local");
            if (!Files.exists(path)) {
              log.info(
                  "No .env.local found in {}, skipping environment fallback",
                  path.toAbsolutePath());
              this.fallback = new HashMap<>();
            } else {
              this.fallback = readKeyValueFile(path);
            }
          }
        }
      }

      // Unset variables resolve to an empty value so optional settings fall back to defaults.
      return fallback.getOrDefault(key, "");
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env.local file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("#"))
            .map(this::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
      } catch (IOException e) {
        log.warn("Could not read {}: {}", path.toAbsolutePath(), e.getMessage());
        return Collections.emptyMap();
      }
    }

    private Map.Entry<String, String> parseLine(String line) {
      int idx = line.indexOf('=');
      if (idx <= 0) return Map.entry("", "");
      String key = line.substring(0, idx).trim();
      String val = line.substring(idx + 1).trim();
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
