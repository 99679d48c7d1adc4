package com.gentoro.medrag;

import com.gentoro.medrag.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line parameters, given as {@code --name value} pairs. A parameter directly followed by
 * another {@code --name} (or by nothing) is a flag and carries no value.
 */
public class StartupParameters {

  static final Set<String> MODES =
      Set.of("query", "import", "enrich", "expand", "stats", "interactive", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "interactive");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new ValidationException("Invalid mode: " + mode);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new ValidationException("Missing config file location");
    }

    if ("query".equals(mode) && getOptionalParameter("query", String.class).isEmpty()) {
      throw new ValidationException("Mode 'query' requires --query <question>");
    }
    if ("expand".equals(mode) && getOptionalParameter("concept", String.class).isEmpty()) {
      throw new ValidationException("Mode 'expand' requires --concept <CUI>");
    }
    intParameter("limit", 0);
    intParameter("depth", 1);
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/medrag.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  /** Integer parameter, or {@code defaultValue} when absent. */
  public int intParameter(String name, int defaultValue) {
    Optional<String> raw = getOptionalParameter(name, String.class);
    if (raw.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.get().trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("--" + name + " expects an integer, got: " + raw.get());
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
