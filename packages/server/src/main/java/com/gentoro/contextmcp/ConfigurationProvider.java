package com.gentoro.contextmcp;

import com.gentoro.contextmcp.exception.ConfigException;
import com.gentoro.contextmcp.exception.SerializationException;
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
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.ConfigurationInterpolator;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML configuration and exposes it as an Apache Commons {@link Configuration}.
 *
 * <p>Location formats: {@code classpath:some/path.yaml}, a {@code file:} URI, or a plain relative
 * or absolute filesystem path. Values may reference {@code ${env:NAME}}; names missing from the
 * process environment are looked up in a {@code .env.local} file, or in the file named by {@code
 * CONTEXT_MCP_ENV_FILE}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String ENV_FILE_VARIABLE = "CONTEXT_MCP_ENV_FILE";
  private static final String MASK = "******";
  private static final List<String> SENSITIVE_MARKERS =
      List.of("secret", "password", "api-key", "apikey", "token");

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  public Configuration config() {
    return configuration;
  }

  /**
   * Sorted {@code key=value} view of the effective configuration for startup logs. Values of
   * sensitive keys are masked; interpolation failures show as {@code <unresolved>}.
   */
  public Map<String, String> describe() {
    Map<String, String> view = new TreeMap<>();
    Iterator<String> keys = configuration.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value;
      try {
        value = configuration.getString(key);
      } catch (RuntimeException e) {
        log.debug("Could not resolve configuration key {}", key, e);
        value = "<unresolved>";
      }
      view.put(key, isSensitive(key) && value != null && !value.isEmpty() ? MASK : value);
    }
    return view;
  }

  static boolean isSensitive(String key) {
    String lower = key.toLowerCase(Locale.ROOT);
    return SENSITIVE_MARKERS.stream().anyMatch(lower::contains);
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      log.warn("Configuration resource {} not found; using defaults", resourceName);
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
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
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
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration location: " + loc, e);
      }
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
    public Object lookup(String expression) {
      // ${env:NAME:-default} may reach the lookup unsplit
      int split = expression.indexOf(":-");
      String key = split < 0 ? expression : expression.substring(0, split);
      String defaultValue = split < 0 ? null : expression.substring(split + 2);
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }

      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            Path path = findEnvFile();
            if (path == null) {
              log.debug("No .env.local found; {} resolved from the environment only", key);
              this.fallback = new HashMap<>();
            } else {
              this.fallback = readKeyValueFile(path);
            }
          }
        }
      }
      return fallback.getOrDefault(key, defaultValue);
    }

    private Path findEnvFile() {
      String explicit = System.getenv(ENV_FILE_VARIABLE);
      if (explicit != null && !explicit.isBlank()) {
        Path path = Paths.get(explicit.trim());
        if (Files.isRegularFile(path)) return path;
        log.warn("{} points to {}, which is not a file", ENV_FILE_VARIABLE, path);
      }
      Path[] candidates = {Paths.get(".env.local"), Paths.get("packages/server/.env.local")};
      for (Path candidate : candidates) {
        if (Files.exists(candidate)) return candidate;
      }
      return null;
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
        log.warn("Could not read {}; ignoring it", path.toAbsolutePath(), e);
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
