package io.fullerstack.dispatch.config;

import java.time.Duration;
import java.util.*;

/**
 * Hierarchical configuration using ResourceBundle (zero dependencies).
 *
 * <p>Supports fallback chain:
 * <ol>
 *   <li>System properties</li>
 *   <li>dispatch_{runtime}.properties (runtime-specific)</li>
 *   <li>dispatch.properties (global defaults)</li>
 * </ol>
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # dispatch.properties (global defaults)
 * dispatch.pool.workers=0
 * dispatch.pool.queue-capacity=0
 *
 * # dispatch_ingest.properties (runtime override)
 * dispatch.pool.workers=16
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * HierarchicalConfig global = HierarchicalConfig.global();
 * int workers = global.getInt(HierarchicalConfig.POOL_WORKERS);
 *
 * HierarchicalConfig ingest = HierarchicalConfig.forRuntime("ingest");
 * Duration grace = ingest.getDuration(HierarchicalConfig.SCOPE_TEARDOWN_TIMEOUT_MS);
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <pre>
 * java -Ddispatch.pool.workers=32 -jar app.jar
 * </pre>
 */
public class HierarchicalConfig {

  public static final String POOL_WORKERS              = "dispatch.pool.workers";
  public static final String POOL_QUEUE_CAPACITY       = "dispatch.pool.queue-capacity";
  public static final String POOL_SHUTDOWN_TIMEOUT_MS  = "dispatch.pool.shutdown-timeout-ms";
  public static final String CONTEXT_STOP_TIMEOUT_MS   = "dispatch.context.stop-timeout-ms";
  public static final String SCOPE_TEARDOWN_TIMEOUT_MS = "dispatch.scope.teardown-timeout-ms";

  private static final String BASE_NAME = "dispatch";

  private final List<ResourceBundle> bundles;  // Most specific first
  private final String context;  // For debugging/logging

  private HierarchicalConfig(List<ResourceBundle> bundles, String context) {
    this.bundles = bundles;
    this.context = context;
  }

  /**
   * Get global configuration (dispatch.properties).
   *
   * @return Global configuration
   * @throws ConfigurationException if dispatch.properties is not on the classpath
   */
  public static HierarchicalConfig global() {
    return new HierarchicalConfig(List.of(loadGlobal()), "global");
  }

  /**
   * Get runtime-specific configuration.
   *
   * <p>Fallback chain:
   * <ol>
   *   <li>dispatch_{runtimeName}.properties (optional)</li>
   *   <li>dispatch.properties (global)</li>
   * </ol>
   *
   * @param runtimeName Runtime name (e.g., "app", "ingest")
   * @return Runtime-specific configuration
   */
  public static HierarchicalConfig forRuntime(String runtimeName) {
    Objects.requireNonNull(runtimeName, "runtimeName cannot be null");
    if (runtimeName.isBlank()) {
      throw new IllegalArgumentException("runtimeName cannot be blank");
    }

    List<ResourceBundle> chain = new ArrayList<>(2);
    try {
      chain.add(ResourceBundle.getBundle(
        BASE_NAME + "_" + runtimeName,
        Locale.ROOT,
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES)
      ));
    } catch (MissingResourceException e) {
      // No runtime override file, global defaults apply
    }
    chain.add(loadGlobal());
    return new HierarchicalConfig(List.copyOf(chain), "runtime:" + runtimeName);
  }

  private static ResourceBundle loadGlobal() {
    try {
      return ResourceBundle.getBundle(BASE_NAME, Locale.ROOT);
    } catch (MissingResourceException e) {
      throw new ConfigurationException("Missing " + BASE_NAME + ".properties on the classpath", e);
    }
  }

  // =========================================================================
  // Type-safe getters with system property override support
  // =========================================================================

  /**
   * Get string value.
   *
   * <p>Checks system properties first, then each bundle from most to least specific.
   *
   * @param key Property key
   * @return Property value
   * @throws ConfigurationException if key not found
   */
  public String getString(String key) {
    String value = lookup(key);
    if (value == null) {
      throw new ConfigurationException("Missing config key '" + key + "' in context: " + context);
    }
    return value;
  }

  /**
   * Get string value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value or default
   */
  public String getString(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Get int value.
   *
   * @param key Property key
   * @return Property value as int
   * @throws ConfigurationException if key not found or invalid format
   */
  public int getInt(String key) {
    String value = getString(key);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid int value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get int value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found or invalid
   * @return Property value as int or default
   */
  public int getInt(String key, int defaultValue) {
    try {
      String value = getString(key, null);
      if (value == null) {
        return defaultValue;
      }
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Get long value.
   *
   * @param key Property key
   * @return Property value as long
   * @throws ConfigurationException if key not found or invalid format
   */
  public long getLong(String key) {
    String value = getString(key);
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid long value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get long value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found or invalid
   * @return Property value as long or default
   */
  public long getLong(String key, long defaultValue) {
    try {
      String value = getString(key, null);
      if (value == null) {
        return defaultValue;
      }
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Get a millisecond value as a Duration.
   *
   * @param key Property key holding milliseconds
   * @return Property value as Duration
   * @throws ConfigurationException if key not found, invalid or negative
   */
  public Duration getDuration(String key) {
    long millis = getLong(key);
    if (millis < 0) {
      throw new ConfigurationException("Negative duration for key '" + key + "': " + millis);
    }
    return Duration.ofMillis(millis);
  }

  /**
   * Get boolean value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as boolean or default
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key, null);
    return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
  }

  /**
   * Check if key exists in configuration.
   *
   * @param key Property key
   * @return true if key exists
   */
  public boolean contains(String key) {
    return lookup(key) != null;
  }

  /**
   * Get all keys across this configuration's levels.
   *
   * @return Set of all keys
   */
  public Set<String> keys() {
    Set<String> keys = new TreeSet<>();
    bundles.forEach(bundle -> keys.addAll(bundle.keySet()));
    return keys;
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "global", "runtime:ingest")
   */
  public String context() {
    return context;
  }

  private String lookup(String key) {
    // System property override
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }
    for (ResourceBundle bundle : bundles) {
      if (bundle.containsKey(key)) {
        return bundle.getString(key);
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "HierarchicalConfig[context=" + context + "]";
  }
}
