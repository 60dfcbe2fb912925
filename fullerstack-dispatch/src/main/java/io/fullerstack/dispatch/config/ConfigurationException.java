package io.fullerstack.dispatch.config;

/**
 * Raised when a configuration key is missing or its value cannot be parsed.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
