package io.intellixity.collate.config;

/**
 * Raised when a declarative aggregate/aggregation definition is inconsistent.
 * <p>
 * Thrown at construction time, before any SQL is generated.
 */
public final class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
