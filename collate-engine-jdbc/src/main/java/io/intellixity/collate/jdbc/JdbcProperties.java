package io.intellixity.collate.jdbc;

import io.intellixity.collate.config.ConfigurationException;
import io.intellixity.collate.config.SpacetimeRun;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings read from a Java Properties file:\n
 *
 * <pre>
 * collate.jdbc.url=jdbc:postgresql://localhost:5432/features
 * collate.jdbc.username=collate
 * collate.jdbc.password=secret
 * collate.jdbc.schema=features
 * collate.jdbc.maxPoolSize=8
 * collate.jdbc.parallelism=4
 * </pre>
 *
 * Only {@code url} is required. {@code schema} is where generated tables go when the run does
 * not name one (see {@link #applyTo(SpacetimeRun)}); engines also report it in their logs.
 */
public record JdbcProperties(String url, String username, String password, String schema,
                             int maxPoolSize, int parallelism) {
  public static final String PREFIX = "collate.jdbc.";
  public static final int DEFAULT_MAX_POOL_SIZE = 10;
  public static final int DEFAULT_PARALLELISM = 4;

  public JdbcProperties {
    if (url == null || url.isBlank()) throw new ConfigurationException("Missing " + PREFIX + "url");
    if (maxPoolSize <= 0) throw new ConfigurationException(PREFIX + "maxPoolSize must be > 0");
    if (parallelism <= 0) throw new ConfigurationException(PREFIX + "parallelism must be > 0");
    schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  /** The run with this schema filled in, unless the run already names its own. */
  public SpacetimeRun applyTo(SpacetimeRun run) {
    Objects.requireNonNull(run, "run");
    if (schema == null || run.schema() != null) return run;
    return run.withSchema(schema);
  }

  public static JdbcProperties from(Properties p) {
    Objects.requireNonNull(p, "p");
    return new JdbcProperties(
        trimmed(p, "url"),
        trimmed(p, "username"),
        p.getProperty(PREFIX + "password"),
        trimmed(p, "schema"),
        intValue(p, "maxPoolSize", DEFAULT_MAX_POOL_SIZE),
        intValue(p, "parallelism", DEFAULT_PARALLELISM));
  }

  public static JdbcProperties load(InputStream in) {
    Objects.requireNonNull(in, "in");
    Properties p = new Properties();
    try {
      p.load(in);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to load JDBC properties", e);
    }
    return from(p);
  }

  public static JdbcProperties fromPath(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to load JDBC properties from " + path, e);
    }
  }

  public static JdbcProperties fromResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = JdbcProperties.class.getClassLoader();
    InputStream in = cl.getResourceAsStream(resource);
    if (in == null) throw new ConfigurationException("JDBC properties not found on classpath: " + resource);
    try (in) {
      return load(in);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to close " + resource, e);
    }
  }

  private static String trimmed(Properties p, String key) {
    String v = p.getProperty(PREFIX + key);
    return v == null ? null : v.trim();
  }

  private static int intValue(Properties p, String key, int def) {
    String v = trimmed(p, key);
    if (v == null || v.isEmpty()) return def;
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid " + PREFIX + key + ": " + v, e);
    }
  }

  @Override
  public String toString() {
    return "JdbcProperties[url=" + url + ", username=" + username + ", schema=" + schema
        + ", maxPoolSize=" + maxPoolSize + ", parallelism=" + parallelism + "]";
  }
}
