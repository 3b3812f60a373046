package io.intellixity.collate.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC data source plus the identity and schema an engine reports in its logs. */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public String id() { return id; }
  public DataSource client() { return client; }
  public String schema() { return schema; }
}
