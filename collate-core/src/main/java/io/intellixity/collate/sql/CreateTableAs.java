package io.intellixity.collate.sql;

import java.util.Objects;

/** {@code CREATE TABLE <name> AS <select>}. */
public record CreateTableAs(String table, SqlRenderable query) implements SqlRenderable {
  public CreateTableAs {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(query, "query");
  }

  @Override
  public String toSql() {
    return "CREATE TABLE " + table + " AS " + query.toSql();
  }
}
