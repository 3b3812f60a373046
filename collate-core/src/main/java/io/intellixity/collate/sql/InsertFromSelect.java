package io.intellixity.collate.sql;

import java.util.Objects;

/** {@code INSERT INTO <name> (<select>)}. */
public record InsertFromSelect(String table, SqlRenderable query) implements SqlRenderable {
  public InsertFromSelect {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(query, "query");
  }

  @Override
  public String toSql() {
    return "INSERT INTO " + table + " (" + query.toSql() + ")";
  }
}
