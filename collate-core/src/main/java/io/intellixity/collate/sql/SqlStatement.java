package io.intellixity.collate.sql;

import java.util.Objects;

/** An executable statement handed to the executor collaborator. */
public record SqlStatement(String sql, Kind kind) implements SqlRenderable {
  public enum Kind {
    /** DDL/DML executed for its side effect. */
    UPDATE,
    /** Read query; the executor returns a scalar or a row. */
    QUERY
  }

  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    if (sql.isBlank()) throw new IllegalArgumentException("sql is blank");
    kind = (kind == null) ? Kind.UPDATE : kind;
  }

  public static SqlStatement update(String sql) {
    return new SqlStatement(sql, Kind.UPDATE);
  }

  public static SqlStatement query(String sql) {
    return new SqlStatement(sql, Kind.QUERY);
  }

  public static SqlStatement update(SqlRenderable r) {
    return new SqlStatement(r.toSql(), Kind.UPDATE);
  }

  @Override
  public String toSql() { return sql; }

  @Override
  public String toString() { return sql; }
}
