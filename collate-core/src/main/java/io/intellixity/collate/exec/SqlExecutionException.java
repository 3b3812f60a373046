package io.intellixity.collate.exec;

/** A statement failed in the database; carries the statement text. */
public final class SqlExecutionException extends RuntimeException {
  private final String sql;

  public SqlExecutionException(String message, String sql) {
    super(message);
    this.sql = sql;
  }

  public SqlExecutionException(String message, String sql, Throwable cause) {
    super(message, cause);
    this.sql = sql;
  }

  public String sql() { return sql; }
}
