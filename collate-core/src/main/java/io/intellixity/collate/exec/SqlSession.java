package io.intellixity.collate.exec;

import io.intellixity.collate.sql.SqlStatement;

import java.util.Map;

/**
 * Statement execution on one connection, inside or outside a transaction.
 * <p>
 * Failures surface as {@link SqlExecutionException}; the session never retries.
 */
public interface SqlSession {
  /** Execute DDL/DML; returns the update count (0 for DDL). */
  long execute(SqlStatement statement);

  /** First column of the first row, or null when the query returns no rows. */
  Object queryOne(SqlStatement statement);

  /** First row keyed by column label (insertion-ordered), or an empty map when there are no rows. */
  Map<String, Object> queryRow(SqlStatement statement);
}
