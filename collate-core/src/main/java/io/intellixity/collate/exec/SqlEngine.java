package io.intellixity.collate.exec;

import java.util.function.Function;

/**
 * The executor collaborator: hands out sessions and owns transaction boundaries.
 * <p>
 * Implementations must be safe to call from several threads; each call gets its own session.
 */
public interface SqlEngine {
  /** Identifier for logs. */
  String id();

  /** Run {@code work} in a new transaction: commit on success, roll back and rethrow on failure. */
  <T> T inTx(Function<SqlSession, T> work);

  /** Run {@code work} on an auto-commit session (used for read-only checks). */
  <T> T withSession(Function<SqlSession, T> work);
}
