package io.intellixity.collate.exec;

import java.util.Objects;
import java.util.function.Function;

/**
 * Template-method base for engines.\n
 *
 * Subclasses implement begin/commit/rollback and the auto-commit session; this class owns the
 * commit-or-rollback discipline so no failure leaves a transaction half-applied.
 */
public abstract class AbstractSqlEngine implements SqlEngine {
  private final String id;

  protected AbstractSqlEngine(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  @Override
  public final String id() { return id; }

  /** Backend-specific transaction begin. */
  protected abstract TxHandle begin();

  /** Backend-specific commit (paired with {@link #begin()}); also releases the handle. */
  protected abstract void commit(TxHandle tx);

  /** Backend-specific rollback (paired with {@link #begin()}); also releases the handle. */
  protected abstract void rollback(TxHandle tx);

  /** Open an auto-commit session; closed through {@link #release(SqlSession)}. */
  protected abstract SqlSession open();

  protected abstract void release(SqlSession session);

  @Override
  public final <T> T inTx(Function<SqlSession, T> work) {
    Objects.requireNonNull(work, "work");
    TxHandle tx = begin();
    T result;
    try {
      result = work.apply(tx);
    } catch (RuntimeException | Error e) {
      try {
        rollback(tx);
      } catch (RuntimeException re) {
        e.addSuppressed(re);
      }
      throw e;
    }
    commit(tx);
    return result;
  }

  @Override
  public final <T> T withSession(Function<SqlSession, T> work) {
    Objects.requireNonNull(work, "work");
    SqlSession s = open();
    try {
      return work.apply(s);
    } finally {
      release(s);
    }
  }
}
