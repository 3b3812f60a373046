package io.intellixity.collate.exec;

/** Backend-specific transaction state; also the session the work runs on. */
public interface TxHandle extends SqlSession {
}
