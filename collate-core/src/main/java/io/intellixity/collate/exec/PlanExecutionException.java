package io.intellixity.collate.exec;

/** A plan run was aborted; the cause is the first failure observed. */
public final class PlanExecutionException extends RuntimeException {
  public PlanExecutionException(String message) {
    super(message);
  }

  public PlanExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
