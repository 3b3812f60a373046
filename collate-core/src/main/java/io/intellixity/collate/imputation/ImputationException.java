package io.intellixity.collate.imputation;

/**
 * Raised while building imputation SQL: unknown rule types, {@code error} rules on columns with nulls,
 * rules that do not apply to the column type, or an incomplete column classification.
 */
public final class ImputationException extends RuntimeException {
  public ImputationException(String message) {
    super(message);
  }

  public ImputationException(String message, Throwable cause) {
    super(message, cause);
  }
}
