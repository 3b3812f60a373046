package io.intellixity.collate.imputation;

/** Kind of output column an imputation rule applies to. */
public enum ColumnType {
  AGGREGATE,
  CATEGORICAL,
  ARRAY_CATEGORICAL;

  /** Categorical columns carry a dedicated null-indicator column instead of an {@code _imp} flag. */
  public boolean categorical() {
    return this == CATEGORICAL || this == ARRAY_CATEGORICAL;
  }
}
