package io.intellixity.collate.imputation;

import java.util.Locale;

public enum ImputationType {
  /** Within-date average, falling back to 0 when the whole date is null. */
  MEAN("mean"),
  /** Configured constant (or the chosen category for categoricals). */
  CONSTANT("constant"),
  ZERO("zero"),
  /** Categoricals only: rely on the null-indicator column. */
  NULL_CATEGORY("null_category"),
  /** Fail if any null is found. */
  ERROR("error");

  private final String id;

  ImputationType(String id) {
    this.id = id;
  }

  public String id() { return id; }

  public static ImputationType fromId(String id) {
    if (id == null || id.isBlank()) throw new ImputationException("Imputation type is blank");
    String k = id.trim().toLowerCase(Locale.ROOT);
    for (ImputationType t : values()) {
      if (t.id.equals(k)) return t;
    }
    throw new ImputationException("Invalid imputation type " + id);
  }
}
