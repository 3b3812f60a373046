package io.intellixity.collate.sql;

import java.util.Objects;

/**
 * A select-list item: raw SQL expression plus an optional label.\n
 *
 * Labels are the generated feature names; the expression text is opaque to this class.
 */
public record Column(String expression, String label) implements SqlRenderable {
  public Column {
    Objects.requireNonNull(expression, "expression");
  }

  /** Wrap a raw expression without a label. */
  public static Column raw(String expression) {
    return new Column(expression, null);
  }

  /** Name used when referencing this column from an outer query. */
  public String name() {
    return label != null ? label : expression;
  }

  public Column label(String newLabel) {
    return new Column(expression, newLabel);
  }

  @Override
  public String toSql() {
    if (label == null) return expression;
    return expression + " AS " + SqlNames.quoteIdentIfNeeded(label);
  }
}
