package io.intellixity.collate.aggregate;

import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.sql.Column;

import java.util.List;
import java.util.Map;

/**
 * Anything that expands into named aggregate columns: a leaf {@link Aggregate} or an
 * {@link AggregateExpression} tree built from them.\n
 *
 * Implementations return a fresh list on every call, so the sequence can be re-read.
 */
public interface ColumnSource {

  /**
   * @param when   optional row predicate applied through {@code FILTER (WHERE ...)}
   * @param prefix prepended to every column label
   * @param params values for {@code {collate_date}}/{@code {collate_interval}} placeholders
   */
  List<Column> columns(String when, String prefix, FormatParams params);

  /** Imputation rule for every column label this source produces under {@code prefix}. */
  Map<String, ImputationRule> imputationRules(String prefix, FormatParams params);

  default List<Column> columns(String when) {
    return columns(when, "", FormatParams.NONE);
  }

  default List<Column> columns() {
    return columns(null);
  }

  default AggregateExpression plus(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.ADD); }
  default AggregateExpression minus(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.SUB); }
  default AggregateExpression times(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.MUL); }
  default AggregateExpression dividedBy(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.DIV); }
  default AggregateExpression lt(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.LT); }
  default AggregateExpression le(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.LE); }
  default AggregateExpression eq(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.EQ); }
  default AggregateExpression ne(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.NE); }
  default AggregateExpression gt(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.GT); }
  default AggregateExpression ge(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.GE); }
  default AggregateExpression or(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.OR); }
  default AggregateExpression and(ColumnSource other) { return new AggregateExpression(this, other, BinaryOperator.AND); }
}
