package io.intellixity.collate.imputation;

import java.util.Objects;

/**
 * Fill policy for one output column.
 *
 * @param type           how nulls are filled
 * @param coltype        categorical columns are handled through their null-indicator sibling
 * @param value          constant value ({@link ImputationType#CONSTANT}) or chosen category
 * @param nullIndicator  true when the column itself is a categorical's null-indicator
 * @param chosenCategory true when the column counts the category named by {@code value}
 */
public record ImputationRule(ImputationType type, ColumnType coltype, String value, boolean nullIndicator,
                             boolean chosenCategory) {
  public ImputationRule {
    Objects.requireNonNull(type, "type");
    coltype = (coltype == null) ? ColumnType.AGGREGATE : coltype;
  }

  public ImputationRule(ImputationType type, ColumnType coltype, String value, boolean nullIndicator) {
    this(type, coltype, value, nullIndicator, false);
  }

  public static ImputationRule of(ImputationType type) {
    return new ImputationRule(type, ColumnType.AGGREGATE, null, false);
  }

  public static ImputationRule constant(Object value) {
    return new ImputationRule(ImputationType.CONSTANT, ColumnType.AGGREGATE,
        value == null ? null : String.valueOf(value), false);
  }

  public ImputationRule withColtype(ColumnType t) {
    return new ImputationRule(type, t, value, nullIndicator, chosenCategory);
  }

  public ImputationRule asNullIndicator() {
    return new ImputationRule(type, coltype, value, true, chosenCategory);
  }

  public ImputationRule asChosenCategory() {
    return new ImputationRule(type, coltype, value, nullIndicator, true);
  }
}
