package io.intellixity.collate.imputation;

import io.intellixity.collate.sql.SqlNames;

import java.util.Objects;

/**
 * Renders the COALESCE fragment that fills one column according to its {@link ImputationRule}.\n
 *
 * The mean is taken within the output date partition; a date whose column is entirely null falls
 * back to 0 rather than passing nulls through.
 */
public final class ImputationSql {
  private ImputationSql() {}

  public static String render(String column, ImputationRule rule, String dateColumn) {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(dateColumn, "dateColumn");
    String col = SqlNames.quoteIdentIfNeeded(column);
    boolean cat = rule.coltype().categorical();

    String fill = switch (rule.type()) {
      case MEAN -> (cat && rule.nullIndicator()) ? "1" : meanOver(col, dateColumn);
      case CONSTANT -> {
        if (rule.value() == null) {
          throw new ImputationException("Constant imputation for column " + column + " has no value");
        }
        if (!cat) yield rule.value();
        yield (rule.nullIndicator() || rule.chosenCategory()) ? "1" : "0";
      }
      case ZERO -> (cat && rule.nullIndicator()) ? "1" : "0";
      case NULL_CATEGORY -> {
        if (!cat) {
          throw new ImputationException("Invalid imputation type " + rule.type().id() + " for column " + column);
        }
        yield rule.nullIndicator() ? "1" : "0";
      }
      case ERROR -> throw new ImputationException("NULL values found in column " + column);
    };
    return "COALESCE(" + col + ", " + fill + ") AS " + col;
  }

  /** {@code CASE WHEN col IS NULL THEN 1 ELSE 0 END AS col_imp}; only for non-categorical columns. */
  public static String imputedFlag(String column) {
    return "CASE WHEN " + SqlNames.quoteIdentIfNeeded(column) + " IS NULL THEN 1 ELSE 0 END AS "
        + SqlNames.quoteIdentIfNeeded(column + "_imp");
  }

  private static String meanOver(String col, String dateColumn) {
    return "AVG(" + col + ") OVER (PARTITION BY " + dateColumn + "), 0";
  }
}
