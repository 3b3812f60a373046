package io.intellixity.collate.aggregate;

/** Operators available to {@link AggregateExpression}. */
public enum BinaryOperator {
  ADD("+", "+", ""),
  SUB("-", "-", ""),
  MUL("*", "*", ""),
  // Force non-integer division.
  DIV("/", "/", "*1.0"),
  LT("<", "<", ""),
  LE("<=", "<=", ""),
  EQ("=", "=", ""),
  NE("!=", "!=", ""),
  GT(">", ">", ""),
  GE(">=", ">=", ""),
  OR("or", "|", ""),
  AND("and", "&", "");

  private final String sql;
  private final String display;
  private final String cast;

  BinaryOperator(String sql, String display, String cast) {
    this.sql = sql;
    this.display = display;
    this.cast = cast;
  }

  /** SQL operator text. */
  public String sql() { return sql; }

  /** Text used in generated column names. */
  public String display() { return display; }

  /** Suffix applied to the left operand. */
  public String cast() { return cast; }
}
