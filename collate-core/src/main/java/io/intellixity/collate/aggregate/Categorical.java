package io.intellixity.collate.aggregate;

import io.intellixity.collate.imputation.ColumnType;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link Compare} fixed to equality, without the operator in generated names.
 * <p>
 * A {@code null} among the choices requests the null indicator: as a plain value it is named
 * {@code {col}_NULL}; as a map value its key names it. The caller's choices are left untouched.
 * <p>
 * {@link #arrayBuilder(String)} targets array columns: a choice matches when the array contains it,
 * {@code ({col} @> ARRAY[{value}])::INT}.
 */
public class Categorical extends Compare {

  protected Categorical(Compare.Builder b) {
    super(b);
  }

  public static Compare.Builder builder(String col) {
    return new Builder(col, "=", ColumnType.CATEGORICAL);
  }

  public static Compare.Builder arrayBuilder(String col) {
    return new Builder(col, "@>", ColumnType.ARRAY_CATEGORICAL);
  }

  private static final class Builder extends Compare.Builder {
    private final ColumnType columnType;

    Builder(String col, String op, ColumnType columnType) {
      super(col, op);
      this.opInName = false;
      this.columnType = columnType;
    }

    @Override
    protected ColumnType columnType() {
      return columnType;
    }

    @Override
    protected String compared(Object value) {
      String v = super.compared(value);
      return columnType == ColumnType.ARRAY_CATEGORICAL ? "ARRAY[" + v + "]" : v;
    }

    @Override
    protected List<Choice> effectiveChoices() {
      List<Choice> out = new ArrayList<>(choices.size());
      for (Choice c : choices) {
        if (c.value() != null) out.add(c);
      }
      return out;
    }

    @Override
    protected String effectiveIncludeNull() {
      String nullName = includeNull;
      for (Choice c : choices) {
        if (c.value() != null) continue;
        nullName = (c.nickname() == null) ? DEFAULT_NULL_NAME : c.nickname();
      }
      return nullName;
    }

    @Override
    public Compare build() {
      return new Categorical(this);
    }
  }
}
