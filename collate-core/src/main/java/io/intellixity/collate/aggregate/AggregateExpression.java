package io.intellixity.collate.aggregate;

import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.imputation.ImputationType;
import io.intellixity.collate.sql.Column;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Binary combination of two column sources, e.g. a ratio of two sums.\n
 *
 * Produces one column per pair in the cross product of both operands' columns:
 * {@code ({c1}{cast} {op} {c2})}, named through {@link #alias(String)} (default
 * {@code {name1}{operator}{name2}}).
 */
public final class AggregateExpression implements ColumnSource {
  public static final String DEFAULT_TEMPLATE = "{name1}{operator}{name2}";
  public static final Set<String> TEMPLATE_PLACEHOLDERS =
      Set.of("name1", "operator", "name2", FormatParams.COLLATE_DATE, FormatParams.COLLATE_INTERVAL);

  private final ColumnSource left;
  private final ColumnSource right;
  private final BinaryOperator operator;
  private final String cast;
  private String template = DEFAULT_TEMPLATE;
  private ImputationRule imputation = ImputationRule.of(ImputationType.ERROR);

  public AggregateExpression(ColumnSource left, ColumnSource right, BinaryOperator operator) {
    this(left, right, operator, null);
  }

  /** @param cast optional suffix for the left operand (e.g. {@code ::decimal}); defaults to the operator's */
  public AggregateExpression(ColumnSource left, ColumnSource right, BinaryOperator operator, String cast) {
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.cast = (cast == null) ? operator.cast() : cast;
  }

  /** Set the naming template. Returns {@code this} for chaining. */
  public AggregateExpression alias(String template) {
    Objects.requireNonNull(template, "template");
    FormatParams.checkPlaceholders(template, TEMPLATE_PLACEHOLDERS, "expression template");
    this.template = template;
    return this;
  }

  /** Imputation for the derived columns. Returns {@code this} for chaining. */
  public AggregateExpression imputation(ImputationRule rule) {
    this.imputation = Objects.requireNonNull(rule, "rule");
    return this;
  }

  public BinaryOperator operator() { return operator; }
  public String template() { return template; }

  @Override
  public List<Column> columns(String when, String prefix, FormatParams params) {
    String p = (prefix == null) ? "" : prefix;
    FormatParams fp = (params == null) ? FormatParams.NONE : params;
    List<Column> columns1 = left.columns(when, "", fp);
    List<Column> columns2 = right.columns(when, "", fp);

    List<Column> out = new ArrayList<>(columns1.size() * columns2.size());
    for (Column c1 : columns1) {
      for (Column c2 : columns2) {
        String expr = "(" + c1.expression() + cast + " " + operator.sql() + " " + c2.expression() + ")";
        out.add(new Column(expr, p + name(c1.name(), c2.name(), fp)));
      }
    }
    return out;
  }

  @Override
  public Map<String, ImputationRule> imputationRules(String prefix, FormatParams params) {
    Map<String, ImputationRule> out = new LinkedHashMap<>();
    for (Column c : columns(null, prefix, params)) out.put(c.label(), imputation);
    return out;
  }

  private String name(String name1, String name2, FormatParams params) {
    Map<String, String> names = new LinkedHashMap<>();
    names.put("name1", name1);
    names.put("operator", operator.display());
    names.put("name2", name2);
    return params.format(template, names);
  }
}
