package io.intellixity.collate.aggregate;

import io.intellixity.collate.config.ConfigurationException;
import io.intellixity.collate.imputation.ColumnType;
import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.imputation.ImputationRules;
import io.intellixity.collate.sql.Column;
import io.intellixity.collate.sql.SqlNames;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One or more SQL aggregate columns in a group by.\n
 *
 * The output is the cross product {functions} x {(name, quantity)} x {orders}; each combination
 * yields exactly one column labelled {@code {prefix}{quantity_name}[_{order}]_{function}}.
 * <p>
 * Quantities may reference {@code {collate_date}} and {@code {collate_interval}}, which are filled
 * in per as-of date and window by {@link io.intellixity.collate.aggregation.SpacetimeAggregation}.
 */
public class Aggregate implements ColumnSource {
  private final Map<String, Quantity> quantities;
  private final List<String> functions;
  private final List<String> orders;
  private final ImputationRules imputation;

  public Aggregate(Map<String, Quantity> quantities, List<String> functions, List<String> orders,
                   ImputationRules imputation) {
    Objects.requireNonNull(quantities, "quantities");
    Objects.requireNonNull(functions, "functions");
    if (quantities.isEmpty()) throw new ConfigurationException("Aggregate has no quantities");
    if (functions.isEmpty()) throw new ConfigurationException("Aggregate has no functions");

    Map<String, Quantity> q = new LinkedHashMap<>();
    for (var e : quantities.entrySet()) {
      if (e.getKey() == null) throw new ConfigurationException("Quantity name is null for " + e.getValue());
      Quantity quantity = Objects.requireNonNull(e.getValue(), "quantity");
      for (String arg : quantity.args()) {
        FormatParams.checkPlaceholders(arg, FormatParams.QUANTITY_PLACEHOLDERS, "quantity '" + e.getKey() + "'");
      }
      q.put(e.getKey(), quantity);
    }
    for (String f : functions) {
      if (f == null || f.isBlank()) throw new ConfigurationException("Aggregate function is blank");
    }
    List<String> o = (orders == null || orders.isEmpty()) ? Collections.singletonList(null) : new ArrayList<>(orders);
    for (String order : o) {
      FormatParams.checkPlaceholders(order, FormatParams.QUANTITY_PLACEHOLDERS, "order");
    }

    this.quantities = Collections.unmodifiableMap(q);
    this.functions = List.copyOf(functions);
    this.orders = Collections.unmodifiableList(o);
    this.imputation = (imputation == null) ? ImputationRules.none(ColumnType.AGGREGATE) : imputation;
  }

  /** {@code Aggregate.of("amount", "sum", "avg")}. */
  public static Aggregate of(String quantity, String... functions) {
    return builder().quantity(quantity).functions(List.of(functions)).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, Quantity> quantities() { return quantities; }
  public List<String> functions() { return functions; }
  /** Orders; a single {@code null} element means no ordering clause. */
  public List<String> orders() { return orders; }
  public ImputationRules imputation() { return imputation; }

  @Override
  public List<Column> columns(String when, String prefix, FormatParams params) {
    String p = (prefix == null) ? "" : prefix;
    FormatParams fp = (params == null) ? FormatParams.NONE : params;
    String filter = (when == null || when.isBlank()) ? "" : " FILTER (WHERE " + when + ")";

    List<Column> out = new ArrayList<>(functions.size() * quantities.size() * orders.size());
    for (String function : functions) {
      for (var e : quantities.entrySet()) {
        for (String order : orders) {
          var split = QuantityExpressions.splitDistinct(e.getValue());
          String args = String.join(", ", split.quantity().args());
          String orderClause = (order == null) ? "" : " WITHIN GROUP (ORDER BY " + order + ")";
          String expr = fp.apply(function + "(" + split.distinct() + args + ")" + orderClause + filter);
          out.add(new Column(expr, columnName(p, e.getKey(), order, function)));
        }
      }
    }
    return out;
  }

  @Override
  public Map<String, ImputationRule> imputationRules(String prefix, FormatParams params) {
    String p = (prefix == null) ? "" : prefix;
    Map<String, ImputationRule> out = new LinkedHashMap<>();
    for (String function : functions) {
      ImputationRule rule = imputation.ruleFor(function);
      for (String quantityName : quantities.keySet()) {
        ImputationRule r = ruleForQuantity(quantityName, rule);
        for (String order : orders) {
          out.put(columnName(p, quantityName, order, function), r);
        }
      }
    }
    return out;
  }

  /** Subclasses flag quantities that count null source values or one particular category. */
  protected ImputationRule ruleForQuantity(String quantityName, ImputationRule rule) {
    return rule;
  }

  private static String columnName(String prefix, String quantityName, String order, String function) {
    String name = quantityName;
    if (order != null) {
      if (!name.isEmpty()) name += "_";
      name += SqlNames.toSqlName(order);
    }
    return SqlNames.toSqlName(prefix + name + "_" + function);
  }

  /** Collects quantities (named or not), functions and orders. */
  public static final class Builder {
    private final List<String> names = new ArrayList<>();
    private final List<Quantity> quantities = new ArrayList<>();
    private List<String> explicitNames;
    private final List<String> functions = new ArrayList<>();
    private final List<String> orders = new ArrayList<>();
    private ImputationRules imputation;

    private Builder() {}

    public Builder quantity(String expression) {
      return quantity(Quantity.of(expression));
    }

    public Builder quantity(Quantity quantity) {
      names.add(null);
      quantities.add(Objects.requireNonNull(quantity, "quantity"));
      return this;
    }

    public Builder quantity(String name, String expression) {
      return quantity(name, Quantity.of(expression));
    }

    public Builder quantity(String name, Quantity quantity) {
      names.add(Objects.requireNonNull(name, "name"));
      quantities.add(Objects.requireNonNull(quantity, "quantity"));
      return this;
    }

    /** Strings, {@link Quantity} values or string collections (tuples). */
    public Builder quantities(Collection<?> quantities) {
      for (Object q : quantities) quantity(QuantityExpressions.asQuantity(q));
      return this;
    }

    /** Name → string, {@link Quantity} or string collection (tuple). */
    public Builder quantities(Map<String, ?> quantities) {
      for (var e : quantities.entrySet()) quantity(e.getKey(), QuantityExpressions.asQuantity(e.getValue()));
      return this;
    }

    /** Explicit names, one per quantity in order. */
    public Builder names(List<String> names) {
      this.explicitNames = List.copyOf(names);
      return this;
    }

    public Builder function(String function) {
      functions.add(function);
      return this;
    }

    public Builder functions(Collection<String> functions) {
      this.functions.addAll(functions);
      return this;
    }

    public Builder order(String order) {
      orders.add(order);
      return this;
    }

    public Builder orders(Collection<String> orders) {
      this.orders.addAll(orders);
      return this;
    }

    public Builder imputation(ImputationRules imputation) {
      this.imputation = imputation;
      return this;
    }

    public Aggregate build() {
      return new Aggregate(named(), functions, orders, imputation);
    }

    Map<String, Quantity> named() {
      List<String> resolved = new ArrayList<>(quantities.size());
      for (int i = 0; i < quantities.size(); i++) {
        String n = names.get(i);
        resolved.add(n != null ? n : SqlNames.toSqlName(quantities.get(i).defaultName()));
      }
      if (explicitNames != null) {
        if (explicitNames.size() != quantities.size()) {
          throw new ConfigurationException("Got " + explicitNames.size() + " names for " + quantities.size()
              + " quantities: " + explicitNames);
        }
        resolved = explicitNames;
      }
      Set<String> seen = new LinkedHashSet<>();
      Map<String, Quantity> out = new LinkedHashMap<>();
      for (int i = 0; i < quantities.size(); i++) {
        String n = resolved.get(i);
        if (!seen.add(n)) throw new ConfigurationException("Duplicate quantity name '" + n + "'");
        out.put(n, quantities.get(i));
      }
      return out;
    }
  }
}
