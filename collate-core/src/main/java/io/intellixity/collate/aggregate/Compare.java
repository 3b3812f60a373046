package io.intellixity.collate.aggregate;

import io.intellixity.collate.config.ConfigurationException;
import io.intellixity.collate.imputation.ColumnType;
import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.imputation.ImputationRules;
import io.intellixity.collate.imputation.ImputationType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Many 0/1 comparisons of one source column against a set of choices.
 * <p>
 * Each choice becomes a quantity {@code ({col} {op} {value})::INT} named {@code {col}_{op}_{choice}}
 * (or {@code {col}_{choice}} without the operator), so {@code sum} counts matches and {@code avg}
 * gives the matching fraction. Strings are quoted and numbers are not, unless overridden.
 * <p>
 * With a {@code maxlen}, names that would exceed it are all truncated and suffixed with a
 * zero-padded index; the ordering of truncated names does not follow the choice order.
 */
public class Compare extends Aggregate {
  public static final String DEFAULT_NULL_NAME = "NULL";

  private final String nullQuantityName;
  private final Map<String, Choice> choicesByName;

  protected Compare(Builder b) {
    this(b, b.prepare());
  }

  private Compare(Builder b, Prepared prepared) {
    super(prepared.quantities(), b.functions, b.orders, b.imputation());
    this.nullQuantityName = prepared.nullName();
    this.choicesByName = prepared.choicesByName();
  }

  public static Builder builder(String col, String op) {
    return new Builder(col, op);
  }

  /** Name of the {@code is NULL} indicator quantity, or null when none was requested. */
  public String nullQuantityName() { return nullQuantityName; }

  @Override
  protected ImputationRule ruleForQuantity(String quantityName, ImputationRule rule) {
    if (quantityName.equals(nullQuantityName)) return rule.asNullIndicator();
    Choice c = choicesByName.get(quantityName);
    if (rule.type() == ImputationType.CONSTANT && c != null && c.matches(rule.value())) return rule.asChosenCategory();
    return rule;
  }

  /** A choice: short name used in column names, plus the compared value. */
  public record Choice(String nickname, Object value) {
    /** A constant fill names its category by short name or by value. */
    boolean matches(String category) {
      if (category == null) return false;
      return category.equals(nickname) || (value != null && category.equals(String.valueOf(value)));
    }
  }

  record Prepared(Map<String, Quantity> quantities, String nullName, Map<String, Choice> choicesByName) {}

  public static class Builder {
    protected final String col;
    protected final String op;
    protected final List<Choice> choices = new ArrayList<>();
    protected final List<String> functions = new ArrayList<>();
    protected final List<String> orders = new ArrayList<>();
    protected String includeNull;
    protected Integer maxlen;
    protected boolean opInName = true;
    protected Boolean quoteChoices;
    protected ImputationRules imputation;
    private Prepared prepared;

    protected Builder(String col, String op) {
      this.col = Objects.requireNonNull(col, "col");
      this.op = Objects.requireNonNull(op, "op");
      if (col.isBlank()) throw new IllegalArgumentException("col is blank");
    }

    /** Each value is its own short name. */
    public Builder choices(Collection<?> values) {
      for (Object v : values) choices.add(new Choice(v == null ? null : String.valueOf(v), v));
      return this;
    }

    /** Short name → value. */
    public Builder choices(Map<String, ?> values) {
      for (var e : values.entrySet()) choices.add(new Choice(e.getKey(), e.getValue()));
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

    /** Add a {@code {col} is NULL} indicator named {@code {col}_NULL}. */
    public Builder includeNull() {
      return includeNull(DEFAULT_NULL_NAME);
    }

    /** Add a {@code {col} is NULL} indicator named {@code {col}_{name}}; null disables it. */
    public Builder includeNull(String name) {
      this.includeNull = name;
      return this;
    }

    public Builder maxlen(int maxlen) {
      this.maxlen = maxlen;
      return this;
    }

    public Builder opInName(boolean opInName) {
      this.opInName = opInName;
      return this;
    }

    public Builder quoteChoices(Boolean quoteChoices) {
      this.quoteChoices = quoteChoices;
      return this;
    }

    public Builder imputation(ImputationRules imputation) {
      this.imputation = imputation;
      return this;
    }

    protected ColumnType columnType() {
      return ColumnType.AGGREGATE;
    }

    ImputationRules imputation() {
      ImputationRules r = (imputation == null) ? ImputationRules.none(columnType()) : imputation;
      return r.withColtype(columnType());
    }

    public Compare build() {
      return new Compare(this);
    }

    /** Derive the quantity map once; subclasses may rewrite the choices first. */
    protected List<Choice> effectiveChoices() {
      return choices;
    }

    protected String effectiveIncludeNull() {
      return includeNull;
    }

    /** Right-hand side of one comparison. */
    protected String compared(Object value) {
      return QuantityExpressions.maybeQuote(value, quoteChoices);
    }

    final Prepared prepare() {
      if (prepared == null) prepared = comparisons(effectiveChoices(), effectiveIncludeNull());
      return prepared;
    }

    private Prepared comparisons(List<Choice> choices, String nullName) {
      String opname = opInName ? "_" + op + "_" : "_";
      List<String> names = new ArrayList<>();
      List<Quantity> quantities = new ArrayList<>();
      List<Choice> byIndex = new ArrayList<>();
      for (Choice c : choices) {
        if (c.value() == null) {
          throw new ConfigurationException("Null choice for column '" + col + "'; use includeNull() instead");
        }
        names.add(col + opname + c.nickname());
        quantities.add(Quantity.of("(" + col + " " + op + " " + FormatParams.escape(compared(c.value())) + ")::INT"));
        byIndex.add(c);
      }
      int nullIndex = -1;
      if (nullName != null) {
        nullIndex = names.size();
        names.add(col + "_" + nullName);
        quantities.add(Quantity.of("(" + col + " is NULL)::INT"));
      }

      if (maxlen != null && names.stream().anyMatch(n -> n.length() > maxlen)) {
        names = truncate(names, maxlen);
      }

      Map<String, Quantity> out = new LinkedHashMap<>();
      Map<String, Choice> chosen = new LinkedHashMap<>();
      for (int i = 0; i < names.size(); i++) {
        if (out.put(names.get(i), quantities.get(i)) != null) {
          throw new ConfigurationException("Duplicate comparison name '" + names.get(i) + "' for column '" + col + "'");
        }
        if (i < byIndex.size()) chosen.put(names.get(i), byIndex.get(i));
      }
      return new Prepared(out, nullIndex < 0 ? null : names.get(nullIndex), Collections.unmodifiableMap(chosen));
    }

    private static List<String> truncate(List<String> names, int maxlen) {
      int width = Math.max(2, String.valueOf(names.size() - 1).length());
      int keep = maxlen - width - 1;
      if (keep < 1) {
        throw new ConfigurationException("maxlen " + maxlen + " is too small to keep " + names.size()
            + " truncated names unique");
      }
      List<String> out = new ArrayList<>(names.size());
      for (int i = 0; i < names.size(); i++) {
        String n = names.get(i);
        String head = n.length() > keep ? n.substring(0, keep) : n;
        out.add(head + "_" + String.format("%0" + width + "d", i));
      }
      return out;
    }
  }
}
