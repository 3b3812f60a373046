package io.intellixity.collate.imputation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rules attached to one aggregate: a default for all of its functions plus per-function overrides.
 * <p>
 * Mirrors the {@code {"all": {...}, "max": {...}}} shape of feature definitions.
 */
public final class ImputationRules {
  public static final String ALL = "all";

  private final ColumnType coltype;
  private final ImputationRule all;
  private final Map<String, ImputationRule> byFunction;

  private ImputationRules(ColumnType coltype, ImputationRule all, Map<String, ImputationRule> byFunction) {
    this.coltype = Objects.requireNonNull(coltype, "coltype");
    this.all = all;
    this.byFunction = Map.copyOf(byFunction);
  }

  /** No rule configured: columns default to {@link ImputationType#ERROR}. */
  public static ImputationRules none(ColumnType coltype) {
    return new ImputationRules(coltype, null, Map.of());
  }

  public static ImputationRules all(ImputationRule rule) {
    return new ImputationRules(ColumnType.AGGREGATE, rule, Map.of());
  }

  public static ImputationRules all(ImputationType type) {
    return all(ImputationRule.of(type));
  }

  public ImputationRules forFunction(String function, ImputationRule rule) {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(rule, "rule");
    if (ALL.equals(function)) return new ImputationRules(coltype, rule, byFunction);
    Map<String, ImputationRule> m = new LinkedHashMap<>(byFunction);
    m.put(function, rule);
    return new ImputationRules(coltype, all, m);
  }

  public ImputationRules withColtype(ColumnType t) {
    return new ImputationRules(t, all, byFunction);
  }

  public ColumnType coltype() { return coltype; }

  /** Resolve the rule for a function; the column type always comes from this rule set. */
  public ImputationRule ruleFor(String function) {
    ImputationRule r = byFunction.get(function);
    if (r == null) r = all;
    if (r == null) r = ImputationRule.of(ImputationType.ERROR);
    return r.withColtype(coltype);
  }
}
