package io.intellixity.collate.aggregate;

import io.intellixity.collate.config.ConfigurationException;
import io.intellixity.collate.imputation.ColumnType;
import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.imputation.ImputationRules;
import io.intellixity.collate.imputation.ImputationType;
import io.intellixity.collate.sql.Column;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class AggregateTest {

  private static List<String> labels(List<Column> cols) {
    return cols.stream().map(Column::label).toList();
  }

  private static List<String> exprs(List<Column> cols) {
    return cols.stream().map(Column::expression).toList();
  }

  @Test
  void sumAndAvgOverPrefix() {
    var cols = Aggregate.of("amount", "sum", "avg").columns(null, "txn_", FormatParams.NONE);
    assertEquals(List.of("txn_amount_sum", "txn_amount_avg"), labels(cols));
    assertEquals(List.of("sum(amount)", "avg(amount)"), exprs(cols));
    assertEquals("sum(amount) AS txn_amount_sum", cols.get(0).toSql());
  }

  @Test
  void crossProductHasOneUniqueColumnPerCombination() {
    Aggregate a = Aggregate.builder()
        .quantity("a").quantity("b").quantity("c")
        .functions(List.of("sum", "max"))
        .orders(List.of("o1", "o2"))
        .build();
    var cols = a.columns();
    assertEquals(2 * 3 * 2, cols.size());
    Set<String> unique = new HashSet<>(labels(cols));
    assertEquals(cols.size(), unique.size());
  }

  @Test
  void columnsCanBeReadTwice() {
    Aggregate a = Aggregate.of("amount", "sum");
    assertEquals(a.columns(), a.columns());
  }

  @Test
  void whenBecomesFilterClause() {
    var cols = Aggregate.of("amount", "sum").columns("amount > 0");
    assertEquals("sum(amount) FILTER (WHERE amount > 0)", cols.get(0).expression());
  }

  @Test
  void distinctQualifierIsPlacedInsideCall() {
    var cols = Aggregate.of("distinct user_id", "count").columns();
    assertEquals("count(distinct user_id)", cols.get(0).expression());
    assertEquals("distinct user_id_count", cols.get(0).label());
  }

  @Test
  void tupleQuantitiesRenderAsArguments() {
    var cols = Aggregate.builder().quantity(Quantity.of("x", "y")).function("corr").build().columns();
    assertEquals("corr(x, y)", cols.get(0).expression());
    assertEquals("x_y_corr", cols.get(0).label());
  }

  @Test
  void orderedSetAggregateUsesWithinGroup() {
    var cols = Aggregate.builder().quantity("pct", "0.5").function("percentile_cont").order("amount").build().columns();
    assertEquals("percentile_cont(0.5) WITHIN GROUP (ORDER BY amount)", cols.get(0).expression());
    assertEquals("pct_amount_percentile_cont", cols.get(0).label());
  }

  @Test
  void orderedSetWithoutQuantityNameHasNoLeadingUnderscore() {
    var cols = Aggregate.builder().quantity("", "0.5").function("percentile_cont").order("amount").build().columns();
    assertEquals("percentile_cont(0.5) WITHIN GROUP (ORDER BY amount)", cols.get(0).expression());
    assertEquals("amount_percentile_cont", cols.get(0).label());
  }

  @Test
  void namedQuantitiesKeepTheirNames() {
    Map<String, Object> q = new LinkedHashMap<>();
    q.put("paid", "amount - discount");
    q.put("slope", List.of("amount", "age"));
    var cols = Aggregate.builder().quantities(q).function("sum").build().columns();
    assertEquals(List.of("paid_sum", "slope_sum"), labels(cols));
    assertEquals(List.of("sum(amount - discount)", "sum(amount, age)"), exprs(cols));
  }

  @Test
  void quotesAreStrippedFromLabels() {
    var cols = Aggregate.of("\"Amount\"", "sum").columns();
    assertEquals("Amount_sum", cols.get(0).label());
    assertEquals("sum(\"Amount\")", cols.get(0).expression());
  }

  @Test
  void placeholdersAreFilledPerWindow() {
    Aggregate a = Aggregate.builder()
        .quantity("age", "'{collate_date}'::date - event_date")
        .function("max")
        .build();
    var cols = a.columns(null, "p_", FormatParams.of("2016-01-01", "1 year"));
    assertEquals("max('2016-01-01'::date - event_date)", cols.get(0).expression());
    assertEquals("p_age_max", cols.get(0).label());
  }

  @Test
  void unsetPlaceholderFailsAtRender() {
    Aggregate a = Aggregate.of("'{collate_date}'::date - d", "max");
    assertThrows(ConfigurationException.class, a::columns);
  }

  @Test
  void unknownPlaceholderIsRejectedAtConstruction() {
    var e = assertThrows(ConfigurationException.class, () -> Aggregate.of("{bogus} + 1", "sum"));
    assertTrue(e.getMessage().contains("{bogus}"));
  }

  @Test
  void doubledBracesRenderAsLiteralBraces() {
    var cols = Aggregate.of("(tags @> '{{red}}')::INT", "sum").columns();
    assertEquals("sum((tags @> '{red}')::INT)", cols.get(0).expression());
  }

  @Test
  void braceTextInsideQuotedLiteralIsKept() {
    Aggregate a = Aggregate.builder()
        .quantity("red_recent", "(tags @> '{red,blue}' AND d >= '{collate_date}'::date - 7)::INT")
        .function("sum")
        .build();
    var cols = a.columns(null, "", FormatParams.of("2016-01-01", "all"));
    assertEquals("sum((tags @> '{red,blue}' AND d >= '2016-01-01'::date - 7)::INT)", cols.get(0).expression());
  }

  @Test
  void escapedPlaceholderIsNotSubstituted() {
    var cols = Aggregate.of("'{{collate_date}}'", "max").columns(null, "", FormatParams.of("2016-01-01", "all"));
    assertEquals("max('{collate_date}')", cols.get(0).expression());
  }

  @Test
  void nameCountMustMatchQuantities() {
    assertThrows(ConfigurationException.class, () -> Aggregate.builder()
        .quantities(List.of("a", "b"))
        .names(List.of("only_one"))
        .function("sum")
        .build());
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThrows(ConfigurationException.class, () -> Aggregate.builder()
        .quantity("x", "a").quantity("x", "b").function("sum").build());
  }

  @Test
  void emptyFunctionsAreRejected() {
    assertThrows(ConfigurationException.class, () -> Aggregate.builder().quantity("a").build());
  }

  @Test
  void rulesFollowFunctionsWithErrorAsDefault() {
    Aggregate a = Aggregate.builder()
        .quantity("amount")
        .functions(List.of("sum", "max"))
        .imputation(ImputationRules.none(ColumnType.AGGREGATE)
            .forFunction("sum", ImputationRule.of(ImputationType.ZERO)))
        .build();
    Map<String, ImputationRule> rules = a.imputationRules("p_", FormatParams.NONE);
    assertEquals(List.of("p_amount_sum", "p_amount_max"), List.copyOf(rules.keySet()));
    assertEquals(ImputationType.ZERO, rules.get("p_amount_sum").type());
    assertEquals(ImputationType.ERROR, rules.get("p_amount_max").type());
  }

  @Test
  void allRuleAppliesToEveryFunction() {
    Aggregate a = Aggregate.builder()
        .quantity("amount")
        .functions(List.of("sum", "max"))
        .imputation(ImputationRules.all(ImputationType.MEAN))
        .build();
    for (ImputationRule r : a.imputationRules("", FormatParams.NONE).values()) {
      assertEquals(ImputationType.MEAN, r.type());
      assertFalse(r.nullIndicator());
    }
  }
}
