package io.intellixity.collate.aggregation;

import io.intellixity.collate.aggregate.Aggregate;
import io.intellixity.collate.aggregate.Categorical;
import io.intellixity.collate.config.ConfigurationException;
import io.intellixity.collate.exec.RecordingSqlEngine;
import io.intellixity.collate.imputation.ImputationException;
import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.imputation.ImputationRules;
import io.intellixity.collate.imputation.ImputationSplit;
import io.intellixity.collate.imputation.ImputationType;
import io.intellixity.collate.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SpacetimeImputationTest {

  private static final String SUM = "ev_entity_id_all_amount_sum";
  private static final String OPEN = "ev_entity_id_all_status_open_sum";
  private static final String NUL = "ev_entity_id_all_status_NULL_sum";

  private static SpacetimeAggregation aggregation(ImputationRules amountRules) {
    return SpacetimeAggregation.builder()
        .aggregate(Aggregate.builder().quantity("amount").function("sum").imputation(amountRules).build())
        .aggregate(Categorical.builder("status").choices(Arrays.asList("open", null)).function("sum")
            .imputation(ImputationRules.all(ImputationType.NULL_CATEGORY)).build())
        .group("entity_id")
        .intervals(List.of("all"))
        .date("2016-01-01")
        .fromObj("events")
        .prefix("ev")
        .stateTable("states")
        .build();
  }

  @Test
  void rulesCoverEveryOutputColumn() {
    var rules = aggregation(ImputationRules.all(ImputationType.MEAN)).getImputationRules();
    assertEquals(List.of(SUM, OPEN, NUL), List.copyOf(rules.keySet()));
    assertEquals(ImputationType.MEAN, rules.get(SUM).type());
    assertTrue(rules.get(NUL).nullIndicator());
  }

  @Test
  void findNullsCountsAgainstStateTable() {
    SqlStatement q = aggregation(ImputationRules.all(ImputationType.MEAN)).findNulls();
    assertEquals(SqlStatement.Kind.QUERY, q.kind());
    assertEquals("SELECT SUM(CASE WHEN " + SUM + " IS NULL THEN 1 ELSE 0 END) AS " + SUM + ",\n"
            + "SUM(CASE WHEN " + OPEN + " IS NULL THEN 1 ELSE 0 END) AS " + OPEN + ",\n"
            + "SUM(CASE WHEN \"" + NUL + "\" IS NULL THEN 1 ELSE 0 END) AS \"" + NUL + "\""
            + "\nFROM states t1\nLEFT JOIN \"ev_aggregation\" t2 USING(entity_id, date)",
        q.sql());
  }

  @Test
  void imputeCreateRewritesOnlyNullBearingColumns() {
    SpacetimeAggregation st = aggregation(ImputationRules.all(ImputationType.MEAN));
    String sql = st.getImputeCreate(List.of(SUM, NUL), List.of(OPEN)).sql();
    assertEquals("CREATE TABLE \"ev_aggregation_imputed\" AS (SELECT entity_id, date"
            + "\n," + OPEN
            + "\n,COALESCE(" + SUM + ", AVG(" + SUM + ") OVER (PARTITION BY date), 0) AS " + SUM
            + "\n,CASE WHEN " + SUM + " IS NULL THEN 1 ELSE 0 END AS " + SUM + "_imp"
            + "\n,COALESCE(\"" + NUL + "\", 1) AS \"" + NUL + "\""
            + "\nFROM states t1"
            + "\nLEFT JOIN \"ev_aggregation\" t2 USING(entity_id, date))",
        sql);
  }

  @Test
  void constantCategoryFillsOnlyTheChosenColumn() {
    SpacetimeAggregation st = SpacetimeAggregation.builder()
        .aggregate(Categorical.builder("code").choices(List.of(1, 2, 12)).function("sum")
            .imputation(ImputationRules.all(ImputationRule.constant("1"))).build())
        .group("entity_id")
        .intervals(List.of("1 year"))
        .date("2016-01-01")
        .fromObj("events")
        .prefix("ev")
        .stateTable("states")
        .build();
    String one = "\"ev_entity_id_1 year_code_1_sum\"";
    String two = "\"ev_entity_id_1 year_code_2_sum\"";
    String twelve = "\"ev_entity_id_1 year_code_12_sum\"";
    var rules = st.getImputationRules();
    assertTrue(rules.get("ev_entity_id_1 year_code_1_sum").chosenCategory());
    assertFalse(rules.get("ev_entity_id_1 year_code_12_sum").chosenCategory());

    String sql = st.getImputeCreate(List.copyOf(rules.keySet()), List.of()).sql();
    assertTrue(sql.contains("COALESCE(" + one + ", 1) AS " + one));
    assertTrue(sql.contains("COALESCE(" + two + ", 0) AS " + two));
    assertTrue(sql.contains("COALESCE(" + twelve + ", 0) AS " + twelve));
  }

  @Test
  void labelsBeyondIdentifierLimitAreRejected() {
    SpacetimeAggregation st = SpacetimeAggregation.builder()
        .aggregate(Aggregate.builder().quantity("amount").function("sum")
            .imputation(ImputationRules.all(ImputationType.ZERO)).build())
        .group("entity_id")
        .intervals(List.of("all"))
        .date("2016-01-01")
        .fromObj("events")
        .prefix("events_with_a_rather_long_prefix_for_features")
        .stateTable("states")
        .build();
    String label = "events_with_a_rather_long_prefix_for_features_entity_id_all_amount_sum";
    assertEquals(List.of(label), List.copyOf(st.getImputationRules().keySet()));

    var e = assertThrows(ConfigurationException.class, st::findNulls);
    assertTrue(e.getMessage().contains(label));
    assertThrows(ConfigurationException.class, () -> st.getImputeCreate(List.of(), List.of(label)));
    var missing = assertThrows(ImputationException.class, () -> st.classifyNulls(Map.of()));
    assertTrue(missing.getMessage().contains("truncated"));
  }

  @Test
  void everyColumnMustBeClassifiedExactlyOnce() {
    SpacetimeAggregation st = aggregation(ImputationRules.all(ImputationType.MEAN));
    assertThrows(ImputationException.class, () -> st.getImputeCreate(List.of(SUM), List.of(OPEN)));
    assertThrows(ImputationException.class, () -> st.getImputeCreate(List.of(SUM, OPEN), List.of(OPEN, NUL)));
    assertThrows(ImputationException.class, () -> st.getImputeCreate(List.of(SUM, "other"), List.of(OPEN, NUL)));
  }

  @Test
  void errorRuleFailsOnlyWhenColumnHasNulls() {
    SpacetimeAggregation st = aggregation(null);
    assertDoesNotThrow(() -> st.getImputeCreate(List.of(), List.of(SUM, OPEN, NUL)));
    var e = assertThrows(ImputationException.class, () -> st.getImputeCreate(List.of(SUM), List.of(OPEN, NUL)));
    assertEquals("NULL values found in column " + SUM, e.getMessage());
  }

  @Test
  void classifyNullsSplitsOnPositiveCounts() {
    SpacetimeAggregation st = aggregation(ImputationRules.all(ImputationType.ZERO));
    Map<String, Object> counts = new LinkedHashMap<>();
    counts.put(SUM, 4L);
    counts.put(OPEN, 0L);
    counts.put(NUL, null);
    ImputationSplit split = st.classifyNulls(counts);
    assertEquals(List.of(SUM), split.imputeColumns());
    assertEquals(List.of(OPEN, NUL), split.passThroughColumns());

    counts.remove(NUL);
    assertThrows(ImputationException.class, () -> st.classifyNulls(counts));
  }

  @Test
  void executeImputationRebuildsImputedTableInOneTransaction() {
    SpacetimeAggregation st = aggregation(ImputationRules.all(ImputationType.ZERO));
    RecordingSqlEngine engine = new RecordingSqlEngine().onQueryRow(s -> {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(SUM, 2L);
      row.put(OPEN, 2L);
      row.put(NUL, 0L);
      return row;
    });

    ImputationSplit split = st.executeImputation(engine);
    assertEquals(List.of(SUM, OPEN), split.imputeColumns());
    assertEquals(1, engine.commits());

    List<String> sql = engine.committedSql();
    assertEquals(3, sql.size());
    assertTrue(sql.get(0).startsWith("SELECT SUM(CASE WHEN"));
    assertEquals("DROP TABLE IF EXISTS \"ev_aggregation_imputed\"", sql.get(1));
    assertTrue(sql.get(2).contains("COALESCE(" + OPEN + ", 0) AS " + OPEN));
    assertTrue(sql.get(2).contains("COALESCE(" + SUM + ", 0) AS " + SUM));
  }

  @Test
  void stateTableIsRequiredForImputation() {
    SpacetimeAggregation st = SpacetimeAggregation.builder()
        .aggregate(Aggregate.of("x", "sum")).group("entity_id").fromObj("events")
        .intervals(List.of("all")).date("2016-01-01").build();
    assertThrows(ConfigurationException.class, st::findNulls);
  }
}
