package io.intellixity.collate.config;

import io.intellixity.collate.aggregation.SpacetimeAggregation;
import io.intellixity.collate.imputation.ColumnType;
import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.imputation.ImputationType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AggregationDefinitionsTest {

  @Test
  void loadsDefinitionFromClasspath() {
    AggregationDefinitions d = AggregationDefinitions.fromResource("definitions/events.json");
    assertEquals("events", d.prefix());
    assertEquals("cleaned.events", d.fromObj());
    assertEquals("event_date", d.knowledgeDateColumn());
    assertEquals(3, d.aggregates().size());
    assertEquals(1, d.categoricals().size());
    assertEquals(Map.of("entity_id", "entity_id"), d.groups());
    assertEquals(4, d.columnSources().size());
  }

  @Test
  void buildsSpacetimeAggregationWithRules() {
    AggregationDefinitions d = AggregationDefinitions.fromResource("definitions/events.json");
    SpacetimeAggregation st = d.toSpacetime(SpacetimeRun.of(List.of("2016-01-01"), "staging.states")
        .withSchema("features").withInputMinDate("2010-01-01"));

    assertEquals("event_date", st.dateColumn());
    assertEquals("\"features\".\"events_aggregation\"", st.getTableName());
    assertEquals("2010-01-01", st.inputMinDate());

    Map<String, ImputationRule> rules = st.getImputationRules();
    assertEquals(ImputationType.MEAN, rules.get("events_entity_id_all_amount_sum").type());
    ImputationRule late = rules.get("events_entity_id_1 year_late_max");
    assertEquals(ImputationType.CONSTANT, late.type());
    assertEquals("0", late.value());
    assertEquals(ImputationType.ZERO, rules.get("events_entity_id_all_amount_age_corr").type());

    ImputationRule nul = rules.get("events_entity_id_all_status_NULL_sum");
    assertEquals(ColumnType.CATEGORICAL, nul.coltype());
    assertEquals(ImputationType.NULL_CATEGORY, nul.type());
    assertTrue(nul.nullIndicator());
    assertEquals(2 * (2 + 1 + 1 + 3), rules.size());
  }

  @Test
  void intervalsMayBeGivenPerGroup() {
    String json = "{\"from_obj\": \"e\", \"aggregates\": [{\"quantity\": \"x\", \"metrics\": [\"sum\"]}],"
        + " \"groups\": {\"entity\": \"entity_id\", \"zip\": \"zip_code\"},"
        + " \"intervals\": {\"entity\": [\"1 month\"], \"zip\": \"all\"}}";
    SpacetimeAggregation st = AggregationDefinitions.parse(json).toSpacetime(SpacetimeRun.of(List.of("2016-01-01"), null));
    assertEquals(List.of("1 month"), st.intervals().get("entity"));
    assertEquals(List.of("all"), st.intervals().get("zip"));
    assertEquals("e", st.prefix());
  }

  @Test
  void errorsNameTheField() {
    var e1 = assertThrows(ConfigurationException.class, () -> AggregationDefinitions.parse(
        "{\"from_obj\": \"e\", \"aggregates\": [{\"quantity\": \"x\"}], \"groups\": [\"g\"], \"intervals\": [\"all\"]}"));
    assertTrue(e1.getMessage().contains("aggregates[0].metrics"), e1.getMessage());

    var e2 = assertThrows(ConfigurationException.class, () -> AggregationDefinitions.parse(
        "{\"from_obj\": \"e\", \"aggregates\": [{\"quantity\": \"x\", \"metrics\": \"sum\","
            + " \"imputation\": {\"all\": {\"type\": \"median\"}}}], \"groups\": [\"g\"], \"intervals\": [\"all\"]}"));
    assertTrue(e2.getMessage().contains("aggregates[0].imputation.all.type"), e2.getMessage());

    var e3 = assertThrows(ConfigurationException.class, () -> AggregationDefinitions.parse(
        "{\"aggregates\": [], \"groups\": [\"g\"], \"intervals\": [\"all\"]}"));
    assertTrue(e3.getMessage().contains("from_obj"), e3.getMessage());

    assertThrows(ConfigurationException.class, () -> AggregationDefinitions.parse("{not json"));
    assertThrows(ConfigurationException.class, () -> AggregationDefinitions.fromResource("definitions/missing.json"));
  }

  @Test
  void constantImputationNeedsValue() {
    var e = assertThrows(ConfigurationException.class, () -> AggregationDefinitions.parse(
        "{\"from_obj\": \"e\", \"aggregates\": [{\"quantity\": \"x\", \"metrics\": \"sum\","
            + " \"imputation\": {\"sum\": {\"type\": \"constant\"}}}], \"groups\": [\"g\"], \"intervals\": [\"all\"]}"));
    assertTrue(e.getMessage().contains("aggregates[0].imputation.sum.value"), e.getMessage());
  }

  @Test
  void arrayCategoricalsHaveTheirOwnSection() {
    String json = "{\"from_obj\": \"e\", \"array_categoricals_imputation\": {\"all\": {\"type\": \"zero\"}},"
        + " \"array_categoricals\": [{\"column\": \"tags\", \"choices\": [\"red\", \"blue\"], \"metrics\": [\"sum\"]}],"
        + " \"groups\": [\"entity_id\"], \"intervals\": [\"all\"]}";
    AggregationDefinitions d = AggregationDefinitions.parse(json);
    assertEquals(1, d.categoricals().size());

    SpacetimeAggregation st = d.toSpacetime(SpacetimeRun.of(List.of("2016-01-01"), "states"));
    ImputationRule red = st.getImputationRules().get("e_entity_id_all_tags_red_sum");
    assertEquals(ColumnType.ARRAY_CATEGORICAL, red.coltype());
    assertEquals(ImputationType.ZERO, red.type());
    assertTrue(st.getSelects().get("entity_id").get(0).toSql().contains("(tags @> ARRAY['red'])::INT"));
  }
}
