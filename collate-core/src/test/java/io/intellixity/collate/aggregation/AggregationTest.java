package io.intellixity.collate.aggregation;

import io.intellixity.collate.aggregate.Aggregate;
import io.intellixity.collate.config.ConfigurationException;
import io.intellixity.collate.exec.RecordingSqlEngine;
import io.intellixity.collate.exec.SequentialPlanExecutor;
import io.intellixity.collate.sql.Select;
import io.intellixity.collate.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AggregationTest {

  private static Aggregation simple() {
    return new Aggregation(List.of(Aggregate.of("amount", "sum")), List.of("entity_id"), "events");
  }

  @Test
  void selectPerGroupWithPrefixedColumns() {
    Map<String, List<Select>> selects = simple().getSelects();
    assertEquals(List.of("entity_id"), List.copyOf(selects.keySet()));
    assertEquals("SELECT entity_id, sum(amount) AS events_entity_id_amount_sum\nFROM events\nGROUP BY entity_id",
        selects.get("entity_id").get(0).toSql());
  }

  @Test
  void tableLifecycleStatements() {
    Aggregation a = simple();
    assertEquals("\"events_entity_id\"", a.getTableName("entity_id"));
    assertEquals("\"events_aggregation\"", a.getTableName());
    assertEquals("DROP TABLE IF EXISTS \"events_entity_id\"", a.getDrops().get("entity_id").sql());
    assertEquals("CREATE TABLE \"events_entity_id\" AS SELECT entity_id, sum(amount) AS events_entity_id_amount_sum"
        + "\nFROM events\nGROUP BY entity_id\nLIMIT 0", a.getCreates().get("entity_id").sql());
    assertEquals("INSERT INTO \"events_entity_id\" (SELECT entity_id, sum(amount) AS events_entity_id_amount_sum"
        + "\nFROM events\nGROUP BY entity_id)", a.getInserts().get("entity_id").get(0).sql());
    assertEquals("CREATE INDEX ON \"events_entity_id\" (entity_id)", a.getIndexes().get("entity_id").sql());
    assertEquals("DROP TABLE IF EXISTS \"events_aggregation\"", a.getDrop().sql());
    assertNull(a.getCreateSchema());
  }

  @Test
  void finalTableJoinsEveryGroup() {
    Map<String, String> groups = new LinkedHashMap<>();
    groups.put("entity", "entity_id");
    groups.put("zip", "zip_code");
    Aggregation a = new Aggregation(List.of(Aggregate.of("amount", "sum")), groups, "events", "ev", null, "features");

    assertEquals("SELECT entity_id, zip_code\nFROM events\nGROUP BY entity_id, zip_code", a.getJoinTable());
    assertEquals("CREATE TABLE \"features\".\"ev_aggregation\" AS (SELECT * FROM "
            + "(SELECT entity_id, zip_code\nFROM events\nGROUP BY entity_id, zip_code) t1"
            + "\nLEFT JOIN \"features\".\"ev_entity\" USING (entity_id)"
            + "\nLEFT JOIN \"features\".\"ev_zip\" USING (zip_code))",
        a.getCreate().sql());
    assertEquals("CREATE SCHEMA IF NOT EXISTS \"features\"", a.getCreateSchema().sql());
  }

  @Test
  void explicitJoinTableIsUsedVerbatim() {
    SqlStatement create = simple().getCreate("entities e");
    assertTrue(create.sql().startsWith("CREATE TABLE \"events_aggregation\" AS (SELECT * FROM entities e\n"));
  }

  @Test
  void prefixAndSuffixDefaults() {
    Aggregation a = new Aggregation(List.of(Aggregate.of("x", "max")), Aggregation.groupsByName(List.of("g")), "src",
        "", null, " ");
    assertEquals("src", a.prefix());
    assertEquals("aggregation", a.suffix());
    assertNull(a.schema());
  }

  @Test
  void planOrdersStatements() {
    Aggregation a = new Aggregation(List.of(Aggregate.of("amount", "sum")), Aggregation.groupsByName(List.of("entity_id")),
        "events", null, null, "s");
    List<String> sql = a.plan().statements().stream().map(SqlStatement::sql).toList();
    assertEquals(7, sql.size());
    assertTrue(sql.get(0).startsWith("CREATE SCHEMA"));
    assertTrue(sql.get(1).startsWith("DROP TABLE IF EXISTS \"s\".\"events_entity_id\""));
    assertTrue(sql.get(2).startsWith("CREATE TABLE \"s\".\"events_entity_id\""));
    assertTrue(sql.get(3).startsWith("INSERT INTO"));
    assertTrue(sql.get(4).startsWith("CREATE INDEX"));
    assertTrue(sql.get(5).startsWith("DROP TABLE IF EXISTS \"s\".\"events_aggregation\""));
    assertTrue(sql.get(6).startsWith("CREATE TABLE \"s\".\"events_aggregation\""));
  }

  @Test
  void executeRunsWholePlanInOneTransaction() {
    RecordingSqlEngine engine = new RecordingSqlEngine();
    Aggregation a = simple();
    a.execute(new SequentialPlanExecutor(engine));
    assertEquals(a.plan().statements(), engine.committed());
    assertEquals(1, engine.commits());
  }

  @Test
  void emptyConfigurationIsRejected() {
    assertThrows(ConfigurationException.class, () -> new Aggregation(List.of(), List.of("g"), "t"));
    assertThrows(ConfigurationException.class,
        () -> new Aggregation(List.of(Aggregate.of("x", "sum")), List.of(), "t"));
    assertThrows(ConfigurationException.class,
        () -> new Aggregation(List.of(Aggregate.of("x", "sum")), List.of("g", "g"), "t"));
  }
}
