package io.intellixity.collate.aggregation;

import io.intellixity.collate.aggregate.ColumnSource;
import io.intellixity.collate.aggregate.FormatParams;
import io.intellixity.collate.config.ConfigurationException;
import io.intellixity.collate.exec.PlanExecutor;
import io.intellixity.collate.exec.SqlSession;
import io.intellixity.collate.sql.Column;
import io.intellixity.collate.sql.CreateTableAs;
import io.intellixity.collate.sql.InsertFromSelect;
import io.intellixity.collate.sql.Select;
import io.intellixity.collate.sql.SqlNames;
import io.intellixity.collate.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A set of aggregates computed for several group-by keys, one table per key, joined into one
 * final table.\n
 *
 * Every method only builds SQL; {@link #execute(PlanExecutor)} hands the plan to an executor.
 */
public class Aggregation {
  private static final Logger log = LoggerFactory.getLogger(Aggregation.class);
  public static final String DEFAULT_SUFFIX = "aggregation";

  protected final List<ColumnSource> aggregates;
  protected final Map<String, String> groups;
  protected final String fromObj;
  protected final String prefix;
  protected final String suffix;
  protected final String schema;

  /**
   * @param aggregates aggregates (or expressions) to compute
   * @param groups     group alias (used in table and column names) → group-by expression
   * @param fromObj    from clause, e.g. a table name or a parenthesised subquery with alias
   * @param prefix     prefix for table and column names, defaults to {@code fromObj}
   * @param suffix     suffix of the final table, defaults to {@code aggregation}
   * @param schema     schema for all tables, or null
   */
  public Aggregation(List<? extends ColumnSource> aggregates, Map<String, String> groups, String fromObj,
                     String prefix, String suffix, String schema) {
    Objects.requireNonNull(aggregates, "aggregates");
    Objects.requireNonNull(groups, "groups");
    Objects.requireNonNull(fromObj, "fromObj");
    if (aggregates.isEmpty()) throw new ConfigurationException("Aggregation has no aggregates");
    if (groups.isEmpty()) throw new ConfigurationException("Aggregation has no groups");
    for (var e : groups.entrySet()) {
      if (e.getKey() == null || e.getKey().isBlank()) throw new ConfigurationException("Group name is blank");
      if (e.getValue() == null || e.getValue().isBlank()) {
        throw new ConfigurationException("Group expression is blank for group '" + e.getKey() + "'");
      }
    }
    this.aggregates = List.copyOf(aggregates);
    this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    this.fromObj = fromObj;
    this.prefix = (prefix == null || prefix.isBlank()) ? fromObj : prefix;
    this.suffix = (suffix == null || suffix.isBlank()) ? DEFAULT_SUFFIX : suffix;
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public Aggregation(List<? extends ColumnSource> aggregates, List<String> groups, String fromObj) {
    this(aggregates, groupsByName(groups), fromObj, null, null, null);
  }

  /** Groups given as plain expressions are named after themselves. */
  public static Map<String, String> groupsByName(List<String> groups) {
    Map<String, String> out = new LinkedHashMap<>();
    for (String g : groups) {
      if (out.put(g, g) != null) throw new ConfigurationException("Duplicate group '" + g + "'");
    }
    return out;
  }

  public List<ColumnSource> aggregates() { return aggregates; }
  public Map<String, String> groups() { return groups; }
  public String fromObj() { return fromObj; }
  public String prefix() { return prefix; }
  public String suffix() { return suffix; }
  public String schema() { return schema; }

  /** Aggregate columns for one group, prefixed {@code {prefix}_{group}_}. */
  protected List<Column> aggregatesSql(String group) {
    String p = prefix + "_" + group + "_";
    List<Column> out = new ArrayList<>();
    for (ColumnSource a : aggregates) out.addAll(a.columns(null, p, FormatParams.NONE));
    return out;
  }

  /** Group → select queries populating that group's table. */
  public Map<String, List<Select>> getSelects() {
    Map<String, List<Select>> out = new LinkedHashMap<>();
    for (var e : groups.entrySet()) {
      List<Column> columns = new ArrayList<>();
      columns.add(Column.raw(e.getValue()));
      columns.addAll(aggregatesSql(e.getKey()));
      out.put(e.getKey(), List.of(Select.of(columns, fromObj).groupBy(e.getValue())));
    }
    return out;
  }

  /** {@code "schema"."prefix_group"}, or the final table when {@code group} is null. */
  public String getTableName(String group) {
    String name = (group == null) ? prefix + "_" + suffix : prefix + "_" + group;
    return SqlNames.qualifiedTable(schema, name);
  }

  public String getTableName() {
    return getTableName(null);
  }

  /** Group → empty table with the select's shape. */
  public Map<String, SqlStatement> getCreates() {
    Map<String, SqlStatement> out = new LinkedHashMap<>();
    for (var e : getSelects().entrySet()) {
      Select first = e.getValue().get(0);
      out.put(e.getKey(), SqlStatement.update(new CreateTableAs(getTableName(e.getKey()), first.limit(0))));
    }
    return out;
  }

  /** Group → one insert-from-select per select. */
  public Map<String, List<SqlStatement>> getInserts() {
    Map<String, List<SqlStatement>> out = new LinkedHashMap<>();
    for (var e : getSelects().entrySet()) {
      List<SqlStatement> inserts = new ArrayList<>();
      for (Select s : e.getValue()) {
        inserts.add(SqlStatement.update(new InsertFromSelect(getTableName(e.getKey()), s)));
      }
      out.put(e.getKey(), inserts);
    }
    return out;
  }

  public Map<String, SqlStatement> getDrops() {
    Map<String, SqlStatement> out = new LinkedHashMap<>();
    for (String group : groups.keySet()) {
      out.put(group, SqlStatement.update("DROP TABLE IF EXISTS " + getTableName(group)));
    }
    return out;
  }

  public Map<String, SqlStatement> getIndexes() {
    Map<String, SqlStatement> out = new LinkedHashMap<>();
    for (var e : groups.entrySet()) {
      out.put(e.getKey(), SqlStatement.update("CREATE INDEX ON " + getTableName(e.getKey())
          + " (" + String.join(", ", indexKeys(e.getValue())) + ")"));
    }
    return out;
  }

  protected List<String> indexKeys(String groupBy) {
    return List.of(groupBy);
  }

  /** Every distinct combination of group values in the source. */
  public String getJoinTable() {
    List<String> gs = new ArrayList<>(groups.values());
    List<Column> columns = new ArrayList<>();
    for (String g : gs) columns.add(Column.raw(g));
    return Select.of(columns, fromObj).groupBy(gs).toSql();
  }

  /** Final table: the join table left-joined with every per-group table. */
  public SqlStatement getCreate(String joinTable) {
    String jt = (joinTable == null || joinTable.isBlank()) ? "(" + getJoinTable() + ") t1" : joinTable;
    StringBuilder query = new StringBuilder("SELECT * FROM ").append(jt);
    for (var e : groups.entrySet()) {
      query.append("\nLEFT JOIN ").append(getTableName(e.getKey()))
          .append(" USING (").append(String.join(", ", joinKeys(e.getValue()))).append(")");
    }
    return SqlStatement.update("CREATE TABLE " + getTableName() + " AS (" + query + ")");
  }

  public SqlStatement getCreate() {
    return getCreate(null);
  }

  protected List<String> joinKeys(String groupBy) {
    return List.of(groupBy);
  }

  public SqlStatement getDrop() {
    return SqlStatement.update("DROP TABLE IF EXISTS " + getTableName());
  }

  /** Null when no schema is configured. */
  public SqlStatement getCreateSchema() {
    if (schema == null) return null;
    return SqlStatement.update("CREATE SCHEMA IF NOT EXISTS " + SqlNames.quoteIdent(schema));
  }

  /** Full rebuild plan; {@code joinTable} overrides the generated join table (aliased from-item). */
  public AggregationPlan plan(String joinTable) {
    Map<String, SqlStatement> drops = getDrops();
    Map<String, SqlStatement> creates = getCreates();
    Map<String, List<SqlStatement>> inserts = getInserts();
    Map<String, SqlStatement> indexes = getIndexes();

    Map<String, AggregationPlan.GroupPlan> plans = new LinkedHashMap<>();
    for (String group : groups.keySet()) {
      plans.put(group, new AggregationPlan.GroupPlan(group, drops.get(group), creates.get(group),
          inserts.get(group), indexes.get(group)));
    }
    return new AggregationPlan(getTableName(), getCreateSchema(), plans, getDrop(), getCreate(joinTable));
  }

  public AggregationPlan plan() {
    return plan(null);
  }

  /**
   * Check the aggregation against a live connection before anything is created.
   * No-op here; subclasses add checks.
   */
  public void validate(SqlSession session) {
  }

  public final void execute(PlanExecutor executor) {
    execute(executor, null);
  }

  /** Validate, then run the full plan through {@code executor}. */
  public final void execute(PlanExecutor executor, String joinTable) {
    Objects.requireNonNull(executor, "executor");
    executor.engine().withSession(session -> {
      validate(session);
      return null;
    });
    AggregationPlan plan = plan(joinTable);
    log.info("collate.aggregation table={} groups={} statements={}",
        plan.table(), plan.groups().size(), plan.statements().size());
    executor.execute(plan);
  }
}
