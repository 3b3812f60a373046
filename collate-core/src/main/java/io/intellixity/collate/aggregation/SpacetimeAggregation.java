package io.intellixity.collate.aggregation;

import io.intellixity.collate.aggregate.ColumnSource;
import io.intellixity.collate.aggregate.FormatParams;
import io.intellixity.collate.config.ConfigurationException;
import io.intellixity.collate.exec.SqlEngine;
import io.intellixity.collate.exec.SqlSession;
import io.intellixity.collate.imputation.ImputationException;
import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.imputation.ImputationSplit;
import io.intellixity.collate.imputation.ImputationSql;
import io.intellixity.collate.sql.Column;
import io.intellixity.collate.sql.Select;
import io.intellixity.collate.sql.SqlNames;
import io.intellixity.collate.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An {@link Aggregation} evaluated at several as-of dates over trailing time windows.\n
 *
 * Each per-group table is keyed by (group value, as-of date) and holds one column set per
 * interval, prefixed {@code {prefix}_{group}_{interval}_}. An interval is either {@code all}
 * (no lower bound) or a Postgres interval literal such as {@code 6 months}; a window keeps rows
 * with {@code as_of_date - interval <= date_column < as_of_date}.
 * <p>
 * The imputation step joins a state table (one row per valid (entity, date)) against the final
 * table and rewrites the columns that turned out to contain nulls.
 */
public class SpacetimeAggregation extends Aggregation {
  private static final Logger log = LoggerFactory.getLogger(SpacetimeAggregation.class);

  public static final String ALL = "all";
  public static final String DEFAULT_STATE_GROUP = "entity_id";
  public static final String DEFAULT_DATE_COLUMN = "date";

  private final Map<String, List<String>> intervals;
  private final List<String> dates;
  private final String stateTable;
  private final String stateGroup;
  private final String dateColumn;
  private final String outputDateColumn;
  private final String inputMinDate;

  protected SpacetimeAggregation(Builder b) {
    super(b.aggregates, b.groups, b.fromObj, b.prefix, b.suffix, b.schema);
    this.intervals = resolveIntervals(groups, b.sharedIntervals, b.intervalsByGroup);
    if (b.dates.isEmpty()) throw new ConfigurationException("SpacetimeAggregation has no dates");
    for (String d : b.dates) {
      if (d == null || d.isBlank()) throw new ConfigurationException("Blank as-of date");
    }
    this.dates = List.copyOf(b.dates);
    this.stateTable = blankToNull(b.stateTable);
    this.stateGroup = orDefault(b.stateGroup, DEFAULT_STATE_GROUP);
    this.dateColumn = orDefault(b.dateColumn, DEFAULT_DATE_COLUMN);
    this.outputDateColumn = orDefault(b.outputDateColumn, DEFAULT_DATE_COLUMN);
    this.inputMinDate = blankToNull(b.inputMinDate);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, List<String>> intervals() { return intervals; }
  public List<String> dates() { return dates; }
  public String stateTable() { return stateTable; }
  public String stateGroup() { return stateGroup; }
  public String dateColumn() { return dateColumn; }
  public String outputDateColumn() { return outputDateColumn; }
  public String inputMinDate() { return inputMinDate; }

  /** Columns of every aggregate for one (interval, date, group), filtered to the window. */
  protected List<Column> aggregatesSql(String interval, String date, String group) {
    String when = ALL.equals(interval) ? null
        : dateColumn + " >= '" + date + "'::date - interval '" + interval + "'";
    String p = columnPrefix(group, interval);
    FormatParams params = FormatParams.of(date, interval);
    List<Column> out = new ArrayList<>();
    for (ColumnSource a : aggregates) out.addAll(a.columns(when, p, params));
    return out;
  }

  private String columnPrefix(String group, String interval) {
    return prefix + "_" + group + "_" + interval + "_";
  }

  /** Group → one select per as-of date. */
  @Override
  public Map<String, List<Select>> getSelects() {
    Map<String, List<Select>> out = new LinkedHashMap<>();
    for (var e : groups.entrySet()) {
      String group = e.getKey();
      String groupBy = e.getValue();
      List<String> groupIntervals = intervals.get(group);
      List<Select> selects = new ArrayList<>(dates.size());
      for (String date : dates) {
        List<Column> columns = new ArrayList<>();
        columns.add(Column.raw(groupBy));
        columns.add(dateLiteral(date));
        for (String interval : groupIntervals) columns.addAll(aggregatesSql(interval, date, group));
        selects.add(Select.of(columns, fromObj).where(where(date, groupIntervals)).groupBy(groupBy));
      }
      out.put(group, selects);
    }
    return out;
  }

  private Column dateLiteral(String date) {
    return new Column("'" + date + "'::date", outputDateColumn);
  }

  /**
   * Rows strictly before {@code date}; bounded below by the widest interval unless one of them is
   * {@code all}, and by the input floor when one is configured.
   */
  public String where(String date, Collection<String> intervals) {
    Objects.requireNonNull(date, "date");
    StringBuilder w = new StringBuilder(dateColumn).append(" < '").append(date).append("'");
    if (!intervals.isEmpty() && !intervals.contains(ALL)) {
      List<String> bounds = new ArrayList<>(intervals.size());
      for (String i : intervals) bounds.add("interval '" + i + "'");
      w.append(" AND ").append(dateColumn).append(" >= '").append(date).append("'::date - greatest(")
          .append(String.join(",", bounds)).append(")");
    }
    if (inputMinDate != null) {
      w.append(" AND ").append(dateColumn).append(" >= '").append(inputMinDate).append("'::date");
    }
    return w.toString();
  }

  @Override
  protected List<String> indexKeys(String groupBy) {
    return List.of(groupBy, outputDateColumn);
  }

  @Override
  protected List<String> joinKeys(String groupBy) {
    return List.of(groupBy, outputDateColumn);
  }

  /** Every (group values, as-of date) present in the source within the union of all windows. */
  @Override
  public String getJoinTable() {
    List<String> gs = new ArrayList<>(groups.values());
    List<String> all = distinctIntervals();
    List<String> queries = new ArrayList<>(dates.size());
    for (String date : dates) {
      List<Column> columns = new ArrayList<>();
      for (String g : gs) columns.add(Column.raw(g));
      columns.add(dateLiteral(date));
      queries.add(Select.of(columns, fromObj).where(where(date, all)).groupBy(gs).toSql());
    }
    return String.join("\nUNION ALL\n", queries);
  }

  private List<String> distinctIntervals() {
    Set<String> out = new LinkedHashSet<>();
    for (List<String> is : intervals.values()) out.addAll(is);
    return new ArrayList<>(out);
  }

  /**
   * With an input floor configured, check every (date, bounded interval) pair against it on the
   * server, one round trip per pair so the failing pair can be named.
   *
   * @throws TemporalValidationException for the first pair whose window starts before the floor
   */
  @Override
  public void validate(SqlSession session) {
    if (inputMinDate == null) return;
    Objects.requireNonNull(session, "session");
    for (String date : dates) {
      for (String interval : distinctIntervals()) {
        if (ALL.equals(interval)) continue;
        Object before = session.queryOne(SqlStatement.query(
            "SELECT ('" + date + "'::date - '" + interval + "'::interval) < '" + inputMinDate + "'::date"));
        if (isTrue(before)) throw new TemporalValidationException(date, interval, inputMinDate);
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("collate.validate table={} dates={} inputMinDate={} ok", getTableName(), dates.size(), inputMinDate);
    }
  }

  private static boolean isTrue(Object v) {
    if (v instanceof Boolean b) return b;
    if (v instanceof Number n) return n.intValue() != 0;
    if (v instanceof String s) return s.equalsIgnoreCase("t") || s.equalsIgnoreCase("true");
    return false;
  }

  /** Output column → its imputation rule, across every group and each group's own intervals. */
  public Map<String, ImputationRule> getImputationRules() {
    Map<String, ImputationRule> out = new LinkedHashMap<>();
    for (String group : groups.keySet()) {
      for (String interval : intervals.get(group)) {
        FormatParams params = FormatParams.of(dates.get(0), interval);
        for (ColumnSource a : aggregates) out.putAll(a.imputationRules(columnPrefix(group, interval), params));
      }
    }
    return out;
  }

  public String getTableName(String group, boolean imputed) {
    if (!imputed) return getTableName(group);
    return SqlNames.qualifiedTable(schema, prefix + "_" + suffix + "_imputed");
  }

  public String getImputedTableName() {
    return getTableName(null, true);
  }

  public SqlStatement getImputeDrop() {
    return SqlStatement.update("DROP TABLE IF EXISTS " + getImputedTableName());
  }

  /** One row: per output column, how many state-table rows have no value for it. */
  public SqlStatement findNulls() {
    String state = requireStateTable();
    Map<String, ImputationRule> rules = getImputationRules();
    checkLabelLengths(rules.keySet());
    List<String> cols = new ArrayList<>();
    for (String column : rules.keySet()) {
      String c = SqlNames.quoteIdentIfNeeded(column);
      cols.add("SUM(CASE WHEN " + c + " IS NULL THEN 1 ELSE 0 END) AS " + c);
    }
    return SqlStatement.query("SELECT " + String.join(",\n", cols)
        + "\nFROM " + state + " t1"
        + "\nLEFT JOIN " + getTableName() + " t2 USING(" + stateGroup + ", " + outputDateColumn + ")");
  }

  /**
   * Split rule columns by their null count from {@link #findNulls()}; a positive count means the
   * column needs imputation.
   */
  public ImputationSplit classifyNulls(Map<String, ?> nullCounts) {
    Objects.requireNonNull(nullCounts, "nullCounts");
    List<String> impute = new ArrayList<>();
    List<String> pass = new ArrayList<>();
    for (String column : getImputationRules().keySet()) {
      if (!nullCounts.containsKey(column)) {
        String hint = SqlNames.exceedsIdentifierLimit(column)
            ? " (label is longer than " + SqlNames.MAX_IDENTIFIER_BYTES + " bytes and was truncated by the database)" : "";
        throw new ImputationException("No null count for column " + column + hint);
      }
      Object count = nullCounts.get(column);
      if (count instanceof Number n && n.longValue() > 0) impute.add(column);
      else pass.add(column);
    }
    return new ImputationSplit(impute, pass);
  }

  /**
   * Imputed copy of the final table, anchored on the state table. Columns in {@code imputeCols}
   * are rewritten through their rule (plus an {@code _imp} flag when not categorical); the rest
   * pass through.
   *
   * @throws ImputationException if a rule column is missing from both lists or listed twice,
   *                             or a column's rule cannot fill it
   */
  public SqlStatement getImputeCreate(List<String> imputeCols, List<String> nonimputeCols) {
    Objects.requireNonNull(imputeCols, "imputeCols");
    Objects.requireNonNull(nonimputeCols, "nonimputeCols");
    String state = requireStateTable();
    Map<String, ImputationRule> rules = getImputationRules();
    checkLabelLengths(rules.keySet());
    checkCoverage(rules.keySet(), imputeCols, nonimputeCols);

    List<String> keys = new ArrayList<>(groups.values());
    keys.add(outputDateColumn);
    StringBuilder query = new StringBuilder("SELECT ").append(String.join(", ", keys));
    for (String col : nonimputeCols) query.append("\n,").append(SqlNames.quoteIdentIfNeeded(col));
    for (String col : imputeCols) {
      ImputationRule rule = rules.get(col);
      query.append("\n,").append(ImputationSql.render(col, rule, outputDateColumn));
      if (!rule.coltype().categorical()) query.append("\n,").append(ImputationSql.imputedFlag(col));
    }
    query.append("\nFROM ").append(state).append(" t1");
    query.append("\nLEFT JOIN ").append(getTableName()).append(" t2 USING(")
        .append(stateGroup).append(", ").append(outputDateColumn).append(")");
    return SqlStatement.update("CREATE TABLE " + getImputedTableName() + " AS (" + query + ")");
  }

  public SqlStatement getImputeCreate(ImputationSplit split) {
    return getImputeCreate(split.imputeColumns(), split.passThroughColumns());
  }

  /** Imputation references every output column by name, so none may be cut short by the database. */
  private static void checkLabelLengths(Collection<String> columns) {
    for (String c : columns) {
      if (SqlNames.exceedsIdentifierLimit(c)) {
        throw new ConfigurationException("Column label " + c + " is longer than " + SqlNames.MAX_IDENTIFIER_BYTES
            + " bytes; shorten the prefix, group or quantity names (or set maxlen on comparisons)");
      }
    }
  }

  private static void checkCoverage(Set<String> ruleColumns, List<String> impute, List<String> nonimpute) {
    Set<String> seen = new HashSet<>();
    List<String> all = new ArrayList<>(impute);
    all.addAll(nonimpute);
    for (String c : all) {
      if (!ruleColumns.contains(c)) throw new ImputationException("Unknown column " + c + " in imputation split");
      if (!seen.add(c)) throw new ImputationException("Column " + c + " is classified more than once");
    }
    for (String c : ruleColumns) {
      if (!seen.contains(c)) throw new ImputationException("Column " + c + " is not classified for imputation");
    }
  }

  /**
   * Count nulls against the state table, then rebuild the imputed table, all in one transaction.
   * The final table must already exist.
   */
  public ImputationSplit executeImputation(SqlEngine engine) {
    Objects.requireNonNull(engine, "engine");
    long t0 = System.nanoTime();
    ImputationSplit split = engine.inTx(session -> {
      ImputationSplit s = classifyNulls(session.queryRow(findNulls()));
      session.execute(getImputeDrop());
      session.execute(getImputeCreate(s));
      return s;
    });
    log.info("collate.impute_done engine={} table={} imputed={} passThrough={} durationMs={}",
        engine.id(), getImputedTableName(), split.imputeColumns().size(), split.passThroughColumns().size(),
        (System.nanoTime() - t0) / 1_000_000);
    return split;
  }

  private String requireStateTable() {
    if (stateTable == null) throw new ConfigurationException("No state table configured for " + getTableName());
    return stateTable;
  }

  private static Map<String, List<String>> resolveIntervals(Map<String, String> groups, List<String> shared,
                                                            Map<String, List<String>> byGroup) {
    for (String g : byGroup.keySet()) {
      if (!groups.containsKey(g)) throw new ConfigurationException("Intervals given for unknown group '" + g + "'");
    }
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (String g : groups.keySet()) {
      List<String> is = byGroup.containsKey(g) ? byGroup.get(g) : shared;
      if (is == null || is.isEmpty()) throw new ConfigurationException("No intervals for group '" + g + "'");
      for (String i : is) {
        if (i == null || i.isBlank()) throw new ConfigurationException("Blank interval for group '" + g + "'");
      }
      out.put(g, List.copyOf(is));
    }
    return Collections.unmodifiableMap(out);
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }

  private static String orDefault(String s, String def) {
    return (s == null || s.isBlank()) ? def : s;
  }

  public static class Builder {
    private final List<ColumnSource> aggregates = new ArrayList<>();
    private final Map<String, String> groups = new LinkedHashMap<>();
    private List<String> sharedIntervals;
    private final Map<String, List<String>> intervalsByGroup = new LinkedHashMap<>();
    private final List<String> dates = new ArrayList<>();
    private String fromObj;
    private String stateTable;
    private String stateGroup;
    private String prefix;
    private String suffix;
    private String schema;
    private String dateColumn;
    private String outputDateColumn;
    private String inputMinDate;

    protected Builder() {}

    public Builder aggregate(ColumnSource aggregate) {
      aggregates.add(Objects.requireNonNull(aggregate, "aggregate"));
      return this;
    }

    public Builder aggregates(Collection<? extends ColumnSource> aggregates) {
      for (ColumnSource a : aggregates) aggregate(a);
      return this;
    }

    /** Group named after its expression. */
    public Builder group(String groupBy) {
      return group(groupBy, groupBy);
    }

    public Builder group(String name, String groupBy) {
      if (groups.put(Objects.requireNonNull(name, "name"), groupBy) != null) {
        throw new ConfigurationException("Duplicate group '" + name + "'");
      }
      return this;
    }

    public Builder groups(Collection<String> groupBys) {
      for (String g : groupBys) group(g);
      return this;
    }

    public Builder groups(Map<String, String> groups) {
      for (var e : groups.entrySet()) group(e.getKey(), e.getValue());
      return this;
    }

    /** Intervals for every group without its own. */
    public Builder intervals(Collection<String> intervals) {
      this.sharedIntervals = new ArrayList<>(intervals);
      return this;
    }

    public Builder intervals(String group, Collection<String> intervals) {
      intervalsByGroup.put(Objects.requireNonNull(group, "group"), new ArrayList<>(intervals));
      return this;
    }

    public Builder intervals(Map<String, ? extends Collection<String>> intervals) {
      for (var e : intervals.entrySet()) intervals(e.getKey(), e.getValue());
      return this;
    }

    public Builder dates(Collection<String> dates) {
      this.dates.addAll(dates);
      return this;
    }

    public Builder date(String date) {
      this.dates.add(date);
      return this;
    }

    public Builder fromObj(String fromObj) { this.fromObj = fromObj; return this; }
    public Builder stateTable(String stateTable) { this.stateTable = stateTable; return this; }
    public Builder stateGroup(String stateGroup) { this.stateGroup = stateGroup; return this; }
    public Builder prefix(String prefix) { this.prefix = prefix; return this; }
    public Builder suffix(String suffix) { this.suffix = suffix; return this; }
    public Builder schema(String schema) { this.schema = schema; return this; }
    public Builder dateColumn(String dateColumn) { this.dateColumn = dateColumn; return this; }
    public Builder outputDateColumn(String outputDateColumn) { this.outputDateColumn = outputDateColumn; return this; }
    public Builder inputMinDate(String inputMinDate) { this.inputMinDate = inputMinDate; return this; }

    public SpacetimeAggregation build() {
      return new SpacetimeAggregation(this);
    }
  }
}
