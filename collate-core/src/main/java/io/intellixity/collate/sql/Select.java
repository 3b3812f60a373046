package io.intellixity.collate.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable SELECT builder: columns, one from-clause, optional where, group by and limit.\n
 *
 * Every {@code withX} returns a copy; rendering is deterministic so plans built twice compare equal.
 */
public final class Select implements SqlRenderable {
  private final List<Column> columns;
  private final String from;
  private final String where;
  private final List<String> groupBy;
  private final Integer limit;

  private Select(List<Column> columns, String from, String where, List<String> groupBy, Integer limit) {
    this.columns = List.copyOf(columns);
    this.from = from;
    this.where = where;
    this.groupBy = List.copyOf(groupBy);
    this.limit = limit;
  }

  public static Select of(List<Column> columns, String from) {
    Objects.requireNonNull(columns, "columns");
    if (columns.isEmpty()) throw new IllegalArgumentException("Select has no columns");
    return new Select(columns, Objects.requireNonNull(from, "from"), null, List.of(), null);
  }

  public Select where(String predicate) {
    return new Select(columns, from, predicate, groupBy, limit);
  }

  public Select groupBy(String... expressions) {
    return groupBy(List.of(expressions));
  }

  public Select groupBy(List<String> expressions) {
    List<String> gb = new ArrayList<>(groupBy);
    gb.addAll(expressions);
    return new Select(columns, from, where, gb, limit);
  }

  public Select limit(int n) {
    if (n < 0) throw new IllegalArgumentException("limit must be >= 0");
    return new Select(columns, from, where, groupBy, n);
  }

  public List<Column> columns() { return columns; }
  public String from() { return from; }
  public String where() { return where; }
  public List<String> groupBy() { return groupBy; }
  public Integer limit() { return limit; }

  @Override
  public String toSql() {
    StringBuilder sql = new StringBuilder("SELECT ");
    List<String> items = new ArrayList<>(columns.size());
    for (Column c : columns) items.add(c.toSql());
    sql.append(String.join(", ", items));
    sql.append("\nFROM ").append(from);
    if (where != null && !where.isBlank()) sql.append("\nWHERE ").append(where);
    if (!groupBy.isEmpty()) sql.append("\nGROUP BY ").append(String.join(", ", groupBy));
    if (limit != null) sql.append("\nLIMIT ").append(limit);
    return sql.toString();
  }

  @Override
  public String toString() { return toSql(); }
}
