package io.intellixity.collate.aggregation;

import io.intellixity.collate.sql.SqlStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered statements that (re)build an aggregation: optional schema creation, one lifecycle per
 * group (drop, create, inserts, index), then the final joined table (drop, create).
 *
 * @param table        final table name, for logs
 * @param createSchema null when no schema is configured
 */
public record AggregationPlan(String table, SqlStatement createSchema, Map<String, GroupPlan> groups,
                              SqlStatement drop, SqlStatement create) {
  public AggregationPlan {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(groups, "groups");
    Objects.requireNonNull(drop, "drop");
    Objects.requireNonNull(create, "create");
    groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
  }

  /** Every statement in sequential execution order. */
  public List<SqlStatement> statements() {
    List<SqlStatement> out = new ArrayList<>();
    if (createSchema != null) out.add(createSchema);
    for (GroupPlan g : groups.values()) out.addAll(g.statements());
    out.add(drop);
    out.add(create);
    return out;
  }

  /** Lifecycle of one per-group table. */
  public record GroupPlan(String group, SqlStatement drop, SqlStatement create, List<SqlStatement> inserts,
                          SqlStatement index) {
    public GroupPlan {
      Objects.requireNonNull(group, "group");
      Objects.requireNonNull(drop, "drop");
      Objects.requireNonNull(create, "create");
      Objects.requireNonNull(index, "index");
      inserts = inserts == null ? List.of() : List.copyOf(inserts);
    }

    public List<SqlStatement> statements() {
      List<SqlStatement> out = new ArrayList<>(inserts.size() + 3);
      out.add(drop);
      out.add(create);
      out.addAll(inserts);
      out.add(index);
      return out;
    }
  }
}
