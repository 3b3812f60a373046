package io.intellixity.collate.config;

import java.util.List;
import java.util.Objects;

/**
 * Run-time parameters of a spacetime aggregation, kept apart from the feature definition so the
 * same definition can be replayed for other dates.
 *
 * @param stateTable       state table for null diagnostics and imputation, or null
 * @param stateGroup       group column of the state table, defaults to {@code entity_id}
 * @param schema           schema for every generated table, or null
 * @param inputMinDate     absolute floor for source rows, or null
 * @param outputDateColumn date column of the output tables, defaults to {@code date}
 */
public record SpacetimeRun(List<String> dates, String stateTable, String stateGroup, String schema,
                           String inputMinDate, String outputDateColumn) {
  public SpacetimeRun {
    Objects.requireNonNull(dates, "dates");
    dates = List.copyOf(dates);
  }

  public static SpacetimeRun of(List<String> dates, String stateTable) {
    return new SpacetimeRun(dates, stateTable, null, null, null, null);
  }

  public SpacetimeRun withSchema(String s) {
    return new SpacetimeRun(dates, stateTable, stateGroup, s, inputMinDate, outputDateColumn);
  }

  public SpacetimeRun withInputMinDate(String d) {
    return new SpacetimeRun(dates, stateTable, stateGroup, schema, d, outputDateColumn);
  }

  public SpacetimeRun withStateGroup(String g) {
    return new SpacetimeRun(dates, stateTable, g, schema, inputMinDate, outputDateColumn);
  }

  public SpacetimeRun withOutputDateColumn(String c) {
    return new SpacetimeRun(dates, stateTable, stateGroup, schema, inputMinDate, c);
  }
}
