package io.intellixity.collate.exec;

import io.intellixity.collate.aggregation.AggregationPlan;
import io.intellixity.collate.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Runs the whole plan, in order, inside one transaction. Any failure rolls everything back. */
public final class SequentialPlanExecutor implements PlanExecutor {
  private static final Logger log = LoggerFactory.getLogger(SequentialPlanExecutor.class);
  private final SqlEngine engine;

  public SequentialPlanExecutor(SqlEngine engine) {
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  @Override
  public SqlEngine engine() { return engine; }

  @Override
  public void execute(AggregationPlan plan) {
    Objects.requireNonNull(plan, "plan");
    long start = System.nanoTime();
    engine.inTx(session -> {
      if (plan.createSchema() != null) session.execute(plan.createSchema());
      for (AggregationPlan.GroupPlan g : plan.groups().values()) {
        for (SqlStatement s : g.statements()) session.execute(s);
        log.debug("collate.plan group={} inserts={}", g.group(), g.inserts().size());
      }
      session.execute(plan.drop());
      session.execute(plan.create());
      return null;
    });
    log.info("collate.plan_done executor=sequential engine={} table={} groups={} durationMs={}",
        engine.id(), plan.table(), plan.groups().size(), (System.nanoTime() - start) / 1_000_000.0);
  }
}
