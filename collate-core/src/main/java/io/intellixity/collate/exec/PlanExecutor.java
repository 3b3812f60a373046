package io.intellixity.collate.exec;

import io.intellixity.collate.aggregation.AggregationPlan;

/**
 * Strategy for running an {@link AggregationPlan}. All strategies run exactly the statements of the
 * plan; they differ only in transaction scoping and dispatch.
 */
public interface PlanExecutor {
  /** Engine used for the plan and for pre-execution validation. */
  SqlEngine engine();

  void execute(AggregationPlan plan);
}
