package io.intellixity.collate.exec;

import io.intellixity.collate.aggregation.AggregationPlan;
import io.intellixity.collate.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the plan on a bounded worker pool, each statement group in its own transaction:\n
 *
 * - schema creation, alone\n
 * - per group: drop + create together, strictly before any insert of that group\n
 * - inserts of a group concurrently (with each other and with other groups)\n
 * - per group: index once all of its inserts succeeded\n
 * - final drop + create only after every group's index step succeeded\n
 *
 * The first failure stops dispatch of further work and the final join is never run.
 */
public final class ParallelPlanExecutor implements PlanExecutor {
  private static final Logger log = LoggerFactory.getLogger(ParallelPlanExecutor.class);
  private static final AtomicInteger POOL_SEQ = new AtomicInteger();

  private final SqlEngine engine;
  private final int parallelism;

  public ParallelPlanExecutor(SqlEngine engine, int parallelism) {
    this.engine = Objects.requireNonNull(engine, "engine");
    if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be > 0");
    this.parallelism = parallelism;
  }

  @Override
  public SqlEngine engine() { return engine; }

  public int parallelism() { return parallelism; }

  @Override
  public void execute(AggregationPlan plan) {
    Objects.requireNonNull(plan, "plan");
    long start = System.nanoTime();
    if (plan.createSchema() != null) runTx(List.of(plan.createSchema()));

    AtomicReference<Throwable> failure = new AtomicReference<>();
    ExecutorService pool = Executors.newFixedThreadPool(parallelism, threadFactory());
    try {
      List<CompletableFuture<Void>> groups = new ArrayList<>();
      for (AggregationPlan.GroupPlan g : plan.groups().values()) {
        groups.add(groupCycle(g, pool, failure));
      }
      try {
        CompletableFuture.allOf(groups.toArray(new CompletableFuture[0])).join();
      } catch (CompletionException e) {
        failure.compareAndSet(null, e.getCause());
      }
    } finally {
      pool.shutdownNow();
    }

    Throwable t = failure.get();
    if (t != null) {
      log.warn("collate.plan_aborted executor=parallel engine={} table={} cause={}",
          engine.id(), plan.table(), t.toString());
      throw new PlanExecutionException("Aggregation plan for " + plan.table() + " aborted: " + t.getMessage(), t);
    }

    runTx(List.of(plan.drop(), plan.create()));
    log.info("collate.plan_done executor=parallel engine={} table={} groups={} parallelism={} durationMs={}",
        engine.id(), plan.table(), plan.groups().size(), parallelism, (System.nanoTime() - start) / 1_000_000.0);
  }

  private CompletableFuture<Void> groupCycle(AggregationPlan.GroupPlan g, ExecutorService pool,
                                             AtomicReference<Throwable> failure) {
    return CompletableFuture
        .runAsync(() -> guarded(failure, List.of(g.drop(), g.create())), pool)
        .thenCompose(v -> {
          List<CompletableFuture<Void>> inserts = new ArrayList<>();
          for (SqlStatement insert : g.inserts()) {
            inserts.add(CompletableFuture.runAsync(() -> guarded(failure, List.of(insert)), pool));
          }
          return CompletableFuture.allOf(inserts.toArray(new CompletableFuture[0]));
        })
        .thenRunAsync(() -> {
          guarded(failure, List.of(g.index()));
          log.info("collate.group_done group={} inserts={}", g.group(), g.inserts().size());
        }, pool);
  }

  private void guarded(AtomicReference<Throwable> failure, List<SqlStatement> statements) {
    if (failure.get() != null) throw new PlanExecutionException("Skipped after earlier failure");
    try {
      runTx(statements);
    } catch (RuntimeException e) {
      failure.compareAndSet(null, e);
      throw e;
    }
  }

  private void runTx(List<SqlStatement> statements) {
    engine.inTx(session -> {
      for (SqlStatement s : statements) session.execute(s);
      return null;
    });
  }

  private static ThreadFactory threadFactory() {
    int poolId = POOL_SEQ.incrementAndGet();
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "collate-plan-" + poolId + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
