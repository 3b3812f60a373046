package io.intellixity.collate.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.collate.exec.ParallelPlanExecutor;
import io.intellixity.collate.exec.PlanExecutor;
import io.intellixity.collate.exec.SequentialPlanExecutor;

import javax.sql.DataSource;
import java.util.Objects;

/** Wiring from {@link JdbcProperties} to pooled engines and executors. */
public final class JdbcDataSources {
  private JdbcDataSources() {}

  /** Caller owns the pool and must close it. */
  public static HikariDataSource pooled(JdbcProperties props) {
    Objects.requireNonNull(props, "props");
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(props.url());
    hc.setUsername(props.username());
    hc.setPassword(props.password());
    hc.setMaximumPoolSize(props.maxPoolSize());
    hc.setPoolName("collate-pool");
    return new HikariDataSource(hc);
  }

  public static JdbcSqlEngine engine(String id, DataSource ds, JdbcProperties props) {
    return new JdbcSqlEngine(new JdbcHandle(id, ds, props.schema()));
  }

  /**
   * Parallel executor when {@code parallelism > 1}, sequential otherwise. The pool must hold at
   * least as many connections as workers.
   */
  public static PlanExecutor executor(JdbcSqlEngine engine, JdbcProperties props) {
    if (props.parallelism() > 1) return new ParallelPlanExecutor(engine, props.parallelism());
    return new SequentialPlanExecutor(engine);
  }
}
