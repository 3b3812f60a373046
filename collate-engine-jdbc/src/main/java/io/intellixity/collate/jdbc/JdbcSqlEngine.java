package io.intellixity.collate.jdbc;

import io.intellixity.collate.exec.AbstractSqlEngine;
import io.intellixity.collate.exec.SqlExecutionException;
import io.intellixity.collate.exec.SqlSession;
import io.intellixity.collate.exec.TxHandle;
import io.intellixity.collate.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link io.intellixity.collate.exec.SqlEngine} over a JDBC {@link DataSource}.\n
 *
 * Generated statements carry no bind parameters, so they run through plain {@link Statement}s.
 * Each transaction or session borrows its own connection.
 */
public final class JdbcSqlEngine extends AbstractSqlEngine {
  private static final Logger log = LoggerFactory.getLogger(JdbcSqlEngine.class);

  private final JdbcHandle handle;
  private final DataSource ds;

  public JdbcSqlEngine(JdbcHandle handle) {
    super(Objects.requireNonNull(handle, "handle").id());
    this.handle = handle;
    this.ds = handle.client();
  }

  public JdbcHandle handle() { return handle; }

  @Override
  protected TxHandle begin() {
    Connection c = connect();
    try {
      c.setAutoCommit(false);
      return new JdbcTx(c);
    } catch (SQLException e) {
      closeQuietly(c, e);
      throw new SqlExecutionException("Failed to begin transaction on " + id(), null, e);
    }
  }

  @Override
  protected void commit(TxHandle tx) {
    JdbcTx j = (JdbcTx) tx;
    try (Connection c = j.conn) {
      c.commit();
    } catch (SQLException e) {
      throw new SqlExecutionException("Commit failed on " + id(), null, e);
    }
  }

  @Override
  protected void rollback(TxHandle tx) {
    JdbcTx j = (JdbcTx) tx;
    try (Connection c = j.conn) {
      c.rollback();
    } catch (SQLException e) {
      throw new SqlExecutionException("Rollback failed on " + id(), null, e);
    }
  }

  @Override
  protected SqlSession open() {
    return new JdbcSession(connect());
  }

  @Override
  protected void release(SqlSession session) {
    try {
      ((JdbcSession) session).conn.close();
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to release connection on " + id(), null, e);
    }
  }

  private Connection connect() {
    try {
      return ds.getConnection();
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to obtain connection for " + id(), null, e);
    }
  }

  private static void closeQuietly(Connection c, SQLException primary) {
    try {
      c.close();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  private class JdbcSession implements SqlSession {
    final Connection conn;

    JdbcSession(Connection conn) {
      this.conn = conn;
    }

    @Override
    public long execute(SqlStatement ss) {
      long start = System.nanoTime();
      debugSql("EXECUTE", ss);
      try (Statement st = conn.createStatement()) {
        st.execute(ss.sql());
        long n = Math.max(0, st.getUpdateCount());
        debugDone("EXECUTE", ss, n, System.nanoTime() - start);
        return n;
      } catch (SQLException e) {
        throw failed(ss, e);
      }
    }

    @Override
    public Object queryOne(SqlStatement ss) {
      long start = System.nanoTime();
      debugSql("QUERY_ONE", ss);
      try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(ss.sql())) {
        Object v = rs.next() ? rs.getObject(1) : null;
        debugDone("QUERY_ONE", ss, v, System.nanoTime() - start);
        return v;
      } catch (SQLException e) {
        throw failed(ss, e);
      }
    }

    @Override
    public Map<String, Object> queryRow(SqlStatement ss) {
      long start = System.nanoTime();
      debugSql("QUERY_ROW", ss);
      try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(ss.sql())) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (rs.next()) {
          ResultSetMetaData md = rs.getMetaData();
          for (int i = 1; i <= md.getColumnCount(); i++) row.put(md.getColumnLabel(i), rs.getObject(i));
        }
        debugDone("QUERY_ROW", ss, row.size(), System.nanoTime() - start);
        return row;
      } catch (SQLException e) {
        throw failed(ss, e);
      }
    }
  }

  private final class JdbcTx extends JdbcSession implements TxHandle {
    JdbcTx(Connection conn) {
      super(conn);
    }
  }

  private SqlExecutionException failed(SqlStatement ss, SQLException e) {
    return new SqlExecutionException("Statement failed on " + id() + " (SQLState " + e.getSQLState() + "): "
        + e.getMessage(), ss.sql(), e);
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("collate.jdbc op={} kind={} handleId={} schema={} sql={}",
        op, ss.kind(), handle.id(), handle.schema(), ss.sql());
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("collate.jdbc_done op={} kind={} durationMs={} result={}",
        op, ss.kind(), durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number || r instanceof Boolean) return String.valueOf(r);
    if (r instanceof CharSequence cs) return "len=" + cs.length();
    return r.getClass().getSimpleName();
  }
}
