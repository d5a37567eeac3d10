package io.intellixity.paging.jdbc;

import io.intellixity.paging.exec.Propagation;
import io.intellixity.paging.exec.Transacter;
import io.intellixity.paging.query.Query;
import io.intellixity.paging.query.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * DataSource-backed query execution with table-keyed change notification.\n
 *
 * Responsibilities:\n
 * - Execute {@link SqlStatement}s, on the current transaction's connection when there is one\n
 * - Transaction scoping via {@link #inTx(Propagation, Supplier)}\n
 * - Notify {@link Query.Listener}s registered on the tables a write declares as affected\n
 *
 * Notifications for writes made inside a transaction are deferred until it commits and dropped if it
 * rolls back. Listeners are always invoked outside any connection or registry lock.
 */
public final class JdbcDriver implements Transacter {
  private static final Logger log = LoggerFactory.getLogger(JdbcDriver.class);

  private final JdbcHandle handle;
  private final DataSource ds;
  private final Propagation defaultPropagation;
  private final ThreadLocal<Tx> currentTx = new ThreadLocal<>();
  private final Map<String, Set<Query.Listener>> listeners = new ConcurrentHashMap<>();

  /** Open transaction bound to the calling thread. */
  private static final class Tx {
    final Connection conn;
    final Set<String> changedTables = new LinkedHashSet<>();

    Tx(Connection conn) {
      this.conn = conn;
    }
  }

  public JdbcDriver(JdbcHandle handle, Propagation defaultPropagation) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.ds = handle.client();
    this.defaultPropagation = Objects.requireNonNull(defaultPropagation, "defaultPropagation");
  }

  public JdbcDriver(JdbcHandle handle) {
    this(handle, Propagation.REQUIRED);
  }

  public JdbcHandle handle() { return handle; }

  @Override
  public Propagation defaultPropagation() {
    return defaultPropagation;
  }

  public boolean inTransaction() {
    return currentTx.get() != null;
  }

  @Override
  public <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    Tx existing = currentTx.get();
    return switch (propagation) {
      case REQUIRED -> (existing != null) ? work.get() : runInNewTx(work);
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (existing == null) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case REQUIRES_NEW -> runInNewTx(work);
      case NEVER -> {
        if (existing != null) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.get();
      }
      // no savepoints: joins the outer transaction
      case NESTED -> (existing != null) ? work.get() : runInNewTx(work);
    };
  }

  private <T> T runInNewTx(Supplier<T> work) {
    Tx outer = currentTx.get();
    Tx tx = begin();
    currentTx.set(tx);
    T result;
    try {
      result = work.get();
    } catch (RuntimeException | Error t) {
      rollbackQuietly(tx, t);
      throw t;
    } finally {
      restore(outer);
    }
    commit(tx);
    if (!tx.changedTables.isEmpty()) notifyListeners(tx.changedTables);
    return result;
  }

  private void restore(Tx outer) {
    if (outer == null) currentTx.remove();
    else currentTx.set(outer);
  }

  private Tx begin() {
    try {
      Connection c = ds.getConnection();
      c.setAutoCommit(false);
      log.debug("paging.jdbc_tx op=begin handleId={}", handle.id());
      return new Tx(c);
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to begin transaction: handleId=" + handle.id(), e);
    }
  }

  private void commit(Tx tx) {
    try (Connection c = tx.conn) {
      c.commit();
      log.debug("paging.jdbc_tx op=commit handleId={} changedTables={}", handle.id(), tx.changedTables);
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to commit transaction: handleId=" + handle.id(), e);
    }
  }

  private void rollbackQuietly(Tx tx, Throwable cause) {
    try (Connection c = tx.conn) {
      c.rollback();
      log.debug("paging.jdbc_tx op=rollback handleId={} droppedTables={}", handle.id(), tx.changedTables);
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  /** Run a SELECT and map every row. */
  public <R> List<R> executeQuery(SqlStatement ss, RowMapper<R> mapper) {
    Objects.requireNonNull(ss, "ss");
    Objects.requireNonNull(mapper, "mapper");
    Tx tx = currentTx.get();
    try {
      Connection c = (tx == null) ? ds.getConnection() : tx.conn;
      try {
        String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
        long start = System.nanoTime();
        debugSql("SELECT", ss, jdbcSql);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          try (ResultSet rs = ps.executeQuery()) {
            List<R> out = new ArrayList<>();
            while (rs.next()) out.add(mapper.map(rs));
            debugDone("SELECT", ss, out.size(), System.nanoTime() - start);
            return out;
          }
        }
      } finally {
        if (tx == null) c.close();
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("JDBC query failed: handleId=" + handle.id() + " sql=" + ss.sql(), e);
    }
  }

  /**
   * Run a write and report it as a change to {@code affectedTables}.\n
   *
   * @return the update count
   */
  public long execute(SqlStatement ss, Collection<String> affectedTables) {
    Objects.requireNonNull(ss, "ss");
    Objects.requireNonNull(affectedTables, "affectedTables");
    Tx tx = currentTx.get();
    long n;
    try {
      Connection c = (tx == null) ? ds.getConnection() : tx.conn;
      try {
        String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
        long start = System.nanoTime();
        debugSql("UPDATE", ss, jdbcSql);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          n = ps.executeUpdate();
          debugDone("UPDATE", ss, n, System.nanoTime() - start);
        }
      } finally {
        if (tx == null) c.close();
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("JDBC update failed: handleId=" + handle.id() + " sql=" + ss.sql(), e);
    }

    if (tx != null) tx.changedTables.addAll(affectedTables);
    else notifyListeners(affectedTables);
    return n;
  }

  /** Observable query over this driver; {@code tables} are the tables its result is derived from. */
  public <R> JdbcQuery<R> query(String sql, RowMapper<R> mapper, Collection<String> tables) {
    return new JdbcQuery<>(this, sql, Map.of(), mapper, tables);
  }

  public void addListener(Collection<String> tables, Query.Listener listener) {
    Objects.requireNonNull(listener, "listener");
    for (String t : tables) {
      listeners.computeIfAbsent(t, k -> ConcurrentHashMap.newKeySet()).add(listener);
    }
  }

  public void removeListener(Collection<String> tables, Query.Listener listener) {
    Objects.requireNonNull(listener, "listener");
    for (String t : tables) {
      Set<Query.Listener> set = listeners.get(t);
      if (set != null) set.remove(listener);
    }
  }

  /** Tell every listener of {@code tables} that their data changed; each listener is called once. */
  public void notifyListeners(Collection<String> tables) {
    Set<Query.Listener> snapshot = new LinkedHashSet<>();
    for (String t : tables) {
      Set<Query.Listener> set = listeners.get(t);
      if (set != null) snapshot.addAll(set);
    }
    if (snapshot.isEmpty()) return;
    log.debug("paging.jdbc_notify handleId={} tables={} listeners={}", handle.id(), tables, snapshot.size());
    for (Query.Listener l : snapshot) l.queryResultsChanged();
  }

  int listenerCount(String table) {
    Set<Query.Listener> set = listeners.get(table);
    return set == null ? 0 : set.size();
  }

  private static void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    for (int i = 0; i < stmt.binds().size(); i++) {
      ps.setObject(i + 1, stmt.binds().get(i));
    }
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("paging.jdbc op={} execKind={} bindCount={} inTx={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.binds().size(), inTransaction(), handle.id(), handle.schema(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("paging.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("paging.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
