package io.intellixity.paging.jdbc;

import io.intellixity.paging.query.Query;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link Query} over named-parameter SQL executed by a {@link JdbcDriver}.\n
 *
 * Immutable: {@link #withParam(String, Object)} returns a copy. Listeners are registered on every
 * table in {@link #tables()}, so any write the driver reports against one of them notifies them.
 */
public final class JdbcQuery<R> implements Query<R> {
  private final JdbcDriver driver;
  private final String sql;
  private final Map<String, Object> params;
  private final RowMapper<R> mapper;
  private final Set<String> tables;

  JdbcQuery(JdbcDriver driver, String sql, Map<String, ?> params, RowMapper<R> mapper, Collection<String> tables) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.sql = Objects.requireNonNull(sql, "sql");
    this.params = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(Objects.requireNonNull(params, "params")));
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.tables = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(tables, "tables")));
    if (this.tables.isEmpty()) throw new IllegalArgumentException("query must read at least one table");
  }

  /** Copy of this query with {@code name} bound to {@code value} (null allowed). */
  public JdbcQuery<R> withParam(String name, Object value) {
    Objects.requireNonNull(name, "name");
    Map<String, Object> next = new LinkedHashMap<>(params);
    next.put(name, value);
    return new JdbcQuery<>(driver, sql, next, mapper, tables);
  }

  public String sql() { return sql; }
  public Map<String, Object> params() { return params; }
  public Set<String> tables() { return tables; }

  @Override
  public List<R> executeAsList() {
    return driver.executeQuery(SqlParamCompiler.compile(sql, params), mapper);
  }

  @Override
  public void addListener(Listener listener) {
    driver.addListener(tables, listener);
  }

  @Override
  public void removeListener(Listener listener) {
    driver.removeListener(tables, listener);
  }

  @Override
  public String toString() {
    return "JdbcQuery[tables=" + tables + ", params=" + params.keySet() + ", sql=" + sql + "]";
  }
}
