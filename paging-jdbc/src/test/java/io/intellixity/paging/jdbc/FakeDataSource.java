package io.intellixity.paging.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mockito-backed DataSource that records JDBC traffic.\n
 *
 * Queries answer with rows from {@link #rows}, keyed by JDBC SQL (default: no rows). Updates report one
 * affected row. Set {@link #failOn} to make statements containing that text throw SQLException.
 */
final class FakeDataSource {
  record Executed(int connection, String sql, List<Object> binds) {}

  final List<Executed> executed = Collections.synchronizedList(new ArrayList<>());
  final List<String> events = Collections.synchronizedList(new ArrayList<>());
  final Map<String, Function<List<Object>, List<Object[]>>> rows = new ConcurrentHashMap<>();
  final AtomicInteger connections = new AtomicInteger();
  volatile String failOn;

  final DataSource dataSource = mock(DataSource.class);

  FakeDataSource() {
    try {
      when(dataSource.getConnection()).thenAnswer(inv -> connection(connections.incrementAndGet()));
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  void answer(String jdbcSql, Object[]... result) {
    rows.put(jdbcSql, binds -> List.of(result));
  }

  int count(String event) {
    synchronized (events) {
      return (int) events.stream().filter(event::equals).count();
    }
  }

  private Connection connection(int id) throws SQLException {
    events.add("open#" + id);
    Connection c = mock(Connection.class);
    when(c.prepareStatement(anyString())).thenAnswer(inv -> statement(id, inv.getArgument(0)));
    doAnswer(inv -> events.add("autoCommit#" + id + "=" + inv.getArgument(0))).when(c).setAutoCommit(anyBoolean());
    doAnswer(inv -> events.add("commit#" + id)).when(c).commit();
    doAnswer(inv -> events.add("rollback#" + id)).when(c).rollback();
    doAnswer(inv -> events.add("close#" + id)).when(c).close();
    return c;
  }

  private PreparedStatement statement(int connection, String sql) throws SQLException {
    List<Object> binds = new ArrayList<>();
    PreparedStatement ps = mock(PreparedStatement.class);
    doAnswer(inv -> {
      int index = inv.getArgument(0);
      while (binds.size() < index) binds.add(null);
      return binds.set(index - 1, inv.getArgument(1));
    }).when(ps).setObject(anyInt(), any());
    when(ps.executeQuery()).thenAnswer(inv -> {
      capture(connection, sql, binds);
      return resultSet(rows.getOrDefault(sql, b -> List.of()).apply(binds));
    });
    when(ps.executeUpdate()).thenAnswer(inv -> {
      capture(connection, sql, binds);
      return 1;
    });
    return ps;
  }

  private void capture(int connection, String sql, List<Object> binds) throws SQLException {
    String f = failOn;
    if (f != null && sql.contains(f)) throw new SQLException("simulated failure: " + f);
    executed.add(new Executed(connection, sql, Collections.unmodifiableList(new ArrayList<>(binds))));
  }

  private static ResultSet resultSet(List<Object[]> data) throws SQLException {
    int[] cursor = {-1};
    ResultSet rs = mock(ResultSet.class);
    when(rs.next()).thenAnswer(inv -> ++cursor[0] < data.size());
    when(rs.getLong(anyInt())).thenAnswer(inv -> ((Number) cell(data, cursor[0], inv.getArgument(0))).longValue());
    when(rs.getString(anyInt())).thenAnswer(inv -> String.valueOf(cell(data, cursor[0], inv.getArgument(0))));
    when(rs.getObject(anyInt())).thenAnswer(inv -> cell(data, cursor[0], inv.getArgument(0)));
    return rs;
  }

  private static Object cell(List<Object[]> data, int row, int column) {
    return data.get(row)[column - 1];
  }
}
