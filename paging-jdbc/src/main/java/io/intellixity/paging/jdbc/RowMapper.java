package io.intellixity.paging.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;

/** Maps the current row of a {@link ResultSet}; must not advance the cursor. */
@FunctionalInterface
public interface RowMapper<R> {
  R map(ResultSet rs) throws SQLException;

  /** First column as a long (COUNT(*) and numeric keys). */
  static RowMapper<Long> firstLong() {
    return rs -> rs.getLong(1);
  }

  /** Named column read through {@link ResultSet#getObject(String, Class)}. */
  static <T> RowMapper<T> column(String label, Class<T> type) {
    return rs -> rs.getObject(label, type);
  }
}
