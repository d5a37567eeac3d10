package io.intellixity.paging.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL with named parameters (e.g. {@code :limit}) and the values bound to them, in appearance order.\n
 *
 * Values may be null.
 */
public record SqlStatement(String sql, List<Object> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (used for SELECT/COUNT). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate(). */
    UPDATE
  }

  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is blank");
    // List.copyOf rejects null values
    binds = binds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
