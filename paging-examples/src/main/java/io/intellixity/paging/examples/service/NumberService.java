package io.intellixity.paging.examples.service;

import io.intellixity.paging.jdbc.JdbcDriver;
import io.intellixity.paging.jdbc.SqlParamCompiler;
import io.intellixity.paging.jdbc.SqlStatement;
import io.intellixity.paging.jdbc.postgres.PostgresPagingQueries;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** Writes to the numbers table; every write invalidates the sessions paging over it. */
@Service
public final class NumberService {
  private final JdbcDriver driver;
  private final String insertSql;
  private final Set<String> tables;

  public NumberService(JdbcDriver driver, PostgresPagingQueries queries) {
    this.driver = driver;
    String schema = driver.handle().schema();
    String table = (schema == null) ? quote(queries.table()) : quote(schema) + "." + quote(queries.table());
    this.insertSql = "INSERT INTO " + table + " (" + quote(queries.keyColumn()) + ") VALUES (:value) ON CONFLICT DO NOTHING";
    this.tables = Set.of(queries.table());
  }

  /** @return number of rows inserted (duplicates are skipped) */
  public long insertAll(List<Long> values) {
    return driver.inTx(() -> {
      long n = 0;
      for (Long v : values) {
        n += driver.execute(SqlParamCompiler.compile(insertSql, Map.of("value", v), SqlStatement.ExecKind.UPDATE), tables);
      }
      return n;
    });
  }

  private static String quote(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
