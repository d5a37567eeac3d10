package io.intellixity.paging.jdbc.postgres;

import io.intellixity.paging.jdbc.JdbcDriver;
import io.intellixity.paging.jdbc.JdbcQuery;
import io.intellixity.paging.jdbc.RowMapper;
import io.intellixity.paging.query.KeyedQueryProvider;
import io.intellixity.paging.query.OffsetQueryProvider;
import io.intellixity.paging.query.PageBoundariesProvider;
import io.intellixity.paging.query.Query;
import io.intellixity.paging.query.QueryPagingSources;
import io.intellixity.paging.source.PagingSource;

import java.util.Comparator;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Wires {@link PostgresPagingQueries} into paging sources over a {@link JdbcDriver}.\n
 *
 * Every query observes the paged table, so a write the driver reports against it invalidates the
 * session. The driver is also the transacter: each load runs in one transaction.
 */
public final class PostgresPagingSources {
  private PostgresPagingSources() {}

  public static Query<Long> countQuery(JdbcDriver driver, PostgresPagingQueries queries) {
    return driver.query(queries.countSql(), RowMapper.firstLong(), tables(queries));
  }

  public static <R> OffsetQueryProvider<R> offsetRows(JdbcDriver driver, PostgresPagingQueries queries, RowMapper<R> rowMapper) {
    JdbcQuery<R> page = driver.query(queries.offsetPageSql(), rowMapper, tables(queries));
    return (limit, offset) -> page.withParam("limit", limit).withParam("offset", offset);
  }

  /** The anchor is not turned into an extra boundary; the anchored page is the one containing it. */
  public static <K> PageBoundariesProvider<K> boundaries(JdbcDriver driver, PostgresPagingQueries queries, RowMapper<K> keyMapper) {
    JdbcQuery<K> q = driver.query(queries.pageBoundariesSql(), keyMapper, tables(queries));
    return (anchor, limit) -> q.withParam("limit", limit);
  }

  public static <K, R> KeyedQueryProvider<K, R> keyedRows(JdbcDriver driver, PostgresPagingQueries queries, RowMapper<R> rowMapper) {
    JdbcQuery<R> page = driver.query(queries.keyedPageSql(), rowMapper, tables(queries));
    return (beginInclusive, endExclusive) -> page.withParam("beginInclusive", beginInclusive).withParam("endExclusive", endExclusive);
  }

  public static <R> PagingSource<Long, R> offset(JdbcDriver driver,
                                                 PostgresPagingQueries queries,
                                                 RowMapper<R> rowMapper,
                                                 Executor executor) {
    return QueryPagingSources.offset(countQuery(driver, queries), driver, executor, offsetRows(driver, queries, rowMapper));
  }

  /** Keyset paging; descending queries get a reversed key order. */
  public static <K extends Comparable<? super K>, R> PagingSource<K, R> keyed(JdbcDriver driver,
                                                                            PostgresPagingQueries queries,
                                                                            RowMapper<K> keyMapper,
                                                                            RowMapper<R> rowMapper,
                                                                            Executor executor) {
    Comparator<K> natural = Comparator.naturalOrder();
    Comparator<K> order = queries.descending() ? natural.reversed() : natural;
    return QueryPagingSources.keyed(driver, executor, order,
        boundaries(driver, queries, keyMapper), keyedRows(driver, queries, rowMapper));
  }

  private static Set<String> tables(PostgresPagingQueries queries) {
    return Set.of(queries.table());
  }
}
