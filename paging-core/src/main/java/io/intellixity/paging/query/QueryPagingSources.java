package io.intellixity.paging.query;

import io.intellixity.paging.exec.PagingExecutors;
import io.intellixity.paging.exec.Transacter;
import io.intellixity.paging.source.PagingSource;

import java.util.Comparator;
import java.util.concurrent.Executor;

/**
 * Factories for query-backed paging sources.\n
 *
 * Loads run on {@link PagingExecutors#io()} unless an executor is given.
 */
public final class QueryPagingSources {
  private QueryPagingSources() {}

  /**
   * Offset paging: {@code queryProvider} receives {@code (limit, offset)} and should page with SQL
   * LIMIT/OFFSET; {@code countQuery} returns the total number of rows.
   */
  public static <R> PagingSource<Long, R> offset(Query<Long> countQuery, OffsetQueryProvider<R> queryProvider) {
    return offset(countQuery, Transacter.NONE, PagingExecutors.io(), queryProvider);
  }

  public static <R> PagingSource<Long, R> offset(Query<Long> countQuery,
                                                 Transacter transacter,
                                                 Executor executor,
                                                 OffsetQueryProvider<R> queryProvider) {
    return new OffsetQueryPagingSource<>(queryProvider, countQuery, transacter, executor, 0L);
  }

  /** Offset paging whose keyless refresh starts at {@code initialOffset}. */
  public static <R> PagingSource<Long, R> offset(Query<Long> countQuery,
                                                 Transacter transacter,
                                                 Executor executor,
                                                 long initialOffset,
                                                 OffsetQueryProvider<R> queryProvider) {
    return new OffsetQueryPagingSource<>(queryProvider, countQuery, transacter, executor, initialOffset);
  }

  /**
   * Keyset paging over naturally ordered keys (ascending).\n
   *
   * Rows must be ordered by a unique key, ideally indexed. {@code boundariesProvider} is called once,
   * on the first load, and must list the first key of every page; {@code queryProvider} receives a
   * {@code [beginInclusive, endExclusive)} key range, with a null end for the last page.
   */
  public static <K extends Comparable<? super K>, R> PagingSource<K, R> keyed(Transacter transacter,
                                                                             PageBoundariesProvider<K> boundariesProvider,
                                                                             KeyedQueryProvider<K, R> queryProvider) {
    return keyed(transacter, PagingExecutors.io(), Comparator.naturalOrder(), boundariesProvider, queryProvider);
  }

  /** Keyset paging with an explicit key order (use a reversed comparator for descending sorts). */
  public static <K, R> PagingSource<K, R> keyed(Transacter transacter,
                                                Executor executor,
                                                Comparator<? super K> keyOrder,
                                                PageBoundariesProvider<K> boundariesProvider,
                                                KeyedQueryProvider<K, R> queryProvider) {
    return new KeyedQueryPagingSource<>(queryProvider, boundariesProvider, keyOrder, transacter, executor);
  }
}
