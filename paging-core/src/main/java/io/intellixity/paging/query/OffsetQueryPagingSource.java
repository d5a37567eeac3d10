package io.intellixity.paging.query;

import io.intellixity.paging.exec.Transacter;
import io.intellixity.paging.source.LoadParams;
import io.intellixity.paging.source.LoadResult;
import io.intellixity.paging.source.PagingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Offset/limit paging.\n
 *
 * Every load re-runs {@code countQuery} so offsets are validated against the current dataset size;
 * jumping to any offset is supported.\n
 *
 * Keys are row offsets:\n
 * - refresh and append keys are the offset the page starts at\n
 * - a prepend key is the offset the already loaded rows start at; the prepend returns the
 *   {@code loadSize} rows right before it (fewer near the start)\n
 *
 * A page's {@code prevKey} is therefore its own start offset, so a prepend always ends exactly where
 * the page it extends begins, whatever size that page was loaded with.
 */
public final class OffsetQueryPagingSource<R> extends QueryPagingSource<Long, R> {
  private static final Logger log = LoggerFactory.getLogger(OffsetQueryPagingSource.class);

  private final OffsetQueryProvider<R> queryProvider;
  private final Query<Long> countQuery;
  private final long initialOffset;

  public OffsetQueryPagingSource(OffsetQueryProvider<R> queryProvider,
                                 Query<Long> countQuery,
                                 Transacter transacter,
                                 Executor executor,
                                 long initialOffset) {
    super(transacter, executor);
    this.queryProvider = Objects.requireNonNull(queryProvider, "queryProvider");
    this.countQuery = Objects.requireNonNull(countQuery, "countQuery");
    if (initialOffset < 0) throw new IllegalArgumentException("initialOffset must be >= 0");
    this.initialOffset = initialOffset;
  }

  @Override
  protected LoadResult<Long, R> loadInTransaction(LoadParams<Long> params) {
    int loadSize = params.loadSize();
    long requested = (params.key() == null) ? initialOffset : params.key();

    // observed from here on, so a change that lands while counting still invalidates the session
    if (!setCurrentQuery(countQuery)) return LoadResult.invalid();
    Long count = countQuery.executeAsOne();
    long totalRows = Math.max(count, 0L);

    long offset;
    long limit;
    if (params instanceof LoadParams.Prepend) {
      // the key is where the already loaded rows start: load the rows right before it
      long end = Math.min(Math.max(requested, 0L), totalRows);
      offset = Math.max(end - loadSize, 0L);
      limit = end - offset;
    } else {
      offset = clampOffset(requested, loadSize, totalRows);
      limit = Math.min(loadSize, totalRows - offset);
    }

    if (log.isDebugEnabled()) {
      log.debug("paging.offset_page type={} requested={} loadSize={} totalRows={} offset={} limit={}",
          params.getClass().getSimpleName(), requested, loadSize, totalRows, offset, limit);
    }

    if (limit <= 0) {
      // nothing to page; the count stays observed so the first insert still invalidates the session
      return new LoadResult.Page<>(List.of(), null, null, saturatedInt(offset), saturatedInt(Math.max(totalRows - offset, 0L)));
    }

    Query<R> query = queryProvider.provide(limit, offset);
    if (!setCurrentQuery(query)) return LoadResult.invalid();
    List<R> rows = query.executeAsList();

    long end = offset + rows.size();
    Long prevKey = (offset > 0) ? offset : null;
    Long nextKey = (end < totalRows) ? end : null;
    return new LoadResult.Page<>(rows, prevKey, nextKey, saturatedInt(offset), saturatedInt(Math.max(totalRows - end, 0L)));
  }

  @Override
  public boolean jumpingSupported() {
    return true;
  }

  @Override
  public Long getRefreshKey(PagingState<Long, R> state) {
    Integer anchor = state.anchorPosition();
    if (anchor == null) return null;
    return Math.max(0L, anchor - (state.config().initialLoadSize() / 2L));
  }

  /**
   * Start offset for a request against a dataset of {@code totalRows} rows.\n
   *
   * Offsets inside the dataset are kept; offsets at or past its end (a jump, or an append into a
   * dataset that shrank) land on the last full page.
   */
  static long clampOffset(long requested, int pageSize, long totalRows) {
    if (requested >= totalRows) return Math.max(totalRows - pageSize, 0L);
    return Math.max(requested, 0L);
  }

  private static int saturatedInt(long v) {
    return (int) Math.min(v, Integer.MAX_VALUE);
  }
}
