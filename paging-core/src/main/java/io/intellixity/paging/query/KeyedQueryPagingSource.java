package io.intellixity.paging.query;

import io.intellixity.paging.exec.Transacter;
import io.intellixity.paging.source.LoadParams;
import io.intellixity.paging.source.LoadResult;
import io.intellixity.paging.source.PagingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keyset paging.\n
 *
 * Keys are values of a unique, ordered column. The first load computes the {@link PageBoundaries} of
 * the whole dataset once; every page is then the key range between two consecutive boundaries.
 * Jumping is not supported: a refresh may only anchor at a key, and the boundaries are never
 * recomputed within a session.\n
 *
 * The boundaries are computed with the size of the first load, so every later load must use the same
 * size (keep {@code initialLoadSize == pageSize}); a load with a different size fails with
 * {@link IllegalArgumentException}.
 */
public final class KeyedQueryPagingSource<K, R> extends QueryPagingSource<K, R> {
  private static final Logger log = LoggerFactory.getLogger(KeyedQueryPagingSource.class);

  enum BoundariesState { UNINITIALIZED, COMPUTING, READY, FAILED }

  private final KeyedQueryProvider<K, R> queryProvider;
  private final PageBoundariesProvider<K> boundariesProvider;
  private final Comparator<? super K> comparator;
  private final AtomicReference<CompletableFuture<PageBoundaries<K>>> boundaries = new AtomicReference<>();
  private volatile Query<K> boundariesQuery;

  public KeyedQueryPagingSource(KeyedQueryProvider<K, R> queryProvider,
                                PageBoundariesProvider<K> boundariesProvider,
                                Comparator<? super K> comparator,
                                Transacter transacter,
                                Executor executor) {
    super(transacter, executor);
    this.queryProvider = Objects.requireNonNull(queryProvider, "queryProvider");
    this.boundariesProvider = Objects.requireNonNull(boundariesProvider, "boundariesProvider");
    this.comparator = Objects.requireNonNull(comparator, "comparator");
  }

  @Override
  protected LoadResult<K, R> loadInTransaction(LoadParams<K> params) {
    PageBoundaries<K> pages = awaitBoundaries(params);
    if (pages == null) return LoadResult.invalid();
    if (params.loadSize() != pages.pageSize()) {
      throw new IllegalArgumentException("loadSize=" + params.loadSize() + " differs from the page size the boundaries were computed with ("
          + pages.pageSize() + "); keyset paging needs initialLoadSize == pageSize");
    }

    if (pages.isEmpty()) {
      // empty dataset: observe the boundaries so the first insert still invalidates the session
      if (!setCurrentQuery(boundariesQuery)) return LoadResult.invalid();
      return LoadResult.page(List.of(), null, null);
    }

    int index = (params.key() == null) ? 0 : pages.indexOfPageContaining(params.key());
    K beginInclusive = pages.keyAt(index);
    K endExclusive = pages.keyAt(index + 1);
    K prevKey = pages.keyAt(index - 1);

    if (log.isDebugEnabled()) {
      log.debug("paging.keyed_page type={} key={} pageIndex={} pages={} begin={} end={}",
          params.getClass().getSimpleName(), params.key(), index, pages.size(), beginInclusive, endExclusive);
    }

    Query<R> query = queryProvider.provide(beginInclusive, endExclusive);
    if (!setCurrentQuery(query)) return LoadResult.invalid();
    List<R> rows = query.executeAsList();
    return LoadResult.page(rows, prevKey, endExclusive);
  }

  /**
   * The session's boundaries, computing them on first use.\n
   *
   * Exactly one caller computes; concurrent first loads wait for it. Returns null if that computation
   * failed (the computing load reports the error and the session is invalidated) or the session was
   * invalidated before it started.
   */
  private PageBoundaries<K> awaitBoundaries(LoadParams<K> params) {
    CompletableFuture<PageBoundaries<K>> existing = boundaries.get();
    if (existing == null) {
      CompletableFuture<PageBoundaries<K>> mine = new CompletableFuture<>();
      if (boundaries.compareAndSet(null, mine)) return computeBoundaries(params, mine);
      existing = boundaries.get();
    }
    try {
      return existing.join();
    } catch (CompletionException | CancellationException e) {
      return null;
    }
  }

  private PageBoundaries<K> computeBoundaries(LoadParams<K> params, CompletableFuture<PageBoundaries<K>> target) {
    try {
      Query<K> query = boundariesProvider.provide(params.key(), params.loadSize());
      boundariesQuery = query;
      // observed before it runs: boundaries are cached for the session, so a change missed here is never seen
      if (!setCurrentQuery(query)) {
        target.cancel(false);
        return null;
      }
      PageBoundaries<K> pages = new PageBoundaries<>(query.executeAsList(), comparator, params.loadSize());
      target.complete(pages);
      log.debug("paging.boundaries_ready anchor={} pageSize={} pages={}", params.key(), params.loadSize(), pages.size());
      return pages;
    } catch (RuntimeException e) {
      PageBoundariesException failure = new PageBoundariesException("Failed to compute page boundaries", e);
      target.completeExceptionally(failure);
      throw failure;
    }
  }

  @Override
  protected boolean invalidatesSession(RuntimeException failure) {
    return failure instanceof PageBoundariesException;
  }

  @Override
  public boolean jumpingSupported() {
    return false;
  }

  /** Start of the last loaded page, located through its neighbours' keys. */
  @Override
  public K getRefreshKey(PagingState<K, R> state) {
    PageBoundaries<K> pages = readyBoundariesOrNull();
    if (pages == null) return null;
    LoadResult.Page<K, R> last = state.lastPageOrNull();
    if (last == null) return null;
    if (last.nextKey() != null) {
      int next = pages.indexOf(last.nextKey());
      if (next > 0) return pages.keyAt(next - 1);
    }
    if (last.prevKey() != null) {
      int prev = pages.indexOf(last.prevKey());
      if (prev >= 0) return pages.keyAt(prev + 1);
    }
    return null;
  }

  BoundariesState boundariesState() {
    CompletableFuture<PageBoundaries<K>> f = boundaries.get();
    if (f == null) return BoundariesState.UNINITIALIZED;
    if (!f.isDone()) return BoundariesState.COMPUTING;
    return f.isCompletedExceptionally() ? BoundariesState.FAILED : BoundariesState.READY;
  }

  /** Boundaries of this session, or null until they have been computed. */
  public PageBoundaries<K> readyBoundariesOrNull() {
    CompletableFuture<PageBoundaries<K>> f = boundaries.get();
    if (f == null || !f.isDone() || f.isCompletedExceptionally()) return null;
    return f.join();
  }
}
