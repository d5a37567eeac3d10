package io.intellixity.paging.query;

import io.intellixity.paging.exec.Transacter;
import io.intellixity.paging.source.LoadParams;
import io.intellixity.paging.source.LoadResult;
import io.intellixity.paging.source.PagingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Paging session over observable {@link Query queries}.\n
 *
 * Owns the session's current query: every page query becomes current before it executes, so a change
 * that lands while the page is read still invalidates the session. A change to the current query's
 * data invalidates the source; invalidation detaches the listener and clears the reference.\n
 *
 * The current query and the invalidated flag are only touched under {@code lock}; the lock is never
 * held while a query executes.
 */
public abstract class QueryPagingSource<K, R> extends PagingSource<K, R> {
  private static final Logger log = LoggerFactory.getLogger(QueryPagingSource.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final InvalidationTracker tracker;
  private final Transacter transacter;

  protected QueryPagingSource(Transacter transacter, Executor executor) {
    super(executor);
    this.transacter = Objects.requireNonNull(transacter, "transacter");
    this.tracker = new InvalidationTracker(this::onQueryResultsChanged);
    registerInvalidatedCallback(this::clearCurrentQuery);
  }

  /** Compute the page; runs inside {@link Transacter#inTx(java.util.function.Supplier)}. */
  protected abstract LoadResult<K, R> loadInTransaction(LoadParams<K> params);

  @Override
  protected final LoadResult<K, R> loadBlocking(LoadParams<K> params) {
    LoadResult<K, R> result = transacter.inTx(() -> loadInTransaction(params));
    // a change may have been reported while the page was read
    return isInvalid() ? LoadResult.invalid() : result;
  }

  /**
   * Make {@code query} the session's current query: detach the old one and attach the new one as a
   * single step.\n
   *
   * @return false if the session is already invalid, in which case nothing is attached and the
   *     caller must not execute the query
   */
  protected final boolean setCurrentQuery(Query<?> query) {
    Objects.requireNonNull(query, "query");
    lock.lock();
    try {
      if (isInvalid()) return false;
      tracker.track(query);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** The query currently observed for changes, or null. */
  public final Query<?> currentQuery() {
    lock.lock();
    try {
      return tracker.current();
    } finally {
      lock.unlock();
    }
  }

  protected final Transacter transacter() { return transacter; }

  private void onQueryResultsChanged() {
    log.debug("paging.query_changed source={}", getClass().getSimpleName());
    invalidate();
  }

  private void clearCurrentQuery() {
    lock.lock();
    try {
      tracker.detach();
    } finally {
      lock.unlock();
    }
  }
}
