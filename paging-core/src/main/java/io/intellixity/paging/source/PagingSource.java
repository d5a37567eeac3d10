package io.intellixity.paging.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Template-method base for paging sources.\n
 *
 * Responsibilities:\n
 * - Dispatch each {@link #load(LoadParams)} onto the configured {@link Executor}\n
 * - Short-circuit loads with {@link LoadResult.Invalid} once the source is invalidated\n
 * - Convert load failures into retryable {@link LoadResult.Error} results\n
 * - Run invalidation callbacks exactly once and resolve in-flight loads as invalid\n
 * - Interrupt the worker threads of loads that are cancelled or invalidated mid-flight\n
 *
 * A source is single-use: after {@link #invalidate()} it never loads again, and callers build a new one.
 */
public abstract class PagingSource<K, R> {
  private static final Logger log = LoggerFactory.getLogger(PagingSource.class);

  private final Executor executor;
  private final AtomicBoolean invalid = new AtomicBoolean();
  private final CopyOnWriteArrayList<Runnable> invalidatedCallbacks = new CopyOnWriteArrayList<>();
  private final Set<CompletableFuture<LoadResult<K, R>>> inFlight = ConcurrentHashMap.newKeySet();
  // guarded by itself
  private final Map<CompletableFuture<LoadResult<K, R>>, Thread> workers = new HashMap<>();
  private final Set<CompletableFuture<LoadResult<K, R>>> interrupted = new HashSet<>();

  protected PagingSource(Executor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /** Blocking load, invoked on the executor thread. Exceptions become {@link LoadResult.Error}. */
  protected abstract LoadResult<K, R> loadBlocking(LoadParams<K> params);

  /** Whether the consumer may jump to an arbitrary key with a refresh. */
  public abstract boolean jumpingSupported();

  /** Key to refresh from after invalidation, derived from what the consumer has loaded; may be null. */
  public abstract K getRefreshKey(PagingState<K, R> state);

  /**
   * True if this failure leaves the source unusable, in which case it is invalidated after the
   * failing load has completed with an error.
   */
  protected boolean invalidatesSession(RuntimeException failure) {
    return false;
  }

  /**
   * Load a page off the calling thread.\n
   *
   * The future completes with {@link LoadResult.Invalid} if the source is (or becomes) invalidated
   * before the load finishes. Cancelling the future, or invalidating the source, interrupts the thread
   * running the load. Blocking work that ignores interrupts (a JDBC driver waiting on the server, for
   * one) runs to completion, but its result is discarded.
   */
  public final CompletableFuture<LoadResult<K, R>> load(LoadParams<K> params) {
    Objects.requireNonNull(params, "params");
    if (isInvalid()) return CompletableFuture.completedFuture(LoadResult.invalid());

    CompletableFuture<LoadResult<K, R>> future = new CompletableFuture<>();
    inFlight.add(future);
    future.whenComplete((r, t) -> {
      inFlight.remove(future);
      if (future.isCancelled()) interruptWorker(future);
    });
    // invalidate() may have run between the check above and registration
    if (isInvalid()) future.complete(LoadResult.invalid());

    try {
      executor.execute(() -> runLoad(params, future));
    } catch (RejectedExecutionException e) {
      log.warn("paging.load_rejected source={} params={}", getClass().getSimpleName(), params, e);
      future.complete(LoadResult.error(e));
    }
    return future;
  }

  private void runLoad(LoadParams<K> params, CompletableFuture<LoadResult<K, R>> future) {
    if (future.isDone()) return;
    if (isInvalid()) {
      future.complete(LoadResult.invalid());
      return;
    }

    long start = System.nanoTime();
    LoadResult<K, R> result;
    boolean fatal = false;
    synchronized (workers) {
      workers.put(future, Thread.currentThread());
    }
    try {
      result = loadBlocking(params);
    } catch (RuntimeException e) {
      fatal = invalidatesSession(e);
      if (future.isDone()) {
        log.debug("paging.load_abandoned source={} params={} cause={}", getClass().getSimpleName(), params, e.toString());
      } else {
        log.warn("paging.load_failed source={} params={} fatal={}", getClass().getSimpleName(), params, fatal, e);
      }
      result = LoadResult.error(e);
    } finally {
      releaseWorker(future);
    }
    future.complete(result);
    if (log.isDebugEnabled()) {
      log.debug("paging.load_done source={} params={} durationMs={} result={}",
          getClass().getSimpleName(), params, (System.nanoTime() - start) / 1_000_000.0, describe(result));
    }
    if (fatal) invalidate();
  }

  /**
   * Mark this source invalid.\n
   *
   * Idempotent: callbacks run only on the first call. Loads still in flight complete with
   * {@link LoadResult.Invalid}.
   */
  public final void invalidate() {
    if (!invalid.compareAndSet(false, true)) return;
    log.debug("paging.invalidated source={} inFlight={}", getClass().getSimpleName(), inFlight.size());
    for (CompletableFuture<LoadResult<K, R>> f : inFlight) {
      f.complete(LoadResult.invalid());
      interruptWorker(f);
    }
    // remove() decides the single runner when registerInvalidatedCallback races with us
    for (Runnable callback : invalidatedCallbacks) {
      if (invalidatedCallbacks.remove(callback)) callback.run();
    }
  }

  public final boolean isInvalid() {
    return invalid.get();
  }

  /**
   * Register a callback run once when this source is invalidated.\n
   *
   * If the source is already invalid, the callback runs immediately on the calling thread.
   */
  public final void registerInvalidatedCallback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    invalidatedCallbacks.add(callback);
    if (isInvalid() && invalidatedCallbacks.remove(callback)) callback.run();
  }

  public final void unregisterInvalidatedCallback(Runnable callback) {
    invalidatedCallbacks.remove(callback);
  }

  private void interruptWorker(CompletableFuture<LoadResult<K, R>> future) {
    synchronized (workers) {
      Thread t = workers.get(future);
      // a load running on the invalidating thread itself sees the flag instead
      if (t == null || t == Thread.currentThread()) return;
      interrupted.add(future);
      t.interrupt();
    }
  }

  private void releaseWorker(CompletableFuture<LoadResult<K, R>> future) {
    boolean clear;
    synchronized (workers) {
      workers.remove(future);
      clear = interrupted.remove(future);
    }
    // the interrupt was meant for this load only, not for the next task on a pooled thread
    if (clear) Thread.interrupted();
  }

  private static String describe(LoadResult<?, ?> r) {
    if (r instanceof LoadResult.Page<?, ?> p) return "page(size=" + p.data().size() + ")";
    if (r instanceof LoadResult.Error<?, ?> e) return "error(" + e.cause().getClass().getSimpleName() + ")";
    return "invalid";
  }
}
