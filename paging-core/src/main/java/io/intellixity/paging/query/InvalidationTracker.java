package io.intellixity.paging.query;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sole change listener of a paging session's current query.\n
 *
 * The first change notification runs the invalidation callback; later notifications are ignored.
 * The owner serializes {@link #track(Query)} and {@link #detach()}; {@link #queryResultsChanged()}
 * may arrive from any thread.
 */
final class InvalidationTracker implements Query.Listener {
  private final Runnable onInvalidated;
  private final AtomicBoolean fired = new AtomicBoolean();
  private Query<?> query;

  InvalidationTracker(Runnable onInvalidated) {
    this.onInvalidated = Objects.requireNonNull(onInvalidated, "onInvalidated");
  }

  /** Detach from the current query (if any), then attach to {@code next}. */
  void track(Query<?> next) {
    if (query == next) return;
    if (query != null) query.removeListener(this);
    query = next;
    if (next != null) next.addListener(this);
  }

  void detach() {
    track(null);
  }

  Query<?> current() {
    return query;
  }

  boolean fired() {
    return fired.get();
  }

  @Override
  public void queryResultsChanged() {
    if (fired.compareAndSet(false, true)) onInvalidated.run();
  }
}
