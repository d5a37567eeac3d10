package io.intellixity.paging.source;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a single page load.\n
 *
 * - {@link Page}: rows plus the keys to continue in either direction (null = nothing more that way)\n
 * - {@link Error}: the load failed; the same request may be retried\n
 * - {@link Invalid}: the paging source was invalidated; discard it and start a new one\n
 */
public interface LoadResult<K, R> {
  /** Marker for {@link Page#itemsBefore()}/{@link Page#itemsAfter()} when the count is not known. */
  int COUNT_UNDEFINED = Integer.MIN_VALUE;

  record Page<K, R>(List<R> data, K prevKey, K nextKey, int itemsBefore, int itemsAfter) implements LoadResult<K, R> {
    public Page {
      data = List.copyOf(Objects.requireNonNull(data, "data"));
      if (itemsBefore != COUNT_UNDEFINED && itemsBefore < 0) throw new IllegalArgumentException("itemsBefore must be >= 0");
      if (itemsAfter != COUNT_UNDEFINED && itemsAfter < 0) throw new IllegalArgumentException("itemsAfter must be >= 0");
    }

    public Page(List<R> data, K prevKey, K nextKey) {
      this(data, prevKey, nextKey, COUNT_UNDEFINED, COUNT_UNDEFINED);
    }
  }

  record Error<K, R>(Throwable cause) implements LoadResult<K, R> {
    public Error {
      Objects.requireNonNull(cause, "cause");
    }
  }

  record Invalid<K, R>() implements LoadResult<K, R> {}

  static <K, R> LoadResult<K, R> page(List<R> data, K prevKey, K nextKey) {
    return new Page<>(data, prevKey, nextKey);
  }

  static <K, R> LoadResult<K, R> error(Throwable cause) {
    return new Error<>(cause);
  }

  static <K, R> LoadResult<K, R> invalid() {
    return new Invalid<>();
  }
}
