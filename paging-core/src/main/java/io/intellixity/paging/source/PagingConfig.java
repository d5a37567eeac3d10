package io.intellixity.paging.source;

/**
 * Page sizing used by paging consumers.\n
 *
 * Keyset sources compute their page boundaries once, using the size of the first load, so they need
 * {@code initialLoadSize == pageSize}; build such configs with {@link #uniform(int)}.
 */
public record PagingConfig(int pageSize, int initialLoadSize, int jumpThreshold) {
  public static final int DEFAULT_INITIAL_PAGE_MULTIPLIER = 3;

  public PagingConfig {
    if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
    if (initialLoadSize <= 0) throw new IllegalArgumentException("initialLoadSize must be > 0");
    if (jumpThreshold != LoadResult.COUNT_UNDEFINED && jumpThreshold <= 0) {
      throw new IllegalArgumentException("jumpThreshold must be > 0 or COUNT_UNDEFINED");
    }
  }

  public PagingConfig(int pageSize) {
    this(pageSize, pageSize * DEFAULT_INITIAL_PAGE_MULTIPLIER, LoadResult.COUNT_UNDEFINED);
  }

  public static PagingConfig uniform(int pageSize) {
    return new PagingConfig(pageSize, pageSize, LoadResult.COUNT_UNDEFINED);
  }

  public boolean isUniform() { return pageSize == initialLoadSize; }

  /** Params for the first load of a session. */
  public <K> LoadParams<K> refresh(K key) { return LoadParams.refresh(key, initialLoadSize); }
  public <K> LoadParams<K> append(K key) { return LoadParams.append(key, pageSize); }
  public <K> LoadParams<K> prepend(K key) { return LoadParams.prepend(key, pageSize); }
}
