package io.intellixity.paging.source;

import java.util.Objects;

/**
 * Request for one page.\n
 *
 * - {@link Refresh}: initial or refresh load, optionally anchored at {@link #key()}\n
 * - {@link Append}: load the page after the last loaded one, from its next key\n
 * - {@link Prepend}: load the page before the first loaded one, from its previous key\n
 */
public interface LoadParams<K> {
  /** Anchor (refresh) or boundary key (append/prepend); only refresh allows null. */
  K key();

  /** Requested number of rows. */
  int loadSize();

  record Refresh<K>(K key, int loadSize) implements LoadParams<K> {
    public Refresh {
      requirePositive(loadSize);
    }
  }

  record Append<K>(K key, int loadSize) implements LoadParams<K> {
    public Append {
      Objects.requireNonNull(key, "key");
      requirePositive(loadSize);
    }
  }

  record Prepend<K>(K key, int loadSize) implements LoadParams<K> {
    public Prepend {
      Objects.requireNonNull(key, "key");
      requirePositive(loadSize);
    }
  }

  static <K> LoadParams<K> refresh(K key, int loadSize) { return new Refresh<>(key, loadSize); }
  static <K> LoadParams<K> append(K key, int loadSize) { return new Append<>(key, loadSize); }
  static <K> LoadParams<K> prepend(K key, int loadSize) { return new Prepend<>(key, loadSize); }

  private static void requirePositive(int loadSize) {
    if (loadSize <= 0) throw new IllegalArgumentException("loadSize must be > 0");
  }
}
