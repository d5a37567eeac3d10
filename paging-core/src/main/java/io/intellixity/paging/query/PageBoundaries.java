package io.intellixity.paging.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * First key of every page across an ordered dataset, as of when it was computed.\n
 *
 * Immutable. Keys are strictly ordered by {@code comparator} (a reversed comparator models a
 * descending sort). {@code pageSize} is the load size the boundaries were computed with.
 */
public final class PageBoundaries<K> {
  private final List<K> keys;
  private final Comparator<? super K> comparator;
  private final int pageSize;

  public PageBoundaries(List<K> keys, Comparator<? super K> comparator, int pageSize) {
    Objects.requireNonNull(keys, "keys");
    this.comparator = Objects.requireNonNull(comparator, "comparator");
    if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
    List<K> copy = new ArrayList<>(keys.size());
    for (K k : keys) {
      if (k == null) throw new IllegalArgumentException("Page boundaries must not contain null keys");
      if (!copy.isEmpty() && comparator.compare(copy.get(copy.size() - 1), k) >= 0) {
        throw new IllegalArgumentException("Page boundaries are not strictly ordered at key=" + k);
      }
      copy.add(k);
    }
    this.keys = Collections.unmodifiableList(copy);
    this.pageSize = pageSize;
  }

  public List<K> keys() { return keys; }
  public int pageSize() { return pageSize; }
  public int size() { return keys.size(); }
  public boolean isEmpty() { return keys.isEmpty(); }
  public K first() { return keys.isEmpty() ? null : keys.get(0); }

  /**
   * Index of the page containing {@code key}: the greatest boundary not after it.\n
   *
   * Keys ordered before the first boundary map to the first page. Returns -1 when empty.
   */
  public int indexOfPageContaining(K key) {
    Objects.requireNonNull(key, "key");
    if (keys.isEmpty()) return -1;
    int r = Collections.binarySearch(keys, key, comparator);
    if (r >= 0) return r;
    int insertion = -(r + 1);
    return Math.max(insertion - 1, 0);
  }

  /** Boundary at {@code index}, or null when out of range. */
  public K keyAt(int index) {
    return (index < 0 || index >= keys.size()) ? null : keys.get(index);
  }

  /** Position of {@code key} as a boundary, or -1 if it is not one. */
  public int indexOf(K key) {
    Objects.requireNonNull(key, "key");
    int r = Collections.binarySearch(keys, key, comparator);
    return Math.max(r, -1);
  }

  @Override
  public String toString() {
    return "PageBoundaries{pageSize=" + pageSize + ", keys=" + keys + "}";
  }
}
