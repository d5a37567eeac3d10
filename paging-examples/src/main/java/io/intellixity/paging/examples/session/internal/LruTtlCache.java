package io.intellixity.paging.examples.session.internal;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU cache with TTL + optional idle expiry.\n
 *
 * - LRU eviction: access-order LinkedHashMap\n
 * - TTL: expire-after-write\n
 * - Idle: expire-after-access (optional)\n
 * - Removal listener: called for every value that leaves the cache (expired, evicted, replaced or
 *   removed), outside the cache lock\n
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final long idleMillis;
  private final LongSupplier nowMillis;
  private final BiConsumer<K, V> onRemoval;

  private final LinkedHashMap<K, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private static final class Entry<V> {
    final V value;
    final long writeAt;
    long accessAt;

    Entry(V value, long now) {
      this.value = value;
      this.writeAt = now;
      this.accessAt = now;
    }
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis, BiConsumer<K, V> onRemoval) {
    this(maxEntries, ttlMillis, idleMillis, System::currentTimeMillis, onRemoval);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis, LongSupplier nowMillis, BiConsumer<K, V> onRemoval) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.idleMillis = idleMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.onRemoval = Objects.requireNonNull(onRemoval, "onRemoval");
  }

  public V get(K key) {
    Objects.requireNonNull(key, "key");
    List<Map.Entry<K, V>> removed = new ArrayList<>();
    V out = null;
    synchronized (this) {
      long now = nowMillis.getAsLong();
      pruneExpired(now, removed);
      Entry<V> e = map.get(key);
      if (e != null) {
        e.accessAt = now;
        out = e.value;
      }
    }
    notifyRemoved(removed);
    return out;
  }

  public void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    List<Map.Entry<K, V>> removed = new ArrayList<>();
    synchronized (this) {
      long now = nowMillis.getAsLong();
      pruneExpired(now, removed);
      Entry<V> prev = map.put(key, new Entry<>(value, now));
      if (prev != null && prev.value != value) removed.add(Map.entry(key, prev.value));
      evictIfNeeded(removed);
    }
    notifyRemoved(removed);
  }

  public V remove(K key) {
    Objects.requireNonNull(key, "key");
    Entry<V> e;
    synchronized (this) {
      e = map.remove(key);
    }
    if (e == null) return null;
    onRemoval.accept(key, e.value);
    return e.value;
  }

  public int size() {
    List<Map.Entry<K, V>> removed = new ArrayList<>();
    int size;
    synchronized (this) {
      pruneExpired(nowMillis.getAsLong(), removed);
      size = map.size();
    }
    notifyRemoved(removed);
    return size;
  }

  private boolean isExpired(Entry<V> e, long now) {
    if (ttlMillis > 0 && (now - e.writeAt) >= ttlMillis) return true;
    if (idleMillis > 0 && (now - e.accessAt) >= idleMillis) return true;
    return false;
  }

  private void pruneExpired(long now, List<Map.Entry<K, V>> removed) {
    if (map.isEmpty()) return;
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<K, Entry<V>> me = it.next();
      if (isExpired(me.getValue(), now)) {
        removed.add(Map.entry(me.getKey(), me.getValue().value));
        it.remove();
      }
    }
  }

  private void evictIfNeeded(List<Map.Entry<K, V>> removed) {
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
      if (!it.hasNext()) return;
      Map.Entry<K, Entry<V>> eldest = it.next();
      removed.add(Map.entry(eldest.getKey(), eldest.getValue().value));
      it.remove();
    }
  }

  private void notifyRemoved(List<Map.Entry<K, V>> removed) {
    for (Map.Entry<K, V> r : removed) onRemoval.accept(r.getKey(), r.getValue());
  }
}
