package io.intellixity.paging.examples.session;

import io.intellixity.paging.examples.session.internal.LruTtlCache;
import io.intellixity.paging.source.LoadParams;
import io.intellixity.paging.source.LoadResult;
import io.intellixity.paging.source.PagingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Registry of live paging sessions.\n
 *
 * Sessions are held in an LRU+TTL cache; a session that leaves the cache has its source invalidated.
 * An invalidated session stays resolvable (its loads answer {@link LoadResult.Invalid}) until it
 * expires, is closed, or is replaced through {@link #restart(String)}.
 */
public final class PagingSessions {
  private static final Logger log = LoggerFactory.getLogger(PagingSessions.class);

  private final PagingSourceFactory factory;
  private final LruTtlCache<String, PagingSession> sessions;
  private final int defaultPageSize;
  private final int maxPageSize;

  public PagingSessions(PagingSourceFactory factory, LruTtlCache<String, PagingSession> sessions, int defaultPageSize, int maxPageSize) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    if (defaultPageSize <= 0 || maxPageSize < defaultPageSize) {
      throw new IllegalArgumentException("need 0 < defaultPageSize <= maxPageSize");
    }
    this.defaultPageSize = defaultPageSize;
    this.maxPageSize = maxPageSize;
  }

  /** Cache removal hook: sessions that leave the cache stop observing the database. */
  public static void onRemoval(String id, PagingSession session) {
    log.debug("paging.session_removed id={} mode={} invalid={}", id, session.mode(), session.isInvalid());
    session.source().invalidate();
  }

  /**
   * Open a session.\n
   *
   * Keyset sessions load every page with the same size; offset sessions load a larger first page.
   */
  public PagingSession create(PagingMode mode, Integer pageSize) {
    return create(mode, pageSize, null);
  }

  private PagingSession create(PagingMode mode, Integer pageSize, Long startKey) {
    Objects.requireNonNull(mode, "mode");
    int size = (pageSize == null) ? defaultPageSize : pageSize;
    if (size <= 0 || size > maxPageSize) {
      throw new IllegalArgumentException("pageSize must be in [1, " + maxPageSize + "]: " + size);
    }
    PagingConfig config = (mode == PagingMode.KEYSET) ? PagingConfig.uniform(size) : new PagingConfig(size);
    PagingSession session = new PagingSession(UUID.randomUUID().toString(), mode, config, factory.create(mode), startKey);
    sessions.put(session.id(), session);
    log.debug("paging.session_created id={} mode={} pageSize={}", session.id(), mode, size);
    return session;
  }

  /** Session by id, or null if unknown or expired. */
  public PagingSession get(String id) {
    return sessions.get(Objects.requireNonNull(id, "id"));
  }

  /**
   * Load a page.\n
   *
   * {@code type} is refresh, append or prepend; append and prepend need a key.
   *
   * @return null if the session does not exist
   */
  public CompletableFuture<LoadResult<Long, Long>> load(String id, String type, Long key) {
    PagingSession session = get(id);
    if (session == null) return null;
    LoadParams<Long> params = params(session.config(), type, key, session.startKey());
    return session.source().load(params).thenApply(r -> {
      if (r instanceof LoadResult.Page<Long, Long> page) session.served(page);
      return r;
    });
  }

  /**
   * Replace a session with a new one whose keyless refresh starts at the old one's refresh key.\n
   *
   * @return the new session, or null if {@code id} is unknown
   */
  public PagingSession restart(String id) {
    PagingSession old = get(id);
    if (old == null) return null;
    Long refreshKey = old.refreshKey();
    sessions.remove(id);
    PagingSession next = create(old.mode(), old.config().pageSize(), refreshKey);
    log.debug("paging.session_restarted old={} new={} refreshKey={}", id, next.id(), refreshKey);
    return next;
  }

  public boolean close(String id) {
    return sessions.remove(Objects.requireNonNull(id, "id")) != null;
  }

  public int size() {
    return sessions.size();
  }

  static LoadParams<Long> params(PagingConfig config, String type, Long key, Long startKey) {
    String t = (type == null) ? "refresh" : type.trim().toLowerCase(Locale.ROOT);
    switch (t) {
      case "refresh":
        return config.refresh(key == null ? startKey : key);
      case "append":
        if (key == null) throw new IllegalArgumentException("append needs a key");
        return config.append(key);
      case "prepend":
        if (key == null) throw new IllegalArgumentException("prepend needs a key");
        return config.prepend(key);
      default:
        throw new IllegalArgumentException("Unknown load type: " + type + " (expected refresh, append or prepend)");
    }
  }
}
