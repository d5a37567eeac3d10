package io.intellixity.paging.examples.session;

import io.intellixity.paging.source.LoadResult;
import io.intellixity.paging.source.PagingConfig;
import io.intellixity.paging.source.PagingSource;
import io.intellixity.paging.source.PagingState;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client's paging session: a single-use source plus the last page it served.\n
 *
 * The last page is what {@link #refreshKey()} derives a restart position from once the source is
 * invalidated.
 */
public final class PagingSession {
  private final String id;
  private final PagingMode mode;
  private final PagingConfig config;
  private final PagingSource<Long, Long> source;
  private final Long startKey;
  private final AtomicReference<LoadResult.Page<Long, Long>> lastPage = new AtomicReference<>();

  PagingSession(String id, PagingMode mode, PagingConfig config, PagingSource<Long, Long> source, Long startKey) {
    this.id = Objects.requireNonNull(id, "id");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.config = Objects.requireNonNull(config, "config");
    this.source = Objects.requireNonNull(source, "source");
    this.startKey = startKey;
  }

  public String id() { return id; }
  public PagingMode mode() { return mode; }
  public PagingConfig config() { return config; }
  public PagingSource<Long, Long> source() { return source; }
  public boolean isInvalid() { return source.isInvalid(); }

  /** Key used by a refresh that names none; null starts at the beginning. */
  public Long startKey() { return startKey; }

  void served(LoadResult.Page<Long, Long> page) {
    lastPage.set(page);
  }

  /** Where a replacement session should start, or null to start from the beginning. */
  public Long refreshKey() {
    LoadResult.Page<Long, Long> last = lastPage.get();
    if (last == null) return null;
    Integer anchor = (last.itemsBefore() == LoadResult.COUNT_UNDEFINED) ? null : last.itemsBefore();
    return source.getRefreshKey(new PagingState<>(List.of(last), anchor, config));
  }
}
