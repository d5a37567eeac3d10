package io.intellixity.paging.source;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of what a consumer has loaded so far; input to {@link PagingSource#getRefreshKey(PagingState)}.
 *
 * @param pages loaded pages in display order
 * @param anchorPosition most recently accessed absolute row position, or null
 */
public record PagingState<K, R>(List<LoadResult.Page<K, R>> pages, Integer anchorPosition, PagingConfig config) {
  public PagingState {
    pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
    Objects.requireNonNull(config, "config");
  }

  public LoadResult.Page<K, R> lastPageOrNull() {
    return pages.isEmpty() ? null : pages.get(pages.size() - 1);
  }

  public LoadResult.Page<K, R> firstPageOrNull() {
    return pages.isEmpty() ? null : pages.get(0);
  }
}
