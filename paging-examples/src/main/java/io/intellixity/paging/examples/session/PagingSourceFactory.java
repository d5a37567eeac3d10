package io.intellixity.paging.examples.session;

import io.intellixity.paging.source.PagingSource;

/** Builds a fresh paging source over the numbers table. */
@FunctionalInterface
public interface PagingSourceFactory {
  PagingSource<Long, Long> create(PagingMode mode);
}
