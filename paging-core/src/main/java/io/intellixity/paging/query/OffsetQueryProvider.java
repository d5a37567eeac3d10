package io.intellixity.paging.query;

/**
 * Produces the row query for one offset page, e.g.
 * <pre>
 * SELECT value FROM numbers ORDER BY value LIMIT :limit OFFSET :offset
 * </pre>
 */
@FunctionalInterface
public interface OffsetQueryProvider<R> {
  Query<R> provide(long limit, long offset);
}
