package io.intellixity.paging.query;

/**
 * Produces the row query for one keyset page, e.g.
 * <pre>
 * SELECT value FROM numbers
 * WHERE value &gt;= :beginInclusive AND (value &lt; :endExclusive OR :endExclusive IS NULL)
 * ORDER BY value
 * </pre>
 * {@code endExclusive} is null for the last page.
 */
@FunctionalInterface
public interface KeyedQueryProvider<K, R> {
  Query<R> provide(K beginInclusive, K endExclusive);
}
