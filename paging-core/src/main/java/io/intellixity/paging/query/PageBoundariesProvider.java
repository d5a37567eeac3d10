package io.intellixity.paging.query;

/**
 * Produces the query listing the first key of every page across the full ordered dataset.\n
 *
 * Ordered ascending with a page size of 3, the dataset {@code [0..9]} yields {@code [0, 3, 6, 9]}.
 * This is usually only feasible with window functions:
 * <pre>
 * SELECT value FROM (
 *   SELECT value,
 *     CASE WHEN ((row_number() OVER (ORDER BY value) - 1) % :limit) = 0 THEN 1 ELSE 0 END page_boundary
 *   FROM numbers
 * ) b WHERE page_boundary = 1 ORDER BY value
 * </pre>
 * {@code anchor} is the refresh key of the first load (may be null); providers may ignore it.
 */
@FunctionalInterface
public interface PageBoundariesProvider<K> {
  Query<K> provide(K anchor, long limit);
}
