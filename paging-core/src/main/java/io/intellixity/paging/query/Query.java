package io.intellixity.paging.query;

import java.util.List;

/**
 * A parameterized, re-executable query producing an ordered list of rows.\n
 *
 * Queries can be observed: a registered {@link Listener} is told when the data the result set was
 * derived from may have changed. Notifications may be a superset of real changes (false positives are
 * fine), but a change must never go unreported.\n
 */
public interface Query<R> {

  /** Execute the query and map every row. */
  List<R> executeAsList();

  /** Execute the query and return its only row; throws if there are zero or several rows. */
  default R executeAsOne() {
    R one = executeAsOneOrNull();
    if (one == null) throw new QueryExecutionException("Query returned no rows: " + this);
    return one;
  }

  /** Execute the query and return its only row, or null if it returned none. */
  default R executeAsOneOrNull() {
    List<R> rows = executeAsList();
    if (rows.isEmpty()) return null;
    if (rows.size() > 1) throw new QueryExecutionException("Query returned " + rows.size() + " rows, expected one: " + this);
    return rows.get(0);
  }

  void addListener(Listener listener);

  void removeListener(Listener listener);

  /** Change callback for {@link Query} observers. */
  @FunctionalInterface
  interface Listener {
    void queryResultsChanged();
  }
}
