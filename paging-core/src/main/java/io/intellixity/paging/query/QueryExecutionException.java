package io.intellixity.paging.query;

/**
 * Raised when a query cannot be executed against its data source (connection loss, malformed SQL,
 * unexpected result shape).\n
 *
 * Paging sources report it to callers as a retryable {@code LoadResult.Error}.
 */
public class QueryExecutionException extends RuntimeException {
  public QueryExecutionException(String message) {
    super(message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
