package io.intellixity.paging.query;

/** Page boundaries could not be computed; the keyset paging session cannot continue. */
public final class PageBoundariesException extends QueryExecutionException {
  public PageBoundariesException(String message, Throwable cause) {
    super(message, cause);
  }
}
