package io.intellixity.paging.exec;

/**
 * Transaction propagation behavior for {@link Transacter#inTx(Propagation, java.util.function.Supplier)}.
 * <p>
 * Modelled on Spring's propagation model, implemented without any Spring dependency.
 */
public enum Propagation {
  /** Join the current transaction, create a new one if none exists. */
  REQUIRED,

  /** Join the current transaction, run non-transactionally if none exists. */
  SUPPORTS,

  /** Join the current transaction, throw if none exists. */
  MANDATORY,

  /** Suspend the current transaction (if any) and run the work in a fresh one. */
  REQUIRES_NEW,

  /** Run non-transactionally, throw if a transaction exists. */
  NEVER,

  /** Currently treated like {@link #REQUIRED}. */
  NESTED
}
