package io.intellixity.paging.exec;

import java.util.function.Supplier;

/**
 * Runs a unit of work inside a data-source transaction.\n
 *
 * Paging sources use it so the queries of a single load (count + page, or boundaries + page)
 * observe one consistent snapshot.\n
 */
public interface Transacter {
  /** Transacter that runs work directly, without any transaction boundary. */
  Transacter NONE = new Transacter() {
    @Override public Propagation defaultPropagation() { return Propagation.SUPPORTS; }
    @Override public <T> T inTx(Propagation propagation, Supplier<T> work) { return work.get(); }
  };

  /** Default propagation used by {@link #inTx(Supplier)}. */
  Propagation defaultPropagation();

  /** Run work within a transaction boundary using the given propagation behavior. */
  <T> T inTx(Propagation propagation, Supplier<T> work);

  /** Run work using {@link #defaultPropagation()}. */
  default <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation(), work);
  }
}
