package com.acme.store.spi;

import java.util.function.Supplier;

/** Store able to run a unit of work atomically. */
public interface TransactionalStore {

  /**
   * Run {@code work} in the caller's transaction, or in a new one when there is none. A runtime
   * exception escaping {@code work} rolls the transaction back and is rethrown.
   */
  <T> T executeWrite(Supplier<T> work);

  /** Like {@link #executeWrite(Supplier)} for work that only reads. */
  <T> T executeRead(Supplier<T> work);

  /** Whether the calling thread currently has an open transaction. */
  boolean hasActiveTransaction();
}
