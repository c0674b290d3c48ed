package com.acme.store.spi;

/** Handle on an active subscription. */
public interface Subscription extends AutoCloseable {

  /** Stop receiving new deliveries; waits for the in-flight one, if any, to finish. */
  void cancel();

  boolean isActive();

  @Override
  default void close() {
    cancel();
  }
}
