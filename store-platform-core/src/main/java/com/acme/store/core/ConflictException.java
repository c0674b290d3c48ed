package com.acme.store.core;

/**
 * Optimistic concurrency violation or unique key clash. The unit of work that hit it has been
 * rolled back and the caller may retry with fresh state.
 */
public class ConflictException extends RuntimeException {
  public ConflictException(String message) {
    super(message);
  }

  public ConflictException(String message, Throwable e) {
    super(message, e);
  }
}
