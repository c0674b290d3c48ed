package com.acme.store.core;

/** Non-retryable failure, e.g. a schema or syntax error in the store. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
