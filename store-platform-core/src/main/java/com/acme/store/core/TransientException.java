package com.acme.store.core;

/** Retryable failure: store or bus temporarily unavailable. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
