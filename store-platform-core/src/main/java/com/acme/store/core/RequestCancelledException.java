package com.acme.store.core;

/** The request context was cancelled or its deadline passed. */
public class RequestCancelledException extends RuntimeException {
  public RequestCancelledException(String message) {
    super(message);
  }
}
