package com.acme.store.uow;

/** Wraps a checked exception thrown by a unit-of-work action. The transaction was rolled back. */
public class UnitOfWorkException extends RuntimeException {
  public UnitOfWorkException(String message, Throwable cause) {
    super(message, cause);
  }
}
