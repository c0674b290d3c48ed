package com.acme.store.uow;

import com.acme.store.core.RequestContext;

/** What a unit-of-work action sees: the request context and the transaction's repositories. */
public interface TransactionScope {

  RequestContext context();

  /**
   * Repository of the given type, created once per unit of work.
   *
   * @throws IllegalArgumentException if no factory is registered for {@code type}
   */
  <R> R repository(Class<R> type);
}
