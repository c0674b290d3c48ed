package com.acme.store.cqrs;

import com.acme.store.core.RequestContext;

/** In-process dispatcher for commands, queries and notifications. */
public interface Mediator {

  /**
   * Routes {@code request} through the behavior chain to its single handler, on the caller's
   * thread.
   *
   * @throws IllegalStateException if no handler is registered for the request type
   * @throws com.acme.store.core.RequestCancelledException if {@code ctx} is already cancelled
   */
  <R> R send(RequestContext ctx, Request<R> request);

  /** Delivers {@code notification} to every subscriber in registration order. */
  void publish(RequestContext ctx, Notification notification);
}
