package com.acme.store.cqrs;

import com.acme.store.core.RequestContext;

/**
 * Cross-cutting step wrapped around every request handler. Behaviors run in registration order,
 * the first registered being the outermost. A behavior short-circuits by throwing instead of
 * calling {@code next}.
 */
public interface PipelineBehavior {

  <R> R handle(RequestContext ctx, Request<R> request, Next<R> next);

  /** Continuation to the next behavior, or to the handler itself. */
  @FunctionalInterface
  interface Next<R> {
    R proceed();
  }
}
