package com.acme.store.cqrs;

import java.util.List;

/**
 * Message routed by the {@link Mediator} to exactly one handler.
 *
 * @param <R> the handler's result type
 */
public interface Request<R> {

  /** Stable type identifier used in logs, metrics and envelope headers. */
  default String type() {
    return getClass().getSimpleName();
  }

  /**
   * Precondition check run by the validation behavior before the handler. Returns the violations;
   * an empty list means the request is valid.
   */
  default List<String> validate() {
    return List.of();
  }
}
