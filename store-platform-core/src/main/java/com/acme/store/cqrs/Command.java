package com.acme.store.cqrs;

import java.util.Optional;

/** Intent to change state. Its handler runs inside a unit of work. */
public interface Command<R> extends Request<R> {

  /** Optional caller-supplied key, propagated to the events the command raises. */
  default Optional<String> idempotencyKey() {
    return Optional.empty();
  }
}
