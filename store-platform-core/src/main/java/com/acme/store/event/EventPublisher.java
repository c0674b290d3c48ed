package com.acme.store.event;

import com.acme.store.core.RequestContext;
import java.util.List;

/** Hands the events of a committed unit of work to the message bus. */
public interface EventPublisher {

  /**
   * Called inside the write transaction, just before commit. Implementations that stage events
   * durably (an outbox) write them here; the default does nothing.
   */
  default void stage(RequestContext ctx, List<DomainEvent> events) {}

  /**
   * Called after a durable commit with the events in the order they were raised.
   *
   * @throws com.acme.store.core.TransientException if the bus rejects the batch; retrying the
   *     same batch reuses the same message ids
   */
  void publish(RequestContext ctx, List<DomainEvent> events);
}
