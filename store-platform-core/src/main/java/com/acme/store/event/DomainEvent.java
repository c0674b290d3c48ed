package com.acme.store.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable fact raised by an aggregate. {@code streamPosition} is the aggregate's per-stream
 * sequence number: strictly increasing and gap-free on the write side, starting at 1.
 *
 * @param payload typed event body, serialized to JSON when the event is enveloped
 */
public record DomainEvent(
    String eventType, String aggregateId, long streamPosition, Instant occurredAt, Object payload) {

  public DomainEvent {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(payload, "payload");
    if (streamPosition < 1) {
      throw new IllegalArgumentException("streamPosition must be >= 1, was " + streamPosition);
    }
  }
}
