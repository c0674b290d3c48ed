package com.acme.store.event;

import com.acme.store.core.EnvelopeHeaders;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Bus representation of a {@link DomainEvent}. The payload stays JSON text until a projection
 * decodes it by {@code eventType}.
 */
public record EventEnvelope(
    UUID messageId,
    String eventType,
    String aggregateId,
    long streamPosition,
    Instant occurredAt,
    String payload,
    Map<String, String> headers) {

  public EventEnvelope {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(aggregateId, "aggregateId");
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public Optional<String> correlationId() {
    return Optional.ofNullable(headers.get(EnvelopeHeaders.CORRELATION_ID));
  }
}
