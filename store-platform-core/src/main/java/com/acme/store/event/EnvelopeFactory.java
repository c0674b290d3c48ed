package com.acme.store.event;

import com.acme.store.core.EnvelopeHeaders;
import com.acme.store.core.Jsons;
import com.acme.store.core.RequestContext;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/** Wraps domain events into envelopes and encodes envelopes for transports that carry text. */
public final class EnvelopeFactory {

  private EnvelopeFactory() {}

  /**
   * Deterministic id of an event: the same event always maps to the same message id, so a
   * republished batch is recognised as a duplicate downstream.
   */
  public static UUID messageIdFor(String eventType, String aggregateId, long streamPosition) {
    String name = eventType + "|" + aggregateId + "|" + streamPosition;
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
  }

  public static UUID messageIdFor(DomainEvent event) {
    return messageIdFor(event.eventType(), event.aggregateId(), event.streamPosition());
  }

  public static EventEnvelope wrap(DomainEvent event, RequestContext ctx) {
    Map<String, String> headers = new HashMap<>();
    if (ctx != null) {
      headers.put(EnvelopeHeaders.CORRELATION_ID, ctx.correlationId());
      ctx.idempotencyKey().ifPresent(k -> headers.put(EnvelopeHeaders.IDEMPOTENCY_KEY, k));
    }
    return new EventEnvelope(
        messageIdFor(event),
        event.eventType(),
        event.aggregateId(),
        event.streamPosition(),
        event.occurredAt(),
        Jsons.toJson(event.payload()),
        headers);
  }

  public static String encode(EventEnvelope envelope) {
    return Jsons.toJson(envelope);
  }

  public static EventEnvelope decode(String json) {
    return Jsons.fromJson(json, EventEnvelope.class);
  }
}
