package com.acme.store.domain;

import com.acme.store.event.EventEnvelope;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Envelope staged in the write transaction and relayed to the bus after commit. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Outbox {

  public static final String STATUS_NEW = "NEW";
  public static final String STATUS_CLAIMED = "CLAIMED";
  public static final String STATUS_PUBLISHED = "PUBLISHED";

  private Long id;
  private UUID messageId;
  private String topic;
  private String eventType;
  private String aggregateId;
  private long streamPosition;
  private Instant occurredAt;
  private String payload;
  private Map<String, String> headers;
  private String status;
  private int attempts;
  private Instant nextAt;
  private Instant createdAt;
  private Instant publishedAt;
  private String lastError;

  public static Outbox fromEnvelope(String topic, EventEnvelope envelope) {
    Outbox outbox = new Outbox();
    outbox.setMessageId(envelope.messageId());
    outbox.setTopic(topic);
    outbox.setEventType(envelope.eventType());
    outbox.setAggregateId(envelope.aggregateId());
    outbox.setStreamPosition(envelope.streamPosition());
    outbox.setOccurredAt(envelope.occurredAt());
    outbox.setPayload(envelope.payload());
    outbox.setHeaders(envelope.headers());
    outbox.setStatus(STATUS_NEW);
    return outbox;
  }

  public EventEnvelope toEnvelope() {
    return new EventEnvelope(
        messageId, eventType, aggregateId, streamPosition, occurredAt, payload, headers);
  }
}
