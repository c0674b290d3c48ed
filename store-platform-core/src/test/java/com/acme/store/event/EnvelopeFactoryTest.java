package com.acme.store.event;

import static org.assertj.core.api.Assertions.*;

import com.acme.store.core.EnvelopeHeaders;
import com.acme.store.core.RequestContext;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EnvelopeFactoryTest {

  record PriceChanged(String sku, BigDecimal price) {}

  private final Instant occurredAt = Instant.parse("2024-03-01T10:15:30Z");

  @Test
  @DisplayName("message id is stable per event and differs between positions")
  void testDeterministicMessageId() {
    DomainEvent first =
        new DomainEvent("PriceChanged", "p-1", 1, occurredAt, new PriceChanged("A", BigDecimal.ONE));
    DomainEvent again =
        new DomainEvent("PriceChanged", "p-1", 1, occurredAt.plusSeconds(9), first.payload());
    DomainEvent second = new DomainEvent("PriceChanged", "p-1", 2, occurredAt, first.payload());

    assertThat(EnvelopeFactory.messageIdFor(first)).isEqualTo(EnvelopeFactory.messageIdFor(again));
    assertThat(EnvelopeFactory.messageIdFor(first))
        .isNotEqualTo(EnvelopeFactory.messageIdFor(second));
  }

  @Test
  @DisplayName("wrap carries stream metadata, JSON payload and request headers")
  void testWrap() {
    DomainEvent event =
        new DomainEvent(
            "PriceChanged", "p-7", 3, occurredAt, new PriceChanged("SKU-7", new BigDecimal("9.50")));
    RequestContext ctx = RequestContext.withCorrelationId("corr-7").withIdempotencyKey("idem-7");

    EventEnvelope envelope = EnvelopeFactory.wrap(event, ctx);

    assertThat(envelope.eventType()).isEqualTo("PriceChanged");
    assertThat(envelope.aggregateId()).isEqualTo("p-7");
    assertThat(envelope.streamPosition()).isEqualTo(3);
    assertThat(envelope.occurredAt()).isEqualTo(occurredAt);
    assertThat(envelope.payload()).isEqualTo("{\"sku\":\"SKU-7\",\"price\":9.50}");
    assertThat(envelope.headers())
        .containsEntry(EnvelopeHeaders.CORRELATION_ID, "corr-7")
        .containsEntry(EnvelopeHeaders.IDEMPOTENCY_KEY, "idem-7");
    assertThat(envelope.correlationId()).contains("corr-7");
  }

  @Test
  @DisplayName("encoded envelope decodes to an equal envelope")
  void testEncodeDecode() {
    EventEnvelope envelope =
        new EventEnvelope(
            EnvelopeFactory.messageIdFor("OrderCreatedEventV1", "o-1", 1),
            "OrderCreatedEventV1",
            "o-1",
            1,
            occurredAt,
            "{\"orderId\":\"o-1\"}",
            Map.of(EnvelopeHeaders.CORRELATION_ID, "c-1"));

    assertThat(EnvelopeFactory.decode(EnvelopeFactory.encode(envelope))).isEqualTo(envelope);
  }

  @Test
  @DisplayName("malformed envelope text is rejected")
  void testDecodeMalformed() {
    assertThatThrownBy(() -> EnvelopeFactory.decode("{not json"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("domain event positions start at one")
  void testPositionMustBePositive() {
    assertThatThrownBy(() -> new DomainEvent("X", "a", 0, occurredAt, "p"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
