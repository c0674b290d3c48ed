package com.acme.store.jms;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.store.event.EnvelopeFactory;
import com.acme.store.event.EventEnvelope;
import jakarta.jms.BytesMessage;
import jakarta.jms.JMSException;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JmsEnvelopeMapper Tests")
class JmsEnvelopeMapperTest {

  private static final EventEnvelope ENVELOPE =
      new EventEnvelope(
          UUID.fromString("00000000-0000-0000-0000-000000000001"),
          "ProductCreatedEventV1",
          "p-1",
          4,
          Instant.parse("2024-05-01T12:00:00Z"),
          "{\"name\":\"Lamp\"}",
          Map.of("correlationId", "corr-1", "idempotencyKey", "key-1"));

  @Nested
  @DisplayName("toMessage Tests")
  class ToMessageTests {

    @Test
    @DisplayName("should carry the encoded envelope with routing properties")
    void testToMessage() throws JMSException {
      Session session = mock(Session.class);
      TextMessage message = mock(TextMessage.class);
      when(session.createTextMessage(EnvelopeFactory.encode(ENVELOPE))).thenReturn(message);

      TextMessage result = JmsEnvelopeMapper.toMessage(session, ENVELOPE);

      assertThat(result).isSameAs(message);
      verify(message).setJMSType("ProductCreatedEventV1");
      verify(message).setJMSCorrelationID("corr-1");
      verify(message).setStringProperty("messageId", ENVELOPE.messageId().toString());
      verify(message).setStringProperty("aggregateId", "p-1");
      verify(message).setLongProperty("streamPosition", 4L);
      verify(message).setStringProperty("idempotencyKey", "key-1");
      verify(message, never()).setStringProperty(eq("correlationId"), anyString());
    }
  }

  @Nested
  @DisplayName("toEnvelope Tests")
  class ToEnvelopeTests {

    @Test
    @DisplayName("should decode the envelope from a text body")
    void testToEnvelope() throws JMSException {
      TextMessage message = mock(TextMessage.class);
      when(message.getText()).thenReturn(EnvelopeFactory.encode(ENVELOPE));

      EventEnvelope decoded = JmsEnvelopeMapper.toEnvelope(message);

      assertThat(decoded).isEqualTo(ENVELOPE);
    }

    @Test
    @DisplayName("should reject non-text messages")
    void testRejectsBytesMessage() {
      assertThatThrownBy(() -> JmsEnvelopeMapper.toEnvelope(mock(BytesMessage.class)))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject a body that is not an envelope")
    void testRejectsGarbage() throws JMSException {
      TextMessage message = mock(TextMessage.class);
      when(message.getText()).thenReturn("{broken");

      assertThatThrownBy(() -> JmsEnvelopeMapper.toEnvelope(message))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("deliveryCount Tests")
  class DeliveryCountTests {

    @Test
    @DisplayName("should use the broker delivery count when present")
    void testDeliveryCountProperty() throws JMSException {
      TextMessage message = mock(TextMessage.class);
      when(message.propertyExists("JMSXDeliveryCount")).thenReturn(true);
      when(message.getIntProperty("JMSXDeliveryCount")).thenReturn(3);

      assertThat(JmsEnvelopeMapper.deliveryCount(message)).isEqualTo(3);
    }

    @Test
    @DisplayName("should fall back to the redelivered flag")
    void testRedeliveredFallback() throws JMSException {
      TextMessage first = mock(TextMessage.class);
      TextMessage again = mock(TextMessage.class);
      when(again.getJMSRedelivered()).thenReturn(true);

      assertThat(JmsEnvelopeMapper.deliveryCount(first)).isEqualTo(1);
      assertThat(JmsEnvelopeMapper.deliveryCount(again)).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("salvage Tests")
  class SalvageTests {

    @Test
    @DisplayName("should fall back to placeholders and the broker id when nothing is readable")
    void testSalvageBareMessage() throws JMSException {
      BytesMessage message = mock(BytesMessage.class);
      when(message.getJMSMessageID()).thenReturn("ID:broker-1");
      when(message.getJMSTimestamp()).thenReturn(1000L);

      EventEnvelope salvaged = JmsEnvelopeMapper.salvage(message);

      assertThat(salvaged.messageId())
          .isEqualTo(UUID.nameUUIDFromBytes("ID:broker-1".getBytes(StandardCharsets.UTF_8)));
      assertThat(salvaged.eventType()).isEqualTo("undecodable");
      assertThat(salvaged.aggregateId()).isEqualTo("unknown");
      assertThat(salvaged.streamPosition()).isZero();
      assertThat(salvaged.payload()).isNull();
      assertThat(salvaged.occurredAt()).isEqualTo(Instant.ofEpochMilli(1000L));
    }

    @Test
    @DisplayName("should ignore a malformed messageId property")
    void testSalvageMalformedId() throws JMSException {
      TextMessage message = mock(TextMessage.class);
      when(message.getText()).thenReturn("{broken");
      when(message.getStringProperty("messageId")).thenReturn("not-a-uuid");
      when(message.getJMSMessageID()).thenReturn("ID:broker-2");

      EventEnvelope salvaged = JmsEnvelopeMapper.salvage(message);

      assertThat(salvaged.messageId())
          .isEqualTo(UUID.nameUUIDFromBytes("ID:broker-2".getBytes(StandardCharsets.UTF_8)));
      assertThat(salvaged.payload()).isEqualTo("{broken");
    }
  }
}
