package com.acme.store.jms;

import com.acme.store.core.EnvelopeHeaders;
import com.acme.store.event.EnvelopeFactory;
import com.acme.store.event.EventEnvelope;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps envelopes to JMS text messages and back. The body carries the whole envelope as JSON. */
public final class JmsEnvelopeMapper {
  private static final Logger LOG = LoggerFactory.getLogger(JmsEnvelopeMapper.class);

  static final String PROP_MESSAGE_ID = "messageId";
  static final String PROP_AGGREGATE_ID = "aggregateId";
  static final String PROP_STREAM_POSITION = "streamPosition";
  static final String PROP_DELIVERY_COUNT = "JMSXDeliveryCount";
  static final String UNDECODABLE_TYPE = "undecodable";
  static final String UNKNOWN_AGGREGATE = "unknown";

  private JmsEnvelopeMapper() {}

  public static TextMessage toMessage(Session session, EventEnvelope envelope)
      throws JMSException {
    TextMessage msg = session.createTextMessage(EnvelopeFactory.encode(envelope));
    msg.setJMSType(envelope.eventType());
    envelope.correlationId().ifPresent(id -> setCorrelationId(msg, id));
    msg.setStringProperty(PROP_MESSAGE_ID, envelope.messageId().toString());
    msg.setStringProperty(PROP_AGGREGATE_ID, envelope.aggregateId());
    msg.setLongProperty(PROP_STREAM_POSITION, envelope.streamPosition());
    for (Map.Entry<String, String> e : envelope.headers().entrySet()) {
      // correlation id travels as the JMS header
      if (EnvelopeHeaders.CORRELATION_ID.equals(e.getKey()) || e.getKey().startsWith("JMS")) {
        continue;
      }
      msg.setStringProperty(e.getKey(), e.getValue());
    }
    return msg;
  }

  /**
   * Decode the envelope carried in {@code message}.
   *
   * @throws IllegalArgumentException if the message is not a text message or its body is not an
   *     envelope
   */
  public static EventEnvelope toEnvelope(Message message) throws JMSException {
    if (!(message instanceof TextMessage)) {
      throw new IllegalArgumentException(
          "Expected a TextMessage but got " + message.getClass().getSimpleName());
    }
    String text = ((TextMessage) message).getText();
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Empty message body");
    }
    return EnvelopeFactory.decode(text);
  }

  /**
   * Best-effort envelope for a message {@link #toEnvelope} rejected, built from its properties and
   * raw body so it can be parked.
   */
  public static EventEnvelope salvage(Message message) throws JMSException {
    String type = message.getJMSType();
    String aggregateId = message.getStringProperty(PROP_AGGREGATE_ID);
    long position =
        message.propertyExists(PROP_STREAM_POSITION)
            ? message.getLongProperty(PROP_STREAM_POSITION)
            : 0L;
    String payload = message instanceof TextMessage ? ((TextMessage) message).getText() : null;
    Map<String, String> headers = new HashMap<>();
    Enumeration<?> names = message.getPropertyNames();
    while (names != null && names.hasMoreElements()) {
      String name = (String) names.nextElement();
      Object value = message.getObjectProperty(name);
      if (value != null) {
        headers.put(name, value.toString());
      }
    }
    return new EventEnvelope(
        salvageMessageId(message),
        type == null || type.isBlank() ? UNDECODABLE_TYPE : type,
        aggregateId == null || aggregateId.isBlank() ? UNKNOWN_AGGREGATE : aggregateId,
        position,
        Instant.ofEpochMilli(message.getJMSTimestamp()),
        payload,
        headers);
  }

  private static UUID salvageMessageId(Message message) throws JMSException {
    String id = message.getStringProperty(PROP_MESSAGE_ID);
    if (id != null) {
      try {
        return UUID.fromString(id);
      } catch (IllegalArgumentException e) {
        LOG.debug("Ignoring malformed messageId property '{}'", id);
      }
    }
    String jmsId = message.getJMSMessageID();
    return jmsId == null
        ? UUID.randomUUID()
        : UUID.nameUUIDFromBytes(jmsId.getBytes(StandardCharsets.UTF_8));
  }

  /** Broker-reported delivery count, starting at 1. */
  public static int deliveryCount(Message message) throws JMSException {
    if (message.propertyExists(PROP_DELIVERY_COUNT)) {
      return Math.max(1, message.getIntProperty(PROP_DELIVERY_COUNT));
    }
    return message.getJMSRedelivered() ? 2 : 1;
  }

  private static void setCorrelationId(Message msg, String correlationId) {
    try {
      msg.setJMSCorrelationID(correlationId);
    } catch (JMSException e) {
      throw new IllegalStateException("Cannot set JMS correlation id", e);
    }
  }
}
