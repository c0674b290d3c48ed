package com.acme.store.jms;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.store.config.MessagingConfig;
import com.acme.store.core.TransientException;
import com.acme.store.event.EnvelopeFactory;
import com.acme.store.event.EventEnvelope;
import com.acme.store.service.DlqService;
import com.acme.store.spi.Delivery;
import com.acme.store.spi.Subscription;
import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import jakarta.jms.MessageConsumer;
import jakarta.jms.MessageListener;
import jakarta.jms.MessageProducer;
import jakarta.jms.Queue;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

@DisplayName("JmsMessageBus Tests")
class JmsMessageBusTest {

  private static final String ORDERS = "STORE.PROJ.ORDERS.Q";
  private static final String PRODUCTS = "STORE.PROJ.PRODUCTS.Q";

  private ConnectionFactory connectionFactory;
  private Connection connection;
  private Session publishSession;
  private Session consumerSession;
  private MessageProducer producer;
  private DlqService dlq;
  private JmsMessageBus bus;

  @BeforeEach
  void setUp() throws JMSException {
    connectionFactory = mock(ConnectionFactory.class);
    connection = mock(Connection.class);
    publishSession = mock(Session.class);
    consumerSession = mock(Session.class);
    producer = mock(MessageProducer.class);
    dlq = mock(DlqService.class);

    when(connectionFactory.createConnection()).thenReturn(connection);
    when(connection.createSession(false, Session.AUTO_ACKNOWLEDGE)).thenReturn(publishSession);
    when(connection.createSession(false, Session.CLIENT_ACKNOWLEDGE)).thenReturn(consumerSession);
    when(publishSession.createProducer(null)).thenReturn(producer);

    MessagingConfig config = new MessagingConfig();
    config.setProjectionQueues(List.of(ORDERS, PRODUCTS));
    bus = new JmsMessageBus(connectionFactory, config, dlq);
  }

  private static EventEnvelope envelope() {
    return new EventEnvelope(
        UUID.randomUUID(),
        "OrderCreatedEventV1",
        "o-1",
        1,
        Instant.parse("2024-05-01T12:00:00Z"),
        "{}",
        Map.of("correlationId", "corr-1"));
  }

  private TextMessage incoming(EventEnvelope envelope, int deliveryCount) throws JMSException {
    TextMessage message = mock(TextMessage.class);
    when(message.getText()).thenReturn(EnvelopeFactory.encode(envelope));
    when(message.propertyExists("JMSXDeliveryCount")).thenReturn(true);
    when(message.getIntProperty("JMSXDeliveryCount")).thenReturn(deliveryCount);
    return message;
  }

  @Test
  @DisplayName("constructor should create and start the connection")
  void testConstructor() throws JMSException {
    verify(connectionFactory).createConnection();
    verify(connection).start();
  }

  @Nested
  @DisplayName("publish Tests")
  class PublishTests {

    @Test
    @DisplayName("should send the envelope to every projection queue")
    void testPublishFansOut() throws JMSException {
      Queue orders = mock(Queue.class);
      Queue products = mock(Queue.class);
      TextMessage message = mock(TextMessage.class);
      when(publishSession.createQueue(ORDERS)).thenReturn(orders);
      when(publishSession.createQueue(PRODUCTS)).thenReturn(products);
      when(publishSession.createTextMessage(anyString())).thenReturn(message);

      bus.publish(envelope());

      verify(producer).send(orders, message);
      verify(producer).send(products, message);
    }

    @Test
    @DisplayName("should raise a transient error and discard the session on failure")
    void testPublishFailure() throws JMSException {
      when(publishSession.createTextMessage(anyString())).thenReturn(mock(TextMessage.class));
      when(publishSession.createQueue(anyString())).thenReturn(mock(Queue.class));
      doThrow(new JMSException("broker gone")).when(producer).send(any(Queue.class), any());

      assertThatThrownBy(() -> bus.publish(envelope()))
          .isInstanceOf(TransientException.class)
          .hasCauseInstanceOf(JMSException.class);
      verify(publishSession).close();
    }
  }

  @Nested
  @DisplayName("subscription Tests")
  class SubscriptionTests {

    private MessageConsumer consumer;
    private List<Delivery> deliveries;

    @BeforeEach
    void setUpConsumer() throws JMSException {
      consumer = mock(MessageConsumer.class);
      Queue queue = mock(Queue.class);
      when(consumerSession.createQueue(ORDERS)).thenReturn(queue);
      when(consumerSession.createConsumer(queue)).thenReturn(consumer);
      deliveries = new ArrayList<>();
    }

    private MessageListener subscribe(com.acme.store.spi.DeliveryHandler handler)
        throws JMSException {
      bus.subscribe(ORDERS, handler);
      ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
      verify(consumer).setMessageListener(listener.capture());
      return listener.getValue();
    }

    @Test
    @DisplayName("ack should acknowledge the delivered message")
    void testAck() throws JMSException {
      EventEnvelope env = envelope();
      TextMessage message = incoming(env, 1);
      MessageListener listener =
          subscribe(
              d -> {
                deliveries.add(d);
                bus.ack(ORDERS, d.envelope().messageId());
              });

      listener.onMessage(message);

      assertThat(deliveries).hasSize(1);
      assertThat(deliveries.get(0).envelope()).isEqualTo(env);
      assertThat(deliveries.get(0).attempt()).isEqualTo(1);
      verify(message).acknowledge();
      verify(consumerSession, never()).recover();
    }

    @Test
    @DisplayName("nack with requeue should recover the session with the broker's attempt count")
    void testNackRequeue() throws JMSException {
      TextMessage message = incoming(envelope(), 2);
      MessageListener listener =
          subscribe(
              d -> {
                deliveries.add(d);
                bus.nack(ORDERS, d.envelope().messageId(), true);
              });

      listener.onMessage(message);

      assertThat(deliveries.get(0).attempt()).isEqualTo(2);
      verify(consumerSession).recover();
      verify(message, never()).acknowledge();
    }

    @Test
    @DisplayName("nack without requeue should acknowledge and drop")
    void testNackDrop() throws JMSException {
      TextMessage message = incoming(envelope(), 1);
      MessageListener listener =
          subscribe(d -> bus.nack(ORDERS, d.envelope().messageId(), false));

      listener.onMessage(message);

      verify(message).acknowledge();
      verify(consumerSession, never()).recover();
    }

    @Test
    @DisplayName("an unsettled delivery should be recovered for redelivery")
    void testUnsettledRecovered() throws JMSException {
      MessageListener listener = subscribe(deliveries::add);

      listener.onMessage(incoming(envelope(), 1));

      verify(consumerSession).recover();
    }

    private TextMessage garbage(UUID messageId) throws JMSException {
      TextMessage garbage = mock(TextMessage.class);
      when(garbage.getText()).thenReturn("not an envelope");
      when(garbage.getJMSType()).thenReturn("OrderCreatedEventV1");
      when(garbage.getStringProperty("messageId")).thenReturn(messageId.toString());
      when(garbage.getStringProperty("aggregateId")).thenReturn("o-9");
      when(garbage.propertyExists("streamPosition")).thenReturn(true);
      when(garbage.getLongProperty("streamPosition")).thenReturn(4L);
      when(garbage.getPropertyNames())
          .thenReturn(Collections.enumeration(List.of("aggregateId")));
      when(garbage.getObjectProperty("aggregateId")).thenReturn("o-9");
      return garbage;
    }

    @Test
    @DisplayName("an undecodable message should be parked then acknowledged")
    void testUndecodableParked() throws JMSException {
      UUID messageId = UUID.randomUUID();
      TextMessage garbage = garbage(messageId);
      MessageListener listener = subscribe(deliveries::add);

      listener.onMessage(garbage);

      assertThat(deliveries).isEmpty();
      ArgumentCaptor<EventEnvelope> parked = ArgumentCaptor.forClass(EventEnvelope.class);
      InOrder order = inOrder(dlq, garbage);
      order
          .verify(dlq)
          .park(
              parked.capture(),
              eq(ORDERS),
              any(IllegalArgumentException.class),
              eq(1),
              eq(JmsMessageBus.PARKED_BY));
      order.verify(garbage).acknowledge();
      assertThat(parked.getValue().messageId()).isEqualTo(messageId);
      assertThat(parked.getValue().eventType()).isEqualTo("OrderCreatedEventV1");
      assertThat(parked.getValue().aggregateId()).isEqualTo("o-9");
      assertThat(parked.getValue().streamPosition()).isEqualTo(4L);
      assertThat(parked.getValue().payload()).isEqualTo("not an envelope");
      assertThat(parked.getValue().headers()).containsEntry("aggregateId", "o-9");
    }

    @Test
    @DisplayName("an undecodable message that cannot be parked should stay on the queue")
    void testUndecodableParkFailure() throws JMSException {
      TextMessage garbage = garbage(UUID.randomUUID());
      doThrow(new IllegalStateException("db down"))
          .when(dlq)
          .park(any(), anyString(), any(), anyInt(), anyString());
      MessageListener listener = subscribe(deliveries::add);

      listener.onMessage(garbage);

      assertThat(deliveries).isEmpty();
      verify(garbage, never()).acknowledge();
      verify(consumerSession).recover();
    }

    @Test
    @DisplayName("settling a message that is not in flight should fail")
    void testSettleUnknown() {
      assertThatThrownBy(() -> bus.ack(ORDERS, UUID.randomUUID()))
          .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("cancel should close the consumer and its session once")
    void testCancel() throws JMSException {
      Subscription subscription = bus.subscribe(ORDERS, deliveries::add);

      subscription.cancel();
      subscription.cancel();

      assertThat(subscription.isActive()).isFalse();
      verify(consumer, times(1)).close();
      verify(consumerSession, times(1)).close();
    }
  }

  @Test
  @DisplayName("shutdown should cancel subscriptions and close the connection")
  void testShutdown() throws JMSException {
    MessageConsumer consumer = mock(MessageConsumer.class);
    when(consumerSession.createQueue(ORDERS)).thenReturn(mock(Queue.class));
    when(consumerSession.createConsumer(any())).thenReturn(consumer);
    Subscription subscription = bus.subscribe(ORDERS, d -> {});

    bus.shutdown();

    assertThat(subscription.isActive()).isFalse();
    verify(consumer).close();
    verify(connection).close();
  }
}
