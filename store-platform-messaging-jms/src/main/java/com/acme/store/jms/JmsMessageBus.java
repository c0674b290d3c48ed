package com.acme.store.jms;

import com.acme.store.config.MessagingConfig;
import com.acme.store.core.TransientException;
import com.acme.store.event.EventEnvelope;
import com.acme.store.service.DlqService;
import com.acme.store.spi.Delivery;
import com.acme.store.spi.DeliveryHandler;
import com.acme.store.spi.MessageBus;
import com.acme.store.spi.Subscription;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.MessageConsumer;
import jakarta.jms.MessageProducer;
import jakarta.jms.Session;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MessageBus} over a JMS broker. Publishing copies each envelope to every configured
 * projection queue through a per-thread session; each subscription owns a client-acknowledged
 * session so a nack with requeue maps onto {@link Session#recover()}. Messages that do not decode
 * are parked in the dead-letter store before they are acknowledged.
 */
@Singleton
@Requires(beans = ConnectionFactory.class)
public class JmsMessageBus implements MessageBus {
  private static final Logger LOG = LoggerFactory.getLogger(JmsMessageBus.class);

  static final String PARKED_BY = "jms-message-bus";

  private final Connection connection;
  private final DlqService dlq;
  private final List<String> queues;
  private final ThreadLocal<SessionHolder> sessionPool;
  private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
  private final Set<JmsSubscription> subscriptions = ConcurrentHashMap.newKeySet();

  public JmsMessageBus(ConnectionFactory cf, MessagingConfig config, DlqService dlq) {
    this.dlq = dlq;
    this.queues = List.copyOf(config.getProjectionQueues());
    try {
      this.connection = cf.createConnection();
      this.connection.start();
      LOG.info("JMS connection started, publishing to {}", queues);
    } catch (JMSException e) {
      throw new TransientException("Failed to initialize JMS connection", e);
    }

    this.sessionPool =
        ThreadLocal.withInitial(
            () -> {
              try {
                LOG.debug("Creating JMS session for thread {}", Thread.currentThread().getName());
                return new SessionHolder(
                    connection.createSession(false, Session.AUTO_ACKNOWLEDGE));
              } catch (JMSException e) {
                throw new TransientException("Failed to create JMS session", e);
              }
            });
  }

  @Override
  public void publish(EventEnvelope envelope) {
    SessionHolder holder = sessionPool.get();
    String current = null;
    try {
      for (String queue : queues) {
        current = queue;
        Message msg = JmsEnvelopeMapper.toMessage(holder.session, envelope);
        holder.producer.send(holder.session.createQueue(queue), msg);
      }
    } catch (JMSException | RuntimeException e) {
      // the session may be broken; the next publish on this thread opens a fresh one
      holder.close();
      sessionPool.remove();
      LOG.error("Failed to publish messageId={} to {}", envelope.messageId(), current, e);
      throw new TransientException(
          "Failed to publish messageId=" + envelope.messageId() + " to queue " + current, e);
    }
  }

  @Override
  public Subscription subscribe(String queue, DeliveryHandler handler) {
    try {
      Session session = connection.createSession(false, Session.CLIENT_ACKNOWLEDGE);
      MessageConsumer consumer = session.createConsumer(session.createQueue(queue));
      JmsSubscription subscription = new JmsSubscription(queue, session, consumer);
      consumer.setMessageListener(m -> onMessage(queue, session, handler, m));
      subscriptions.add(subscription);
      LOG.info("Subscribed to JMS queue {}", queue);
      return subscription;
    } catch (JMSException e) {
      throw new TransientException("Failed to subscribe to queue " + queue, e);
    }
  }

  void onMessage(String queue, Session session, DeliveryHandler handler, Message message) {
    EventEnvelope envelope;
    int attempt;
    try {
      envelope = JmsEnvelopeMapper.toEnvelope(message);
      attempt = JmsEnvelopeMapper.deliveryCount(message);
    } catch (JMSException | IllegalArgumentException e) {
      parkUndecodable(queue, session, message, e);
      return;
    }

    String key = key(queue, envelope.messageId());
    inFlight.put(key, new InFlight(session, message));
    try {
      handler.onDelivery(new Delivery(queue, envelope, attempt));
    } catch (RuntimeException e) {
      LOG.error("Handler on {} failed on messageId={}", queue, envelope.messageId(), e);
    }
    if (inFlight.remove(key) != null) {
      LOG.warn("messageId={} on {} was not settled; recovering", envelope.messageId(), queue);
      recover(queue, session);
    }
  }

  private void parkUndecodable(String queue, Session session, Message message, Exception cause) {
    EventEnvelope salvaged;
    try {
      salvaged = JmsEnvelopeMapper.salvage(message);
      dlq.park(salvaged, queue, cause, JmsEnvelopeMapper.deliveryCount(message), PARKED_BY);
    } catch (JMSException | RuntimeException e) {
      LOG.error("Failed to park undecodable message on {}; leaving it on the queue", queue, e);
      recover(queue, session);
      return;
    }
    LOG.error("Parked undecodable messageId={} from {}", salvaged.messageId(), queue, cause);
    acknowledge(queue, message);
  }

  @Override
  public void ack(String queue, UUID messageId) {
    InFlight delivery = settle(queue, messageId);
    acknowledge(queue, delivery.message());
  }

  @Override
  public void nack(String queue, UUID messageId, boolean requeue) {
    InFlight delivery = settle(queue, messageId);
    if (requeue) {
      recover(queue, delivery.session());
    } else {
      acknowledge(queue, delivery.message());
    }
  }

  private InFlight settle(String queue, UUID messageId) {
    InFlight delivery = inFlight.remove(key(queue, messageId));
    if (delivery == null) {
      throw new IllegalStateException(
          "Message " + messageId + " is not in flight on queue " + queue);
    }
    return delivery;
  }

  private static void acknowledge(String queue, Message message) {
    try {
      message.acknowledge();
    } catch (JMSException e) {
      throw new TransientException("Failed to acknowledge message on " + queue, e);
    }
  }

  private static void recover(String queue, Session session) {
    try {
      session.recover();
    } catch (JMSException e) {
      throw new TransientException("Failed to recover session on " + queue, e);
    }
  }

  private static String key(String queue, UUID messageId) {
    return queue + "/" + messageId;
  }

  @PreDestroy
  void shutdown() {
    LOG.info("Shutting down JMS message bus");
    subscriptions.forEach(JmsSubscription::cancel);
    sessionPool.remove();
    try {
      connection.close();
    } catch (JMSException e) {
      LOG.warn("Error during JMS shutdown", e);
    }
  }

  private record InFlight(Session session, Message message) {}

  private final class JmsSubscription implements Subscription {
    private final String queue;
    private final Session session;
    private final MessageConsumer consumer;
    private volatile boolean active = true;

    private JmsSubscription(String queue, Session session, MessageConsumer consumer) {
      this.queue = queue;
      this.session = session;
      this.consumer = consumer;
    }

    @Override
    public void cancel() {
      if (!active) {
        return;
      }
      active = false;
      subscriptions.remove(this);
      try {
        // blocks until a running listener returns
        consumer.close();
        session.close();
        LOG.info("Unsubscribed from JMS queue {}", queue);
      } catch (JMSException e) {
        LOG.warn("Error closing JMS consumer on {}", queue, e);
      }
    }

    @Override
    public boolean isActive() {
      return active;
    }
  }

  /** Session and producer reused by one publishing thread. */
  private static final class SessionHolder {
    final Session session;
    final MessageProducer producer;

    SessionHolder(Session session) throws JMSException {
      this.session = session;
      this.producer = session.createProducer(null);
    }

    void close() {
      try {
        producer.close();
      } catch (JMSException e) {
        LOG.debug("Error closing producer", e);
      }
      try {
        session.close();
      } catch (JMSException e) {
        LOG.debug("Error closing session", e);
      }
    }
  }
}
