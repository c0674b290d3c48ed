package com.acme.store.spi;

import com.acme.store.event.EventEnvelope;
import java.util.UUID;

/**
 * Durable at-least-once bus. Within one queue, deliveries are handed to subscribers one at a time
 * in publish order, and a delivery stays in flight until it is acked or nacked.
 */
public interface MessageBus {

  /**
   * Publish to every queue bound to the bus.
   *
   * @throws com.acme.store.core.TransientException if the broker is unreachable
   */
  void publish(EventEnvelope envelope);

  Subscription subscribe(String queue, DeliveryHandler handler);

  void ack(String queue, UUID messageId);

  /**
   * Reject an in-flight delivery. With {@code requeue} it is redelivered ahead of later messages
   * and its attempt count goes up; without, it is dropped.
   */
  void nack(String queue, UUID messageId, boolean requeue);
}
