package com.acme.store.processor.consumer;

import com.acme.store.config.TimeoutConfig;
import com.acme.store.event.EventEnvelope;
import com.acme.store.processor.projection.ProjectionDispatcher;
import com.acme.store.service.DlqService;
import com.acme.store.spi.Delivery;
import com.acme.store.spi.MessageBus;
import com.acme.store.spi.Subscription;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Long-lived consumer of one queue. Each delivery is dispatched to the projections and then acked;
 * a failed delivery is requeued until it reaches the delivery budget, after which it is parked in
 * the dead-letter store and acked so later messages keep flowing.
 */
public class ProjectionWorker {
  private static final Logger LOG = LoggerFactory.getLogger(ProjectionWorker.class);

  public static final String METRIC_NAME = "store.projection.deliveries";

  private final String name;
  private final String queue;
  private final MessageBus bus;
  private final ProjectionDispatcher dispatcher;
  private final DlqService dlq;
  private final int maxDeliveryAttempts;
  private final Counter acked;
  private final Counter retried;
  private final Counter deadLettered;
  private Subscription subscription;
  private boolean stopped;

  public ProjectionWorker(
      String name,
      String queue,
      MessageBus bus,
      ProjectionDispatcher dispatcher,
      DlqService dlq,
      TimeoutConfig timeoutConfig,
      MeterRegistry meters) {
    this.name = name;
    this.queue = queue;
    this.bus = bus;
    this.dispatcher = dispatcher;
    this.dlq = dlq;
    this.maxDeliveryAttempts = timeoutConfig.getMaxDeliveryAttempts();
    this.acked = counter(meters, "acked");
    this.retried = counter(meters, "retried");
    this.deadLettered = counter(meters, "dead-lettered");
  }

  private Counter counter(MeterRegistry meters, String outcome) {
    return Counter.builder(METRIC_NAME)
        .description("Projection deliveries by outcome")
        .tag("queue", queue)
        .tag("outcome", outcome)
        .register(meters);
  }

  public synchronized void start() {
    if (subscription != null) {
      throw new IllegalStateException("Worker " + name + " already started");
    }
    subscription = bus.subscribe(queue, this::onDelivery);
    LOG.info("Worker {} consuming {} (max {} attempts)", name, queue, maxDeliveryAttempts);
  }

  /** Stop consuming. Returns once the in-flight delivery, if any, has been settled. */
  public synchronized void stop() {
    if (subscription == null || stopped) {
      return;
    }
    stopped = true;
    subscription.cancel();
    LOG.info("Worker {} stopped consuming {}", name, queue);
  }

  public synchronized boolean isRunning() {
    return subscription != null && !stopped && subscription.isActive();
  }

  void onDelivery(Delivery delivery) {
    EventEnvelope envelope = delivery.envelope();
    MDC.put("messageId", envelope.messageId().toString());
    MDC.put("aggregateId", envelope.aggregateId());
    try {
      dispatcher.dispatch(envelope);
      bus.ack(queue, envelope.messageId());
      acked.increment();
    } catch (RuntimeException e) {
      handleFailure(delivery, e);
    } finally {
      MDC.remove("messageId");
      MDC.remove("aggregateId");
    }
  }

  private void handleFailure(Delivery delivery, RuntimeException error) {
    EventEnvelope envelope = delivery.envelope();
    if (delivery.attempt() < maxDeliveryAttempts) {
      LOG.warn(
          "Attempt {}/{} failed for {} aggregate={} position={}: {}",
          delivery.attempt(),
          maxDeliveryAttempts,
          envelope.eventType(),
          envelope.aggregateId(),
          envelope.streamPosition(),
          error.toString());
      bus.nack(queue, envelope.messageId(), true);
      retried.increment();
      return;
    }

    LOG.error(
        "Giving up on {} aggregate={} position={} after {} attempt(s)",
        envelope.eventType(),
        envelope.aggregateId(),
        envelope.streamPosition(),
        delivery.attempt(),
        error);
    try {
      dlq.park(envelope, queue, error, delivery.attempt(), name);
    } catch (RuntimeException parkFailure) {
      LOG.error("Failed to park messageId={}, requeueing", envelope.messageId(), parkFailure);
      bus.nack(queue, envelope.messageId(), true);
      retried.increment();
      return;
    }
    bus.ack(queue, envelope.messageId());
    deadLettered.increment();
  }

  public String getName() {
    return name;
  }

  public String getQueue() {
    return queue;
  }
}
