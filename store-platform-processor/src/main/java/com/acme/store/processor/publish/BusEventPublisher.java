package com.acme.store.processor.publish;

import com.acme.store.core.RequestContext;
import com.acme.store.core.TransientException;
import com.acme.store.event.DomainEvent;
import com.acme.store.event.EnvelopeFactory;
import com.acme.store.event.EventEnvelope;
import com.acme.store.event.EventPublisher;
import com.acme.store.spi.MessageBus;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Publishes committed events straight to the bus, in raised order. */
public class BusEventPublisher implements EventPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(BusEventPublisher.class);

  private final MessageBus bus;

  public BusEventPublisher(MessageBus bus) {
    this.bus = bus;
  }

  @Override
  public void publish(RequestContext ctx, List<DomainEvent> events) {
    for (DomainEvent event : events) {
      EventEnvelope envelope = EnvelopeFactory.wrap(event, ctx);
      try {
        bus.publish(envelope);
      } catch (TransientException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new TransientException(
            "Failed to publish " + envelope.eventType() + " messageId=" + envelope.messageId(), e);
      }
      LOG.debug(
          "Published {} aggregate={} position={} messageId={}",
          envelope.eventType(),
          envelope.aggregateId(),
          envelope.streamPosition(),
          envelope.messageId());
    }
  }
}
