package com.acme.store.processor.publish;

import com.acme.store.config.MessagingConfig;
import com.acme.store.core.RequestContext;
import com.acme.store.domain.Outbox;
import com.acme.store.event.DomainEvent;
import com.acme.store.event.EnvelopeFactory;
import com.acme.store.event.EventPublisher;
import com.acme.store.processor.outbox.OutboxRelay;
import com.acme.store.service.OutboxService;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stages events in the outbox inside the write transaction, then asks the relay to publish them
 * right after commit. The fast path stops at the first event it cannot publish and leaves that
 * event and the ones after it to the relay's sweep, which keeps their order.
 */
public class OutboxEventPublisher implements EventPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(OutboxEventPublisher.class);

  private final OutboxService outbox;
  private final OutboxRelay relay;
  private final MessagingConfig config;

  public OutboxEventPublisher(OutboxService outbox, OutboxRelay relay, MessagingConfig config) {
    this.outbox = outbox;
    this.relay = relay;
    this.config = config;
  }

  @Override
  public void stage(RequestContext ctx, List<DomainEvent> events) {
    if (events.isEmpty()) {
      return;
    }
    outbox.stage(
        events.stream()
            .map(e -> Outbox.fromEnvelope(config.getEventTopic(), EnvelopeFactory.wrap(e, ctx)))
            .toList());
  }

  @Override
  public void publish(RequestContext ctx, List<DomainEvent> events) {
    for (int i = 0; i < events.size(); i++) {
      UUID messageId = EnvelopeFactory.messageIdFor(events.get(i));
      boolean published;
      try {
        published = relay.publishNow(messageId);
      } catch (RuntimeException e) {
        LOG.warn("Fast-path publish failed for messageId={}: {}", messageId, e.toString());
        published = false;
      }
      if (!published) {
        LOG.info(
            "Fast path stopped at messageId={}, {} event(s) left for outbox sweep",
            messageId,
            events.size() - i);
        return;
      }
    }
  }
}
