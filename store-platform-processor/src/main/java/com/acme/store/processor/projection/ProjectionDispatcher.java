package com.acme.store.processor.projection;

import com.acme.store.event.EventEnvelope;
import com.acme.store.projection.Projection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes envelopes to the projections registered for their event type. Registration is additive:
 * several projections may react to the same type.
 */
public class ProjectionDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(ProjectionDispatcher.class);

  private final Map<String, List<Projection>> byType = new ConcurrentHashMap<>();

  public void register(String eventType, Projection projection) {
    byType.computeIfAbsent(eventType, t -> new CopyOnWriteArrayList<>()).add(projection);
    LOG.info("Registered projection {} for event type {}", projection.name(), eventType);
  }

  /** Register {@code projection} for every event type it declares. */
  public void register(Projection projection) {
    projection.eventTypes().forEach(type -> register(type, projection));
  }

  public void dispatch(EventEnvelope envelope) {
    List<Projection> projections = byType.get(envelope.eventType());
    if (projections == null || projections.isEmpty()) {
      LOG.debug("No projection for event type {}, ignoring", envelope.eventType());
      return;
    }
    for (Projection projection : projections) {
      projection.processEvent(envelope);
    }
  }

  public Set<String> eventTypes() {
    return Set.copyOf(byType.keySet());
  }
}
