package com.acme.store.processor.projection;

import com.acme.store.core.Jsons;
import com.acme.store.core.ProjectionException;
import com.acme.store.event.EventEnvelope;
import com.acme.store.projection.Projection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projection whose handlers are bound once, by event type, when the subclass is constructed.
 * Incoming envelopes are matched by their type tag and their payload decoded into the bound
 * class; types without a binding are ignored.
 */
public abstract class AbstractProjection implements Projection {
  private static final Logger LOG = LoggerFactory.getLogger(AbstractProjection.class);

  private final String name;
  private final Map<String, Binding<?>> bindings = new HashMap<>();

  protected AbstractProjection(String name) {
    this.name = name;
  }

  protected final <P> void on(String eventType, Class<P> payloadType, EventApplier<P> applier) {
    if (bindings.putIfAbsent(eventType, new Binding<>(payloadType, applier)) != null) {
      throw new IllegalStateException(
          "Projection " + name + " already handles event type " + eventType);
    }
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Set<String> eventTypes() {
    return Set.copyOf(bindings.keySet());
  }

  @Override
  public void processEvent(EventEnvelope envelope) {
    Binding<?> binding = bindings.get(envelope.eventType());
    if (binding == null) {
      LOG.debug("{} ignores event type {}", name, envelope.eventType());
      return;
    }
    applyBound(envelope, () -> binding.apply(envelope));
  }

  /** Runs the decode-and-apply step; subclasses wrap it, e.g. in a transaction. */
  protected void applyBound(EventEnvelope envelope, Runnable application) {
    application.run();
  }

  private record Binding<P>(Class<P> payloadType, EventApplier<P> applier) {

    void apply(EventEnvelope envelope) {
      P payload;
      try {
        payload = Jsons.fromJson(envelope.payload(), payloadType);
      } catch (IllegalArgumentException e) {
        throw new ProjectionException(
            "Cannot decode " + envelope.eventType() + " payload as " + payloadType.getSimpleName(),
            envelope.eventType(),
            envelope.aggregateId(),
            e);
      }
      applier.apply(envelope, payload);
    }
  }
}
