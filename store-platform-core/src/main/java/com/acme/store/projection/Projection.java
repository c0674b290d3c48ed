package com.acme.store.projection;

import com.acme.store.event.EventEnvelope;
import java.util.Set;

/** Applies events to one read model. Applying the same event twice must leave it unchanged. */
public interface Projection {

  /** Name under which checkpoints and logs are kept. */
  String name();

  /** Event types this projection reacts to. */
  Set<String> eventTypes();

  /**
   * Apply {@code envelope}. Unknown event types are ignored.
   *
   * @throws com.acme.store.core.ProjectionException if the event cannot be applied
   */
  void processEvent(EventEnvelope envelope);
}
