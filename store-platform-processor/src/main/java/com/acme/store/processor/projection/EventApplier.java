package com.acme.store.processor.projection;

import com.acme.store.event.EventEnvelope;

/** Applies one decoded event payload to a read model. */
@FunctionalInterface
public interface EventApplier<P> {
  void apply(EventEnvelope envelope, P payload);
}
