package com.acme.store.uow;

import com.acme.store.domain.AggregateRoot;
import com.acme.store.event.DomainEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Event buffer of one unit of work, in raised order. */
public class EventCollector {
  private final List<DomainEvent> events = new ArrayList<>();

  public void collectFrom(AggregateRoot aggregate) {
    events.addAll(aggregate.pullEvents());
  }

  public void add(DomainEvent event) {
    events.add(event);
  }

  public List<DomainEvent> events() {
    return Collections.unmodifiableList(events);
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }
}
