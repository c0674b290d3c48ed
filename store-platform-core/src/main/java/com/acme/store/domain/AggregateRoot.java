package com.acme.store.domain;

import com.acme.store.event.DomainEvent;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for write-side entities. An aggregate owns the events it raises until the unit of
 * work that loaded it commits; {@link #getVersion()} is the stream position of the last raised
 * event and {@link #getPersistedVersion()} the one the store currently holds.
 */
public abstract class AggregateRoot {

  private final String id;
  private final Clock clock;
  private long version;
  private final List<DomainEvent> pendingEvents = new ArrayList<>();

  protected AggregateRoot(String id, long version) {
    this(id, version, Clock.systemUTC());
  }

  protected AggregateRoot(String id, long version, Clock clock) {
    this.id = Objects.requireNonNull(id, "id");
    this.version = version;
    this.clock = clock;
  }

  public String getId() {
    return id;
  }

  protected Clock getClock() {
    return clock;
  }

  public long getVersion() {
    return version;
  }

  /** Version the aggregate had when it was loaded, used for the optimistic concurrency check. */
  public long getPersistedVersion() {
    return version - pendingEvents.size();
  }

  public boolean isNew() {
    return getPersistedVersion() == 0;
  }

  protected DomainEvent raise(String eventType, Object payload) {
    version++;
    DomainEvent event = new DomainEvent(eventType, id, version, clock.instant(), payload);
    pendingEvents.add(event);
    return event;
  }

  public List<DomainEvent> getPendingEvents() {
    return Collections.unmodifiableList(pendingEvents);
  }

  /** Returns the pending events in raised order and forgets them. */
  public List<DomainEvent> pullEvents() {
    List<DomainEvent> events = List.copyOf(pendingEvents);
    pendingEvents.clear();
    return events;
  }
}
