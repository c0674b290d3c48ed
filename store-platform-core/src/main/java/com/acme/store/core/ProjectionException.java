package com.acme.store.core;

/** A projection could not apply an event; the delivery is retried and eventually dead-lettered. */
public class ProjectionException extends RuntimeException {
  private final String eventType;
  private final String aggregateId;

  public ProjectionException(String message, String eventType, String aggregateId, Throwable e) {
    super(message, e);
    this.eventType = eventType;
    this.aggregateId = aggregateId;
  }

  public String getEventType() {
    return eventType;
  }

  public String getAggregateId() {
    return aggregateId;
  }
}
