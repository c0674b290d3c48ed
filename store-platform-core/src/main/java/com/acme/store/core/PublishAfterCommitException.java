package com.acme.store.core;

import com.acme.store.event.DomainEvent;
import java.util.List;

/**
 * The transaction committed but its events could not be handed to the bus. The write stands; the
 * caller gets the committed result and the events that still need publishing.
 */
public class PublishAfterCommitException extends RuntimeException {
  private final transient Object committedResult;
  private final transient List<DomainEvent> unpublishedEvents;

  public PublishAfterCommitException(
      Object committedResult, List<DomainEvent> unpublishedEvents, Throwable cause) {
    super(
        "Committed but failed to publish " + unpublishedEvents.size() + " event(s): "
            + cause.getMessage(),
        cause);
    this.committedResult = committedResult;
    this.unpublishedEvents = List.copyOf(unpublishedEvents);
  }

  public Object getCommittedResult() {
    return committedResult;
  }

  public List<DomainEvent> getUnpublishedEvents() {
    return unpublishedEvents;
  }
}
