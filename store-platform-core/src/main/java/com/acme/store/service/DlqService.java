package com.acme.store.service;

import com.acme.store.event.EventEnvelope;

/** Parks envelopes that a consumer gave up on. */
public interface DlqService {

  /**
   * Park {@code envelope} for manual intervention.
   *
   * @param queue the queue it was consumed from
   * @param error the failure of the last attempt
   * @param attempts number of delivery attempts made
   * @param parkedBy the component that gave up
   */
  void park(EventEnvelope envelope, String queue, Throwable error, int attempts, String parkedBy);
}
