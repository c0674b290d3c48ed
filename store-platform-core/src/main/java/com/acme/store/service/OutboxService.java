package com.acme.store.service;

import com.acme.store.domain.Outbox;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Outbox operations used by the outbox publisher and relay. */
public interface OutboxService {

  /** Stage entries inside the caller's transaction. */
  void stage(List<Outbox> entries);

  Optional<Outbox> claimOne(UUID messageId);

  List<Outbox> claim(int max);

  void markPublished(long id);

  void reschedule(long id, long backoffMs, String error);

  void release(long id);

  int recoverStuck(Duration olderThan);
}
