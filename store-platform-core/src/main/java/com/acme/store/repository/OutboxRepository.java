package com.acme.store.repository;

import com.acme.store.domain.Outbox;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Transactional outbox: envelopes staged with the write and relayed afterwards. */
public interface OutboxRepository {

  /**
   * Insert a NEW entry inside the caller's transaction.
   *
   * @return the generated row id
   */
  long insert(Outbox outbox);

  /**
   * Claim the entry carrying {@code messageId} if it is still NEW and no earlier entry of the same
   * aggregate is NEW or CLAIMED.
   */
  Optional<Outbox> claimByMessageId(UUID messageId);

  /**
   * Claim up to {@code max} due entries, oldest first. An entry is skipped while an earlier entry
   * of its aggregate is pending and not part of the same batch.
   */
  List<Outbox> claimBatch(int max);

  void markPublished(long id);

  /** Release a claimed entry for another attempt after {@code backoffMs}. */
  void reschedule(long id, long backoffMs, String error);

  /** Put a claimed entry back to NEW without counting an attempt. */
  void release(long id);

  /** Release entries that have stayed CLAIMED longer than {@code olderThan}. */
  int recoverStuck(Duration olderThan);
}
