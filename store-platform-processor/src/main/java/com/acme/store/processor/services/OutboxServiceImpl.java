package com.acme.store.processor.services;

import com.acme.store.domain.Outbox;
import com.acme.store.repository.OutboxRepository;
import com.acme.store.service.OutboxService;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Singleton
public class OutboxServiceImpl implements OutboxService {
  private final OutboxRepository repository;

  public OutboxServiceImpl(OutboxRepository repository) {
    this.repository = repository;
  }

  @Override
  public void stage(List<Outbox> entries) {
    for (Outbox entry : entries) {
      entry.setId(repository.insert(entry));
    }
  }

  @Override
  public Optional<Outbox> claimOne(UUID messageId) {
    return repository.claimByMessageId(messageId);
  }

  @Override
  public List<Outbox> claim(int max) {
    return repository.claimBatch(max);
  }

  @Override
  public void markPublished(long id) {
    repository.markPublished(id);
  }

  @Override
  public void reschedule(long id, long backoffMs, String error) {
    repository.reschedule(id, backoffMs, error);
  }

  @Override
  public void release(long id) {
    repository.release(id);
  }

  @Override
  public int recoverStuck(Duration olderThan) {
    return repository.recoverStuck(olderThan);
  }
}
