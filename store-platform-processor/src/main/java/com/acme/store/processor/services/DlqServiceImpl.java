package com.acme.store.processor.services;

import com.acme.store.core.Jsons;
import com.acme.store.domain.Dlq;
import com.acme.store.event.EventEnvelope;
import com.acme.store.repository.DlqRepository;
import com.acme.store.service.DlqService;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class DlqServiceImpl implements DlqService {
  private static final Logger LOG = LoggerFactory.getLogger(DlqServiceImpl.class);

  private final DlqRepository repository;
  private final Clock clock;

  public DlqServiceImpl(DlqRepository repository) {
    this(repository, Clock.systemUTC());
  }

  @Inject
  public DlqServiceImpl(DlqRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  public void park(
      EventEnvelope envelope, String queue, Throwable error, int attempts, String parkedBy) {
    Dlq entry =
        new Dlq(
            UUID.randomUUID(),
            envelope.messageId(),
            queue,
            envelope.eventType(),
            envelope.aggregateId(),
            envelope.streamPosition(),
            envelope.payload(),
            Jsons.toJson(envelope.headers()),
            error.getClass().getName(),
            error.getMessage(),
            attempts,
            parkedBy,
            clock.instant());
    repository.insert(entry);
    LOG.warn(
        "Parked messageId={} type={} aggregate={} position={} from {} after {} attempt(s)",
        envelope.messageId(),
        envelope.eventType(),
        envelope.aggregateId(),
        envelope.streamPosition(),
        queue,
        attempts);
  }
}
