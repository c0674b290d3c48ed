package com.acme.store.processor.projection;

import com.acme.store.core.ConflictException;
import com.acme.store.event.EventEnvelope;
import com.acme.store.repository.CheckpointRepository;
import com.acme.store.spi.TransactionalStore;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projection made idempotent by a per-aggregate checkpoint. The read-model mutation and the
 * checkpoint advance commit together; an event at or below the checkpoint is skipped.
 */
public abstract class CheckpointedProjection extends AbstractProjection {
  private static final Logger LOG = LoggerFactory.getLogger(CheckpointedProjection.class);

  private final TransactionalStore store;
  private final CheckpointRepository checkpoints;

  protected CheckpointedProjection(
      String name, TransactionalStore store, CheckpointRepository checkpoints) {
    super(name);
    this.store = store;
    this.checkpoints = checkpoints;
  }

  @Override
  protected void applyBound(EventEnvelope envelope, Runnable application) {
    store.executeWrite(
        () -> {
          OptionalLong applied = checkpoints.findPosition(name(), envelope.aggregateId());
          if (applied.isPresent() && envelope.streamPosition() <= applied.getAsLong()) {
            LOG.debug(
                "{} skips {} aggregate={} position={} (checkpoint {})",
                name(),
                envelope.eventType(),
                envelope.aggregateId(),
                envelope.streamPosition(),
                applied.getAsLong());
            return null;
          }
          application.run();
          if (!checkpoints.advance(name(), envelope.aggregateId(), envelope.streamPosition())) {
            throw new ConflictException(
                "Checkpoint of " + name() + " for " + envelope.aggregateId()
                    + " moved concurrently past " + envelope.streamPosition());
          }
          return null;
        });
  }
}
