package com.acme.store.processor.outbox;

import com.acme.store.config.TimeoutConfig;
import com.acme.store.domain.Outbox;
import com.acme.store.service.OutboxService;
import com.acme.store.spi.MessageBus;
import com.acme.store.spi.TransactionalStore;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves staged outbox rows onto the bus. Rows are claimed in a short transaction and published
 * outside it; a failed publish is rescheduled with exponential backoff. Rows of one aggregate go
 * out in staging order: once a row fails, later rows of its aggregate wait for it.
 */
@Singleton
@Requires(property = "messaging.publish-mode", value = "OUTBOX")
public class OutboxRelay {
  private static final Logger LOG = LoggerFactory.getLogger(OutboxRelay.class);

  private final OutboxService store;
  private final MessageBus bus;
  private final TransactionalStore transactions;
  private final TimeoutConfig timeoutConfig;

  public OutboxRelay(
      OutboxService store,
      MessageBus bus,
      TimeoutConfig timeoutConfig,
      TransactionalStore transactions) {
    this.store = store;
    this.bus = bus;
    this.timeoutConfig = timeoutConfig;
    this.transactions = transactions;
  }

  /**
   * Publish one staged row immediately if it can be claimed.
   *
   * @return true if the row was published, false if it was not claimable or the bus rejected it
   */
  public boolean publishNow(UUID messageId) {
    return transactions
        .executeWrite(() -> store.claimOne(messageId))
        .map(this::sendAndMark)
        .orElse(false);
  }

  /**
   * Release rows stuck in CLAIMED, then claim and publish one batch.
   *
   * @return the number of rows claimed
   */
  @Scheduled(fixedDelay = "${timeout.outbox-sweep-interval:1s}")
  public int sweepOnce() {
    int recovered = store.recoverStuck(timeoutConfig.getOutboxClaimTimeout());
    if (recovered > 0) {
      LOG.info("Recovered {} stuck CLAIMED outbox rows", recovered);
    }
    List<Outbox> rows =
        transactions.executeWrite(() -> store.claim(timeoutConfig.getOutboxBatchSize()));
    if (!rows.isEmpty()) {
      LOG.debug("Sweeping {} outbox rows", rows.size());
    }
    Set<String> held = new HashSet<>();
    for (Outbox row : rows) {
      if (held.contains(row.getAggregateId())) {
        store.release(row.getId());
        LOG.debug(
            "Released outbox id={} behind a failed entry of aggregate {}",
            row.getId(),
            row.getAggregateId());
      } else if (!sendAndMark(row)) {
        held.add(row.getAggregateId());
      }
    }
    return rows.size();
  }

  private boolean sendAndMark(Outbox row) {
    try {
      bus.publish(row.toEnvelope());
    } catch (RuntimeException e) {
      long backoff = backoffMillis(row.getAttempts());
      LOG.warn(
          "Failed to publish outbox id={} messageId={}, retry in {} ms: {}",
          row.getId(),
          row.getMessageId(),
          backoff,
          e.toString());
      store.reschedule(row.getId(), backoff, e.toString());
      return false;
    }
    store.markPublished(row.getId());
    LOG.debug("Published outbox id={} type={}", row.getId(), row.getEventType());
    return true;
  }

  long backoffMillis(int attempts) {
    return Math.min(
        timeoutConfig.getMaxBackoffMillis(), (long) Math.pow(2, Math.max(1, attempts + 1)) * 1000L);
  }
}
