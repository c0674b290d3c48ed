package com.acme.store.persistence.jdbc.outbox;

import com.acme.store.persistence.jdbc.mapper.OutboxMapper;
import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.time.Clock;

/** H2-specific implementation of OutboxRepository. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2OutboxRepository extends JdbcOutboxRepository {

  public H2OutboxRepository(TransactionOperations<Connection> transactionOps) {
    this(transactionOps, Clock.systemUTC());
  }

  @Inject
  public H2OutboxRepository(
      TransactionOperations<Connection> transactionOps, Clock clock) {
    super(transactionOps, clock);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO outbox
        (message_id, topic, event_type, aggregate_id, stream_position, occurred_at, payload,
         headers, status, attempts, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, 'NEW', 0, ?)
        """;
  }

  @Override
  protected String getClaimByMessageIdSql() {
    return """
        UPDATE outbox o
        SET status = 'CLAIMED', claimed_at = ?
        WHERE o.message_id = ? AND o.status = 'NEW'
          AND NOT EXISTS (
            SELECT 1 FROM outbox e
            WHERE e.aggregate_id = o.aggregate_id AND e.id < o.id
              AND e.status IN ('NEW', 'CLAIMED'))
        """;
  }

  @Override
  protected String getSelectByMessageIdSql() {
    return "SELECT " + OutboxMapper.COLUMNS + " FROM outbox WHERE message_id = ?";
  }

  @Override
  protected String getSelectDueSql() {
    return "SELECT "
        + OutboxMapper.COLUMNS
        + """
         FROM outbox
        WHERE status = 'NEW' AND (next_at IS NULL OR next_at <= ?)
        ORDER BY id ASC
        LIMIT ?
        """;
  }

  @Override
  protected String getCountPendingBeforeSql() {
    return """
        SELECT COUNT(*) FROM outbox
        WHERE aggregate_id = ? AND id < ? AND status IN ('NEW', 'CLAIMED')
        """;
  }

  @Override
  protected String getClaimByIdSql() {
    return """
        UPDATE outbox
        SET status = 'CLAIMED', claimed_at = ?
        WHERE id = ? AND status = 'NEW'
        """;
  }

  @Override
  protected String getMarkPublishedSql() {
    return """
        UPDATE outbox
        SET status = 'PUBLISHED', published_at = ?, last_error = NULL
        WHERE id = ?
        """;
  }

  @Override
  protected String getRescheduleSql() {
    return """
        UPDATE outbox
        SET status = 'NEW', next_at = ?, last_error = ?, attempts = attempts + 1,
            claimed_at = NULL
        WHERE id = ?
        """;
  }

  @Override
  protected String getReleaseSql() {
    return """
        UPDATE outbox
        SET status = 'NEW', claimed_at = NULL
        WHERE id = ? AND status = 'CLAIMED'
        """;
  }

  @Override
  protected String getRecoverStuckSql() {
    return """
        UPDATE outbox
        SET status = 'NEW', claimed_at = NULL
        WHERE status = 'CLAIMED' AND claimed_at < ?
        """;
  }
}
