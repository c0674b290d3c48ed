package com.acme.store.persistence.jdbc.outbox;

import com.acme.store.persistence.jdbc.mapper.OutboxMapper;
import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.time.Clock;

/**
 * PostgreSQL-specific implementation of OutboxRepository. Due rows are selected with {@code FOR
 * UPDATE SKIP LOCKED} so concurrent relays never wait on each other's batches.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresOutboxRepository extends JdbcOutboxRepository {

  public PostgresOutboxRepository(TransactionOperations<Connection> transactionOps) {
    this(transactionOps, Clock.systemUTC());
  }

  @Inject
  public PostgresOutboxRepository(
      TransactionOperations<Connection> transactionOps, Clock clock) {
    super(transactionOps, clock);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO store.outbox
        (message_id, topic, event_type, aggregate_id, stream_position, occurred_at, payload,
         headers, status, attempts, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, 'NEW', 0, ?)
        """;
  }

  @Override
  protected String getClaimByMessageIdSql() {
    return """
        UPDATE store.outbox o
        SET status = 'CLAIMED', claimed_at = ?
        WHERE o.message_id = ? AND o.status = 'NEW'
          AND NOT EXISTS (
            SELECT 1 FROM store.outbox e
            WHERE e.aggregate_id = o.aggregate_id AND e.id < o.id
              AND e.status IN ('NEW', 'CLAIMED'))
        """;
  }

  @Override
  protected String getSelectByMessageIdSql() {
    return "SELECT " + OutboxMapper.COLUMNS + " FROM store.outbox WHERE message_id = ?";
  }

  @Override
  protected String getSelectDueSql() {
    return "SELECT "
        + OutboxMapper.COLUMNS
        + """
         FROM store.outbox
        WHERE status = 'NEW' AND (next_at IS NULL OR next_at <= ?)
        ORDER BY id ASC
        LIMIT ? FOR UPDATE SKIP LOCKED
        """;
  }

  @Override
  protected String getCountPendingBeforeSql() {
    return """
        SELECT COUNT(*) FROM store.outbox
        WHERE aggregate_id = ? AND id < ? AND status IN ('NEW', 'CLAIMED')
        """;
  }

  @Override
  protected String getClaimByIdSql() {
    return """
        UPDATE store.outbox
        SET status = 'CLAIMED', claimed_at = ?
        WHERE id = ? AND status = 'NEW'
        """;
  }

  @Override
  protected String getMarkPublishedSql() {
    return """
        UPDATE store.outbox
        SET status = 'PUBLISHED', published_at = ?, last_error = NULL
        WHERE id = ?
        """;
  }

  @Override
  protected String getRescheduleSql() {
    return """
        UPDATE store.outbox
        SET status = 'NEW', next_at = ?, last_error = ?, attempts = attempts + 1,
            claimed_at = NULL
        WHERE id = ?
        """;
  }

  @Override
  protected String getReleaseSql() {
    return """
        UPDATE store.outbox
        SET status = 'NEW', claimed_at = NULL
        WHERE id = ? AND status = 'CLAIMED'
        """;
  }

  @Override
  protected String getRecoverStuckSql() {
    return """
        UPDATE store.outbox
        SET status = 'NEW', claimed_at = NULL
        WHERE status = 'CLAIMED' AND claimed_at < ?
        """;
  }
}
