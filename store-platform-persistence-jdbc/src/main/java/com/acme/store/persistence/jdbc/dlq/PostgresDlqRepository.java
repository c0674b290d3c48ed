package com.acme.store.persistence.jdbc.dlq;

import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;

/** PostgreSQL-specific implementation of DlqRepository */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresDlqRepository extends JdbcDlqRepository {

  public PostgresDlqRepository(TransactionOperations<Connection> transactionOps) {
    super(transactionOps);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO store.dead_letter
        (id, message_id, queue, event_type, aggregate_id, stream_position, payload, headers,
         error_class, error_message, attempts, parked_by, parked_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getFindByQueueSql() {
    return """
        SELECT id, message_id, queue, event_type, aggregate_id, stream_position, payload,
               headers::text AS headers, error_class, error_message, attempts, parked_by, parked_at
        FROM store.dead_letter
        WHERE queue = ?
        ORDER BY parked_at ASC, stream_position ASC
        """;
  }
}
