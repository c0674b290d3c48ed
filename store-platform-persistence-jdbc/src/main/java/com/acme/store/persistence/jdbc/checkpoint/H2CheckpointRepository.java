package com.acme.store.persistence.jdbc.checkpoint;

import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.time.Clock;

/** H2-specific implementation of CheckpointRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2CheckpointRepository extends JdbcCheckpointRepository {

  public H2CheckpointRepository(TransactionOperations<Connection> transactionOps) {
    super(transactionOps, Clock.systemUTC());
  }

  @Override
  protected String getFindPositionSql() {
    return """
        SELECT stream_position FROM projection_checkpoint
        WHERE projection = ? AND aggregate_id = ?
        """;
  }

  @Override
  protected String getMoveForwardSql() {
    return """
        UPDATE projection_checkpoint
        SET stream_position = ?, updated_at = ?
        WHERE projection = ? AND aggregate_id = ? AND stream_position < ?
        """;
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO projection_checkpoint (projection, aggregate_id, stream_position, updated_at)
        SELECT ?, ?, ?, ?
        WHERE NOT EXISTS(
          SELECT 1 FROM projection_checkpoint WHERE projection = ? AND aggregate_id = ?)
        """;
  }
}
