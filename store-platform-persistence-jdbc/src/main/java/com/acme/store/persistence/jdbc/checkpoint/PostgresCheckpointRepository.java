package com.acme.store.persistence.jdbc.checkpoint;

import com.acme.store.persistence.jdbc.ExceptionTranslator;
import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** PostgreSQL-specific implementation of CheckpointRepository, advancing with one upsert. */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresCheckpointRepository extends JdbcCheckpointRepository {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresCheckpointRepository.class);

  public PostgresCheckpointRepository(TransactionOperations<Connection> transactionOps) {
    super(transactionOps, Clock.systemUTC());
  }

  @Override
  public boolean advance(String projection, String aggregateId, long position) {
    return transactionOps.executeWrite(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(getUpsertSql())) {
            ps.setString(1, projection);
            ps.setString(2, aggregateId);
            ps.setLong(3, position);
            ps.setTimestamp(4, Timestamp.from(clock.instant()));
            return ps.executeUpdate() == 1;
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "advance projection checkpoint", LOG);
          }
        });
  }

  protected String getUpsertSql() {
    return """
        INSERT INTO store.projection_checkpoint
        (projection, aggregate_id, stream_position, updated_at)
        VALUES (?, ?, ?, ?)
        ON CONFLICT (projection, aggregate_id) DO UPDATE
        SET stream_position = EXCLUDED.stream_position, updated_at = EXCLUDED.updated_at
        WHERE store.projection_checkpoint.stream_position < EXCLUDED.stream_position
        """;
  }

  @Override
  protected String getFindPositionSql() {
    return """
        SELECT stream_position FROM store.projection_checkpoint
        WHERE projection = ? AND aggregate_id = ?
        """;
  }

  @Override
  protected String getMoveForwardSql() {
    return """
        UPDATE store.projection_checkpoint
        SET stream_position = ?, updated_at = ?
        WHERE projection = ? AND aggregate_id = ? AND stream_position < ?
        """;
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO store.projection_checkpoint
        (projection, aggregate_id, stream_position, updated_at)
        SELECT ?, ?, ?, ?
        WHERE NOT EXISTS(
          SELECT 1 FROM store.projection_checkpoint WHERE projection = ? AND aggregate_id = ?)
        """;
  }
}
