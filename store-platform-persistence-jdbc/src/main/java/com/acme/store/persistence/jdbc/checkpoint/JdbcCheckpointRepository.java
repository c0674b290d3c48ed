package com.acme.store.persistence.jdbc.checkpoint;

import com.acme.store.persistence.jdbc.ExceptionTranslator;
import com.acme.store.repository.CheckpointRepository;
import io.micronaut.transaction.TransactionOperations;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of CheckpointRepository using Template Method pattern. The default
 * {@link #advance} moves an existing row forward and otherwise inserts one if absent; dialects
 * with an upsert override it.
 */
public abstract class JdbcCheckpointRepository implements CheckpointRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcCheckpointRepository.class);

  protected final TransactionOperations<Connection> transactionOps;
  protected final Clock clock;

  protected JdbcCheckpointRepository(
      TransactionOperations<Connection> transactionOps, Clock clock) {
    this.transactionOps = transactionOps;
    this.clock = clock;
  }

  @Override
  public OptionalLong findPosition(String projection, String aggregateId) {
    return transactionOps.executeRead(
        status -> {
          try (PreparedStatement ps =
              status.getConnection().prepareStatement(getFindPositionSql())) {
            ps.setString(1, projection);
            ps.setString(2, aggregateId);
            try (ResultSet rs = ps.executeQuery()) {
              return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find projection checkpoint", LOG);
          }
        });
  }

  @Override
  public boolean advance(String projection, String aggregateId, long position) {
    Timestamp now = Timestamp.from(clock.instant());
    boolean advanced =
        transactionOps.executeWrite(
            status -> {
              Connection conn = status.getConnection();
              try {
                try (PreparedStatement ps = conn.prepareStatement(getMoveForwardSql())) {
                  ps.setLong(1, position);
                  ps.setTimestamp(2, now);
                  ps.setString(3, projection);
                  ps.setString(4, aggregateId);
                  ps.setLong(5, position);
                  if (ps.executeUpdate() == 1) {
                    return true;
                  }
                }
                try (PreparedStatement ps = conn.prepareStatement(getInsertIfAbsentSql())) {
                  ps.setString(1, projection);
                  ps.setString(2, aggregateId);
                  ps.setLong(3, position);
                  ps.setTimestamp(4, now);
                  ps.setString(5, projection);
                  ps.setString(6, aggregateId);
                  return ps.executeUpdate() == 1;
                }
              } catch (SQLException e) {
                throw ExceptionTranslator.translateException(
                    e, "advance projection checkpoint", LOG);
              }
            });
    LOG.trace("Checkpoint {}/{} -> {} advanced={}", projection, aggregateId, position, advanced);
    return advanced;
  }

  // Template methods for database-specific SQL

  /** Parameters: projection, aggregate_id. */
  protected abstract String getFindPositionSql();

  /** Parameters: new position, updated_at, projection, aggregate_id, new position. */
  protected abstract String getMoveForwardSql();

  /** Parameters: projection, aggregate_id, position, updated_at, projection, aggregate_id. */
  protected abstract String getInsertIfAbsentSql();
}
