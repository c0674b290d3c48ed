package com.acme.store.persistence.jdbc.dlq;

import com.acme.store.domain.Dlq;
import com.acme.store.persistence.jdbc.ExceptionTranslator;
import com.acme.store.persistence.jdbc.mapper.DlqMapper;
import com.acme.store.repository.DlqRepository;
import io.micronaut.transaction.TransactionOperations;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of DlqRepository using Template Method pattern. Subclasses
 * override database-specific SQL methods.
 */
public abstract class JdbcDlqRepository implements DlqRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcDlqRepository.class);

  protected final TransactionOperations<Connection> transactionOps;

  protected JdbcDlqRepository(TransactionOperations<Connection> transactionOps) {
    this.transactionOps = transactionOps;
  }

  @Override
  public void insert(Dlq entry) {
    transactionOps.executeWrite(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(getInsertSql())) {
            ps.setObject(1, entry.getId());
            ps.setObject(2, entry.getMessageId());
            ps.setString(3, entry.getQueue());
            ps.setString(4, entry.getEventType());
            ps.setString(5, entry.getAggregateId());
            ps.setLong(6, entry.getStreamPosition());
            ps.setString(7, entry.getPayload());
            ps.setString(8, entry.getHeaders() == null ? "{}" : entry.getHeaders());
            ps.setString(9, entry.getErrorClass());
            ps.setString(10, entry.getErrorMessage());
            ps.setInt(11, entry.getAttempts());
            ps.setString(12, entry.getParkedBy());
            ps.setTimestamp(13, Timestamp.from(entry.getParkedAt()));
            return ps.executeUpdate();
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert DLQ entry", LOG);
          }
        });
    LOG.debug(
        "Inserted DLQ entry: messageId={}, queue={}, eventType={}, parkedBy={}",
        entry.getMessageId(),
        entry.getQueue(),
        entry.getEventType(),
        entry.getParkedBy());
  }

  @Override
  public List<Dlq> findByQueue(String queue) {
    return transactionOps.executeRead(
        status -> {
          try (PreparedStatement ps =
              status.getConnection().prepareStatement(getFindByQueueSql())) {
            ps.setString(1, queue);
            List<Dlq> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) {
                results.add(DlqMapper.toDomain(rs));
              }
            }
            return results;
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find DLQ entries by queue", LOG);
          }
        });
  }

  // Template methods for database-specific SQL

  protected abstract String getInsertSql();

  protected abstract String getFindByQueueSql();
}
