package com.acme.store.persistence.jdbc.outbox;

import com.acme.store.core.Jsons;
import com.acme.store.domain.Outbox;
import com.acme.store.persistence.jdbc.ExceptionTranslator;
import com.acme.store.persistence.jdbc.mapper.OutboxMapper;
import com.acme.store.repository.OutboxRepository;
import io.micronaut.transaction.TransactionOperations;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of OutboxRepository using Template Method pattern. Subclasses
 * override database-specific SQL methods.
 *
 * <p>Rows of one aggregate are handed out in insertion order: a row is never claimed while an
 * earlier row of the same aggregate is still NEW or CLAIMED elsewhere.
 */
public abstract class JdbcOutboxRepository implements OutboxRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcOutboxRepository.class);

  protected final TransactionOperations<Connection> transactionOps;
  protected final Clock clock;

  protected JdbcOutboxRepository(TransactionOperations<Connection> transactionOps, Clock clock) {
    this.transactionOps = transactionOps;
    this.clock = clock;
  }

  @Override
  public long insert(Outbox outbox) {
    Instant now = clock.instant();
    return transactionOps.executeWrite(
        status -> {
          try (PreparedStatement ps =
              status
                  .getConnection()
                  .prepareStatement(getInsertSql(), Statement.RETURN_GENERATED_KEYS)) {
            ps.setObject(1, outbox.getMessageId());
            ps.setString(2, outbox.getTopic());
            ps.setString(3, outbox.getEventType());
            ps.setString(4, outbox.getAggregateId());
            ps.setLong(5, outbox.getStreamPosition());
            ps.setTimestamp(6, Timestamp.from(outbox.getOccurredAt()));
            ps.setString(7, outbox.getPayload());
            ps.setString(8, headersJson(outbox.getHeaders()));
            ps.setTimestamp(9, Timestamp.from(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
              if (!keys.next()) {
                throw new SQLException("No id generated for outbox entry");
              }
              long id = keys.getLong(1);
              LOG.debug(
                  "Staged outbox entry id={} messageId={} type={}",
                  id,
                  outbox.getMessageId(),
                  outbox.getEventType());
              return id;
            }
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert outbox entry", LOG);
          }
        });
  }

  @Override
  public Optional<Outbox> claimByMessageId(UUID messageId) {
    return transactionOps.executeWrite(
        status -> {
          Connection conn = status.getConnection();
          try {
            try (PreparedStatement ps = conn.prepareStatement(getClaimByMessageIdSql())) {
              ps.setTimestamp(1, Timestamp.from(clock.instant()));
              ps.setObject(2, messageId);
              if (ps.executeUpdate() == 0) {
                return Optional.<Outbox>empty();
              }
            }
            try (PreparedStatement ps = conn.prepareStatement(getSelectByMessageIdSql())) {
              ps.setObject(1, messageId);
              try (ResultSet rs = ps.executeQuery()) {
                return rs.next()
                    ? Optional.of(OutboxMapper.toDomain(rs))
                    : Optional.<Outbox>empty();
              }
            }
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(
                e, "claim outbox entry by message id", LOG);
          }
        });
  }

  /**
   * Selects due candidates, then claims them in id order. A candidate is taken only when every
   * earlier pending row of its aggregate was claimed by this batch; the claim itself is a
   * conditional update so that a row taken by a concurrent relay in between is skipped.
   */
  @Override
  public List<Outbox> claimBatch(int max) {
    Instant now = clock.instant();
    return transactionOps.executeWrite(
        status -> {
          Connection conn = status.getConnection();
          try {
            List<Outbox> candidates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(getSelectDueSql())) {
              ps.setTimestamp(1, Timestamp.from(now));
              ps.setInt(2, max);
              try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                  candidates.add(OutboxMapper.toDomain(rs));
                }
              }
            }
            List<Outbox> claimed = new ArrayList<>();
            Map<String, Integer> claimedPerAggregate = new HashMap<>();
            try (PreparedStatement pending = conn.prepareStatement(getCountPendingBeforeSql());
                PreparedStatement claim = conn.prepareStatement(getClaimByIdSql())) {
              for (Outbox candidate : candidates) {
                int claimedBefore =
                    claimedPerAggregate.getOrDefault(candidate.getAggregateId(), 0);
                if (countPendingBefore(pending, candidate) != claimedBefore) {
                  LOG.debug(
                      "Outbox id={} waits behind an earlier entry of aggregate {}",
                      candidate.getId(),
                      candidate.getAggregateId());
                  continue;
                }
                claim.setTimestamp(1, Timestamp.from(now));
                claim.setLong(2, candidate.getId());
                if (claim.executeUpdate() == 1) {
                  candidate.setStatus(Outbox.STATUS_CLAIMED);
                  claimed.add(candidate);
                  claimedPerAggregate.merge(candidate.getAggregateId(), 1, Integer::sum);
                }
              }
            }
            return claimed;
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(
                e, "claim batch of outbox entries", LOG);
          }
        });
  }

  private int countPendingBefore(PreparedStatement ps, Outbox candidate) throws SQLException {
    ps.setString(1, candidate.getAggregateId());
    ps.setLong(2, candidate.getId());
    try (ResultSet rs = ps.executeQuery()) {
      rs.next();
      return rs.getInt(1);
    }
  }

  @Override
  public void markPublished(long id) {
    update(getMarkPublishedSql(), "mark outbox entry as published", id,
        ps -> {
          ps.setTimestamp(1, Timestamp.from(clock.instant()));
          ps.setLong(2, id);
        });
  }

  @Override
  public void reschedule(long id, long backoffMs, String error) {
    Instant nextAt = clock.instant().plusMillis(backoffMs);
    update(getRescheduleSql(), "reschedule outbox entry", id,
        ps -> {
          ps.setTimestamp(1, Timestamp.from(nextAt));
          ps.setString(2, error);
          ps.setLong(3, id);
        });
  }

  @Override
  public void release(long id) {
    update(getReleaseSql(), "release outbox entry", id, ps -> ps.setLong(1, id));
  }

  @Override
  public int recoverStuck(Duration olderThan) {
    Instant threshold = clock.instant().minus(olderThan);
    return transactionOps.executeWrite(
        status -> {
          try (PreparedStatement ps =
              status.getConnection().prepareStatement(getRecoverStuckSql())) {
            ps.setTimestamp(1, Timestamp.from(threshold));
            return ps.executeUpdate();
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "recover stuck outbox entries", LOG);
          }
        });
  }

  private void update(String sql, String operation, long id, Binder binder) {
    int updated =
        transactionOps.executeWrite(
            status -> {
              try (PreparedStatement ps = status.getConnection().prepareStatement(sql)) {
                binder.bind(ps);
                return ps.executeUpdate();
              } catch (SQLException e) {
                throw ExceptionTranslator.translateException(e, operation, LOG);
              }
            });
    if (updated == 0) {
      LOG.warn("No rows updated for {}: id={}", operation, id);
    }
  }

  protected String headersJson(Map<String, String> headers) {
    return headers == null || headers.isEmpty() ? "{}" : Jsons.toJson(headers);
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  // Template methods for database-specific SQL

  /**
   * Parameters: message_id, topic, event_type, aggregate_id, stream_position, occurred_at,
   * payload, headers, created_at.
   */
  protected abstract String getInsertSql();

  /**
   * Parameters: claimed_at, message_id. Must not match while an earlier row of the same aggregate
   * is NEW or CLAIMED.
   */
  protected abstract String getClaimByMessageIdSql();

  /** Parameters: message_id. */
  protected abstract String getSelectByMessageIdSql();

  /** Parameters: now, limit. */
  protected abstract String getSelectDueSql();

  /** Parameters: aggregate_id, id. Counts NEW or CLAIMED rows of the aggregate before id. */
  protected abstract String getCountPendingBeforeSql();

  /** Parameters: claimed_at, id. */
  protected abstract String getClaimByIdSql();

  /** Parameters: published_at, id. */
  protected abstract String getMarkPublishedSql();

  /** Parameters: next_at, last_error, id. */
  protected abstract String getRescheduleSql();

  /** Parameters: id. */
  protected abstract String getReleaseSql();

  /** Parameters: claimed-before threshold. */
  protected abstract String getRecoverStuckSql();
}
