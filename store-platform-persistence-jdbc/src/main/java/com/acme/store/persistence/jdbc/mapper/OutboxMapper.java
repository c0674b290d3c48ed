package com.acme.store.persistence.jdbc.mapper;

import com.acme.store.core.Jsons;
import com.acme.store.domain.Outbox;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/** Maps outbox rows to {@link Outbox} entities. */
public final class OutboxMapper {

  public static final String COLUMNS =
      "id, message_id, topic, event_type, aggregate_id, stream_position, occurred_at, payload,"
          + " headers, status, attempts, next_at, created_at, published_at, last_error";

  private OutboxMapper() {}

  public static Outbox toDomain(ResultSet rs) throws SQLException {
    Outbox outbox = new Outbox();
    outbox.setId(rs.getLong("id"));
    outbox.setMessageId(rs.getObject("message_id", UUID.class));
    outbox.setTopic(rs.getString("topic"));
    outbox.setEventType(rs.getString("event_type"));
    outbox.setAggregateId(rs.getString("aggregate_id"));
    outbox.setStreamPosition(rs.getLong("stream_position"));
    outbox.setOccurredAt(toInstant(rs.getTimestamp("occurred_at")));
    outbox.setPayload(rs.getString("payload"));
    outbox.setHeaders(Jsons.toStringMap(rs.getString("headers")));
    outbox.setStatus(rs.getString("status"));
    outbox.setAttempts(rs.getInt("attempts"));
    outbox.setNextAt(toInstant(rs.getTimestamp("next_at")));
    outbox.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
    outbox.setPublishedAt(toInstant(rs.getTimestamp("published_at")));
    outbox.setLastError(rs.getString("last_error"));
    return outbox;
  }

  static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
