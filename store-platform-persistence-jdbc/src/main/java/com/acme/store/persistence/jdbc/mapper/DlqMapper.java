package com.acme.store.persistence.jdbc.mapper;

import com.acme.store.domain.Dlq;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

/** Maps dead-letter rows to {@link Dlq} entities. */
public final class DlqMapper {

  private DlqMapper() {}

  public static Dlq toDomain(ResultSet rs) throws SQLException {
    return new Dlq(
        rs.getObject("id", UUID.class),
        rs.getObject("message_id", UUID.class),
        rs.getString("queue"),
        rs.getString("event_type"),
        rs.getString("aggregate_id"),
        rs.getLong("stream_position"),
        rs.getString("payload"),
        rs.getString("headers"),
        rs.getString("error_class"),
        rs.getString("error_message"),
        rs.getInt("attempts"),
        rs.getString("parked_by"),
        OutboxMapper.toInstant(rs.getTimestamp("parked_at")));
  }
}
