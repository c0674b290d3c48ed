package com.acme.commerce.infrastructure.persistence;

import com.acme.commerce.domain.model.Order;
import com.acme.commerce.domain.model.ShopItem;
import com.acme.commerce.domain.repository.OrderRepository;
import com.acme.store.core.ConflictException;
import com.acme.store.core.Jsons;
import com.acme.store.persistence.jdbc.ExceptionTranslator;
import com.acme.store.uow.EventCollector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micronaut.transaction.TransactionOperations;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** JDBC implementation of OrderRepository. Shop items are stored as a JSON column. */
@Slf4j
public class JdbcOrderRepository implements OrderRepository {
  private static final TypeReference<List<ShopItem>> SHOP_ITEMS = new TypeReference<>() {};

  private static final String SELECT_SQL =
      """
      SELECT order_id, account_email, delivery_address, delivered_time, shop_items, version
      FROM customer_order
      WHERE order_id = ?
      """;

  private static final String INSERT_SQL =
      """
      INSERT INTO customer_order (order_id, account_email, delivery_address, delivered_time,
                                  shop_items, version, created_at)
      VALUES (?, ?, ?, ?, ?, ?, ?)
      """;

  private static final String BUMP_VERSION_SQL =
      "UPDATE customer_order SET version = ? WHERE order_id = ? AND version = ?";

  private final TransactionOperations<Connection> transactionOps;
  private final EventCollector collector;
  private final Clock clock;

  public JdbcOrderRepository(
      TransactionOperations<Connection> transactionOps, EventCollector collector, Clock clock) {
    this.transactionOps = transactionOps;
    this.collector = collector;
    this.clock = clock;
  }

  @Override
  public Optional<Order> load(String orderId) {
    log.debug("Loading order: {}", orderId);
    return transactionOps.executeRead(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(SELECT_SQL)) {
            ps.setString(1, orderId);
            try (ResultSet rs = ps.executeQuery()) {
              if (!rs.next()) {
                return Optional.<Order>empty();
              }
              Timestamp delivered = rs.getTimestamp("delivered_time");
              return Optional.of(
                  new Order(
                      rs.getString("order_id"),
                      rs.getLong("version"),
                      readItems(rs.getString("shop_items")),
                      rs.getString("account_email"),
                      rs.getString("delivery_address"),
                      delivered == null ? null : delivered.toInstant(),
                      clock));
            }
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "load order", log);
          }
        });
  }

  @Override
  public void save(Order order) {
    log.debug("Saving order: {} at version {}", order.getId(), order.getVersion());
    int updated =
        transactionOps.executeWrite(
            status -> {
              Connection conn = status.getConnection();
              try {
                if (order.isNew()) {
                  try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                    ps.setString(1, order.getId());
                    ps.setString(2, order.getAccountEmail());
                    ps.setString(3, order.getDeliveryAddress());
                    ps.setTimestamp(
                        4,
                        order.getDeliveredTime() == null
                            ? null
                            : Timestamp.from(order.getDeliveredTime()));
                    ps.setString(5, Jsons.toJson(order.getShopItems()));
                    ps.setLong(6, order.getVersion());
                    ps.setTimestamp(7, Timestamp.from(clock.instant()));
                    return ps.executeUpdate();
                  }
                }
                try (PreparedStatement ps = conn.prepareStatement(BUMP_VERSION_SQL)) {
                  ps.setLong(1, order.getVersion());
                  ps.setString(2, order.getId());
                  ps.setLong(3, order.getPersistedVersion());
                  return ps.executeUpdate();
                }
              } catch (SQLException e) {
                throw ExceptionTranslator.translateException(e, "save order", log);
              }
            });
    if (updated == 0) {
      throw new ConflictException("Order " + order.getId() + " was modified concurrently");
    }
    collector.collectFrom(order);
  }

  private static List<ShopItem> readItems(String json) {
    try {
      return Jsons.mapper().readValue(json, SHOP_ITEMS);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored shop items are not valid JSON", e);
    }
  }
}
