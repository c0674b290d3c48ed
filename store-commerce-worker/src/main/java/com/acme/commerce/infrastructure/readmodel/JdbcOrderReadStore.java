package com.acme.commerce.infrastructure.readmodel;

import com.acme.commerce.domain.model.ShopItem;
import com.acme.store.core.Jsons;
import com.acme.store.persistence.jdbc.ExceptionTranslator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micronaut.transaction.TransactionOperations;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Order read model table; shop items are kept as JSON. */
@Slf4j
public class JdbcOrderReadStore {
  private static final TypeReference<List<ShopItem>> SHOP_ITEMS = new TypeReference<>() {};

  private static final String SELECT_SQL =
      """
      SELECT order_id, account_email, delivery_address, delivered_time, shop_items, item_count,
             total_price, created_at
      FROM order_view
      WHERE order_id = ?
      """;

  private static final String INSERT_SQL =
      """
      INSERT INTO order_view (order_id, account_email, delivery_address, delivered_time,
                              shop_items, item_count, total_price, created_at)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?)
      """;

  private final TransactionOperations<Connection> transactionOps;

  public JdbcOrderReadStore(TransactionOperations<Connection> transactionOps) {
    this.transactionOps = transactionOps;
  }

  public void insert(OrderReadModel view) {
    transactionOps.executeWrite(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(INSERT_SQL)) {
            ps.setString(1, view.getOrderId());
            ps.setString(2, view.getAccountEmail());
            ps.setString(3, view.getDeliveryAddress());
            ps.setTimestamp(
                4, view.getDeliveredTime() == null ? null : Timestamp.from(view.getDeliveredTime()));
            ps.setString(5, Jsons.toJson(view.getShopItems()));
            ps.setInt(6, view.getItemCount());
            ps.setBigDecimal(7, view.getTotalPrice());
            ps.setTimestamp(8, Timestamp.from(view.getCreatedAt()));
            return ps.executeUpdate();
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert order view", log);
          }
        });
  }

  public Optional<OrderReadModel> findById(String orderId) {
    return transactionOps.executeRead(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(SELECT_SQL)) {
            ps.setString(1, orderId);
            try (ResultSet rs = ps.executeQuery()) {
              if (!rs.next()) {
                return Optional.<OrderReadModel>empty();
              }
              Timestamp delivered = rs.getTimestamp("delivered_time");
              return Optional.of(
                  new OrderReadModel(
                      rs.getString("order_id"),
                      rs.getString("account_email"),
                      rs.getString("delivery_address"),
                      delivered == null ? null : delivered.toInstant(),
                      readItems(rs.getString("shop_items")),
                      rs.getInt("item_count"),
                      rs.getBigDecimal("total_price"),
                      rs.getTimestamp("created_at").toInstant()));
            }
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find order view", log);
          }
        });
  }

  private static List<ShopItem> readItems(String json) {
    try {
      return Jsons.mapper().readValue(json, SHOP_ITEMS);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored order view items are not valid JSON", e);
    }
  }
}
