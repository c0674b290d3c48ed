package com.acme.commerce.infrastructure.persistence;

import com.acme.commerce.domain.model.Product;
import com.acme.commerce.domain.repository.ProductRepository;
import com.acme.store.core.ConflictException;
import com.acme.store.persistence.jdbc.ExceptionTranslator;
import com.acme.store.uow.EventCollector;
import io.micronaut.transaction.TransactionOperations;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * JDBC implementation of ProductRepository. Saves check the version the product was loaded with;
 * a save against a moved version fails with {@link ConflictException}.
 */
@Slf4j
public class JdbcProductRepository implements ProductRepository {
  private static final String SELECT_SQL =
      """
      SELECT product_id, name, description, price, deleted, version
      FROM product
      WHERE product_id = ?
      """;

  private static final String INSERT_SQL =
      """
      INSERT INTO product (product_id, name, description, price, deleted, version, updated_at)
      VALUES (?, ?, ?, ?, ?, ?, ?)
      """;

  private static final String UPDATE_SQL =
      """
      UPDATE product
      SET name = ?, description = ?, price = ?, deleted = ?, version = ?, updated_at = ?
      WHERE product_id = ? AND version = ?
      """;

  private final TransactionOperations<Connection> transactionOps;
  private final EventCollector collector;
  private final Clock clock;

  public JdbcProductRepository(
      TransactionOperations<Connection> transactionOps, EventCollector collector, Clock clock) {
    this.transactionOps = transactionOps;
    this.collector = collector;
    this.clock = clock;
  }

  @Override
  public Optional<Product> load(String productId) {
    log.debug("Loading product: {}", productId);
    return transactionOps.executeRead(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(SELECT_SQL)) {
            ps.setString(1, productId);
            try (ResultSet rs = ps.executeQuery()) {
              if (!rs.next()) {
                return Optional.<Product>empty();
              }
              return Optional.of(
                  new Product(
                      rs.getString("product_id"),
                      rs.getLong("version"),
                      rs.getString("name"),
                      rs.getString("description"),
                      rs.getBigDecimal("price"),
                      rs.getBoolean("deleted"),
                      clock));
            }
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "load product", log);
          }
        });
  }

  @Override
  public void save(Product product) {
    log.debug("Saving product: {} at version {}", product.getId(), product.getVersion());
    int updated =
        transactionOps.executeWrite(
            status -> {
              Connection conn = status.getConnection();
              Timestamp now = Timestamp.from(clock.instant());
              try {
                if (product.isNew()) {
                  try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                    ps.setString(1, product.getId());
                    ps.setString(2, product.getName());
                    ps.setString(3, product.getDescription());
                    ps.setBigDecimal(4, product.getPrice());
                    ps.setBoolean(5, product.isDeleted());
                    ps.setLong(6, product.getVersion());
                    ps.setTimestamp(7, now);
                    return ps.executeUpdate();
                  }
                }
                try (PreparedStatement ps = conn.prepareStatement(UPDATE_SQL)) {
                  ps.setString(1, product.getName());
                  ps.setString(2, product.getDescription());
                  ps.setBigDecimal(3, product.getPrice());
                  ps.setBoolean(4, product.isDeleted());
                  ps.setLong(5, product.getVersion());
                  ps.setTimestamp(6, now);
                  ps.setString(7, product.getId());
                  ps.setLong(8, product.getPersistedVersion());
                  return ps.executeUpdate();
                }
              } catch (SQLException e) {
                throw ExceptionTranslator.translateException(e, "save product", log);
              }
            });
    if (updated == 0) {
      throw new ConflictException(
          "Product " + product.getId() + " was modified concurrently (expected version "
              + product.getPersistedVersion() + ")");
    }
    collector.collectFrom(product);
  }
}
