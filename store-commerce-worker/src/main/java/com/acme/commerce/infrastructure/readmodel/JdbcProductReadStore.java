package com.acme.commerce.infrastructure.readmodel;

import com.acme.store.persistence.jdbc.ExceptionTranslator;
import io.micronaut.transaction.TransactionOperations;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Product read model table. Writes join the caller's transaction, so the projection can commit them
 * together with its checkpoint.
 */
@Slf4j
public class JdbcProductReadStore {
  private static final String SELECT_SQL =
      """
      SELECT product_id, name, description, price, created_at, updated_at
      FROM product_view
      WHERE product_id = ?
      """;

  private static final String INSERT_SQL =
      """
      INSERT INTO product_view (product_id, name, description, price, created_at, updated_at)
      VALUES (?, ?, ?, ?, ?, ?)
      """;

  private static final String UPDATE_SQL =
      """
      UPDATE product_view
      SET name = ?, description = ?, price = ?, updated_at = ?
      WHERE product_id = ?
      """;

  private static final String DELETE_SQL = "DELETE FROM product_view WHERE product_id = ?";

  private final TransactionOperations<Connection> transactionOps;

  public JdbcProductReadStore(TransactionOperations<Connection> transactionOps) {
    this.transactionOps = transactionOps;
  }

  public void insert(ProductReadModel view) {
    transactionOps.executeWrite(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(INSERT_SQL)) {
            ps.setString(1, view.getProductId());
            ps.setString(2, view.getName());
            ps.setString(3, view.getDescription());
            ps.setBigDecimal(4, view.getPrice());
            ps.setTimestamp(5, Timestamp.from(view.getCreatedAt()));
            ps.setTimestamp(6, Timestamp.from(view.getUpdatedAt()));
            return ps.executeUpdate();
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert product view", log);
          }
        });
  }

  /** @return whether a row was updated */
  public boolean update(ProductReadModel view) {
    int updated =
        transactionOps.executeWrite(
            status -> {
              try (PreparedStatement ps = status.getConnection().prepareStatement(UPDATE_SQL)) {
                ps.setString(1, view.getName());
                ps.setString(2, view.getDescription());
                ps.setBigDecimal(3, view.getPrice());
                ps.setTimestamp(4, Timestamp.from(view.getUpdatedAt()));
                ps.setString(5, view.getProductId());
                return ps.executeUpdate();
              } catch (SQLException e) {
                throw ExceptionTranslator.translateException(e, "update product view", log);
              }
            });
    return updated > 0;
  }

  public void delete(String productId) {
    transactionOps.executeWrite(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(DELETE_SQL)) {
            ps.setString(1, productId);
            return ps.executeUpdate();
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete product view", log);
          }
        });
  }

  public Optional<ProductReadModel> findById(String productId) {
    return transactionOps.executeRead(
        status -> {
          try (PreparedStatement ps = status.getConnection().prepareStatement(SELECT_SQL)) {
            ps.setString(1, productId);
            try (ResultSet rs = ps.executeQuery()) {
              if (!rs.next()) {
                return Optional.<ProductReadModel>empty();
              }
              return Optional.of(
                  new ProductReadModel(
                      rs.getString("product_id"),
                      rs.getString("name"),
                      rs.getString("description"),
                      rs.getBigDecimal("price"),
                      rs.getTimestamp("created_at").toInstant(),
                      rs.getTimestamp("updated_at").toInstant()));
            }
          } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find product view", log);
          }
        });
  }
}
