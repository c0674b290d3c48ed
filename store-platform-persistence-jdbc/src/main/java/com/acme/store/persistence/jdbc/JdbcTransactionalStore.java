package com.acme.store.persistence.jdbc;

import com.acme.store.spi.TransactionalStore;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.util.function.Supplier;

/**
 * {@link TransactionalStore} over Micronaut's JDBC transaction manager. Work runs with REQUIRED
 * propagation, so repositories called inside it share the caller's connection.
 */
@Singleton
public class JdbcTransactionalStore implements TransactionalStore {

  private final TransactionOperations<Connection> transactionOps;

  public JdbcTransactionalStore(TransactionOperations<Connection> transactionOps) {
    this.transactionOps = transactionOps;
  }

  @Override
  public <T> T executeWrite(Supplier<T> work) {
    return transactionOps.executeWrite(status -> work.get());
  }

  @Override
  public <T> T executeRead(Supplier<T> work) {
    return transactionOps.executeRead(status -> work.get());
  }

  @Override
  public boolean hasActiveTransaction() {
    return transactionOps.findTransactionStatus().isPresent();
  }
}
