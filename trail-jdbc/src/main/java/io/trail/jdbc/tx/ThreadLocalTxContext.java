package io.trail.jdbc.tx;

import io.trail.spi.TxContext;

import java.sql.Connection;

/**
 * {@link TxContext} implementation that stores the transaction connection in a {@link ThreadLocal}.
 *
 * <p>Designed for manual JDBC transaction management. Use with
 * {@link JdbcTransactionManager}, which handles binding and cleanup, and with
 * {@link JdbcTransactionRunner}, which joins a transaction bound here.
 *
 * @see JdbcTransactionManager
 * @see TxContext
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<Connection> connection = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return connection.get() != null;
  }

  @Override
  public Connection currentConnection() {
    Connection current = connection.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  void bind(Connection conn) {
    if (connection.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    connection.set(conn);
  }

  void unbind() {
    connection.remove();
  }
}
