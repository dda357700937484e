package io.trail.spi;

import java.sql.Connection;

/**
 * Exposes the transaction bound to the current thread, so trail operations can join a
 * transaction the caller already opened.
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();
}
