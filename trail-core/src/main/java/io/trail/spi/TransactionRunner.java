package io.trail.spi;

import java.sql.Connection;

/**
 * Executes work atomically. Every write performed through {@link TransactionScope#connection()}
 * commits together, or none does.
 *
 * <p>Implementations join a transaction that is already active on the current thread
 * rather than opening a second one. In that case rolling back the work must not roll back
 * what the enclosing transaction did before it.
 */
public interface TransactionRunner {

  /**
   * Runs {@code work} in a transaction. The transaction commits when {@code work} returns
   * normally and {@link TransactionScope#setRollbackOnly()} was not called; it rolls back
   * otherwise, and exceptions thrown by {@code work} propagate.
   *
   * @throws TrailStoreException if the transaction cannot be opened or completed
   */
  <T> T execute(TransactionWork<T> work);

  @FunctionalInterface
  interface TransactionWork<T> {
    T run(TransactionScope scope);
  }

  /** Handle on the running transaction. */
  interface TransactionScope {
    Connection connection();

    /** Marks the transaction so that it rolls back instead of committing. */
    void setRollbackOnly();

    boolean isRollbackOnly();
  }
}
