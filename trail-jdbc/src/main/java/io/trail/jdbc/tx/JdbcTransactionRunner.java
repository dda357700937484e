package io.trail.jdbc.tx;

import io.trail.spi.ConnectionProvider;
import io.trail.spi.TrailStoreException;
import io.trail.spi.TransactionRunner;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TransactionRunner} for plain JDBC.
 *
 * <p>When a {@link JdbcTransactionManager} transaction is bound to the current thread the
 * work joins it behind a savepoint: a rollback undoes the work only, and the enclosing
 * transaction decides whether everything commits. Otherwise the runner opens, commits and
 * closes a transaction of its own.
 */
public final class JdbcTransactionRunner implements TransactionRunner {
  private static final Logger logger = Logger.getLogger(JdbcTransactionRunner.class.getName());

  private final JdbcTransactionManager transactionManager;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionRunner(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.transactionManager = new JdbcTransactionManager(connectionProvider, txContext);
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  @Override
  public <T> T execute(TransactionWork<T> work) {
    Objects.requireNonNull(work, "work");
    if (txContext.isTransactionActive()) {
      return executeNested(txContext.currentConnection(), work);
    }
    try (JdbcTransactionManager.Transaction tx = transactionManager.begin()) {
      Scope scope = new Scope(tx.connection());
      T result = work.run(scope);
      if (scope.rollbackOnly) {
        tx.rollback();
      } else {
        tx.commit();
      }
      return result;
    } catch (SQLException e) {
      throw new TrailStoreException("Failed to complete transaction", e);
    }
  }

  private <T> T executeNested(Connection conn, TransactionWork<T> work) {
    Savepoint savepoint;
    try {
      savepoint = conn.setSavepoint();
    } catch (SQLException e) {
      throw new TrailStoreException("Failed to create savepoint", e);
    }
    Scope scope = new Scope(conn);
    T result;
    try {
      result = work.run(scope);
    } catch (RuntimeException | Error e) {
      try {
        conn.rollback(savepoint);
      } catch (SQLException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw e;
    }
    try {
      if (scope.rollbackOnly) {
        logger.log(Level.FINE, "Rolling back to savepoint inside enclosing transaction");
        conn.rollback(savepoint);
      } else {
        conn.releaseSavepoint(savepoint);
      }
    } catch (SQLException e) {
      throw new TrailStoreException("Failed to complete savepoint", e);
    }
    return result;
  }

  private static final class Scope implements TransactionScope {
    private final Connection connection;
    private boolean rollbackOnly;

    private Scope(Connection connection) {
      this.connection = connection;
    }

    @Override
    public Connection connection() {
      return connection;
    }

    @Override
    public void setRollbackOnly() {
      rollbackOnly = true;
    }

    @Override
    public boolean isRollbackOnly() {
      return rollbackOnly;
    }
  }
}
