package io.trail.spring;

import io.trail.spi.TrailStoreException;
import io.trail.spi.TransactionRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TransactionRunner} running trail plans in Spring-managed transactions.
 *
 * <p>Plans use {@link TransactionDefinition#PROPAGATION_NESTED}: inside an existing
 * transaction a plan runs behind a savepoint, so a failed plan rolls back alone and the
 * caller's transaction stays usable. Without one the plan gets a transaction of its own.
 *
 * <pre>{@code
 * TransactionRunner runner = new SpringTransactionRunner(dataSource, transactionManager);
 * }</pre>
 */
public final class SpringTransactionRunner implements TransactionRunner {
  private final SpringTxContext txContext;
  private final TransactionTemplate transactionTemplate;

  public SpringTransactionRunner(DataSource dataSource, PlatformTransactionManager transactionManager) {
    this.txContext = new SpringTxContext(dataSource);
    this.transactionTemplate = new TransactionTemplate(
        Objects.requireNonNull(transactionManager, "transactionManager"));
    this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
  }

  @Override
  public <T> T execute(TransactionWork<T> work) {
    Objects.requireNonNull(work, "work");
    try {
      return transactionTemplate.execute(status -> {
        Scope scope = new Scope(txContext, status);
        try {
          return work.run(scope);
        } finally {
          scope.release();
        }
      });
    } catch (TransactionException e) {
      throw new TrailStoreException("Failed to complete transaction", e);
    }
  }

  private static final class Scope implements TransactionScope {
    private final SpringTxContext txContext;
    private final TransactionStatus status;
    private Connection connection;

    private Scope(SpringTxContext txContext, TransactionStatus status) {
      this.txContext = txContext;
      this.status = status;
    }

    @Override
    public Connection connection() {
      if (connection == null) {
        try {
          connection = txContext.currentConnection();
        } catch (DataAccessException e) {
          throw new TrailStoreException("Failed to obtain transactional connection", e);
        }
      }
      return connection;
    }

    @Override
    public void setRollbackOnly() {
      status.setRollbackOnly();
    }

    @Override
    public boolean isRollbackOnly() {
      return status.isRollbackOnly();
    }

    private void release() {
      if (connection != null) {
        txContext.releaseConnection(connection);
        connection = null;
      }
    }
  }
}
