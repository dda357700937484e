package io.trail.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for transactions opened by the trail itself and for
 * read-only version queries.
 *
 * <p>Callers are responsible for closing the returned connection.
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
