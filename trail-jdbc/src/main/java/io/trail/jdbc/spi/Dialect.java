package io.trail.jdbc.spi;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific SQL for the version ledger and the
 * parameter markers entity stores need for typed values.
 * Register custom dialects via {@code META-INF/services/io.trail.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL, PostgreSQL, H2.
 *
 * @see io.trail.jdbc.dialect.Dialects
 */
public interface Dialect {

  /** Version columns in insert order, without {@code id}. */
  String VERSION_COLUMNS = "event, item_type, item_id, item_changes, originator_id, origin, meta, inserted_at";

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Marker binding a JSON string to a JSON column in {@code VALUES} and {@code SET}
   * clauses, e.g. {@code ?} or {@code CAST(? AS jsonb)}.
   */
  String jsonParameter();

  /**
   * Marker binding a parameter of the given type in a {@code SELECT} list, where the
   * database cannot infer the type from a target column.
   */
  String typedParameter(ParameterType type);

  /**
   * SQL for appending one version.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>event (String)</li>
   *   <li>item_type (String)</li>
   *   <li>item_id (Long)</li>
   *   <li>item_changes (String/JSON)</li>
   *   <li>originator_id (Long)</li>
   *   <li>origin (String)</li>
   *   <li>meta (String/JSON)</li>
   *   <li>inserted_at (Timestamp)</li>
   * </ol>
   */
  String insertVersionSql(String table);

  /**
   * SQL for rewriting a placeholder version.
   *
   * <p>Parameters: item_id (Long), item_changes (String/JSON), id (Long)
   */
  String updateVersionItemSql(String table);

  /**
   * SQL for appending one version per entity row matching {@code whereSql}, projected
   * with {@code INSERT ... SELECT}.
   *
   * <p>Parameters: event, item_type, item_changes, originator_id, origin, meta,
   * inserted_at, then the parameters of {@code whereSql}. {@code item_id} is read from
   * {@code primaryKey}.
   *
   * @param returning whether the statement returns the inserted rows
   * @throws UnsupportedOperationException if {@code returning} is requested but not
   *                                       {@link #supportsInsertReturning() supported}
   */
  String projectVersionsSql(String versionTable, String entityTable, String primaryKey, String whereSql,
                            boolean returning);

  /**
   * Whether {@code INSERT ... SELECT ... RETURNING} is available.
   */
  default boolean supportsInsertReturning() {
    return false;
  }

  /**
   * SQL returning {@code max(primaryKey) + 1}, or 1 for an empty table.
   */
  default String nextIdSql(String table, String primaryKey) {
    return "SELECT COALESCE(MAX(" + primaryKey + "), 0) + 1 FROM " + table;
  }

  /**
   * Prepares an insert whose generated key is read back with
   * {@link PreparedStatement#getGeneratedKeys()}; the key is the first column.
   */
  default PreparedStatement prepareInsert(Connection conn, String sql, String keyColumn) throws SQLException {
    return conn.prepareStatement(sql, new String[] {keyColumn});
  }

  /** SQL types a {@link #typedParameter(ParameterType)} marker can carry. */
  enum ParameterType {
    VARCHAR,
    BIGINT,
    TIMESTAMP,
    JSON
  }
}
