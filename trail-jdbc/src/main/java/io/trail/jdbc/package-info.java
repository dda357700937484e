/**
 * JDBC implementations of the trail stores.
 *
 * <p>{@link io.trail.jdbc.JdbcEntityStore} writes the tracked rows and
 * {@link io.trail.jdbc.JdbcVersionStore} appends to the version ledger.
 * {@link io.trail.jdbc.JdbcTemplate} provides lightweight JDBC helpers and
 * {@link io.trail.jdbc.DataSourceConnectionProvider} adapts a {@link javax.sql.DataSource}
 * to the {@link io.trail.spi.ConnectionProvider} SPI.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.trail.jdbc.dialect}: built-in dialects and detection</li>
 *   <li>{@code io.trail.jdbc.tx}: manual transaction management</li>
 * </ul>
 *
 * @see io.trail.jdbc.JdbcEntityStore
 * @see io.trail.jdbc.JdbcVersionStore
 */
package io.trail.jdbc;
