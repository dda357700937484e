/**
 * Built-in {@link io.trail.jdbc.spi.Dialect} implementations for H2, MySQL and PostgreSQL.
 *
 * @see io.trail.jdbc.dialect.Dialects
 */
package io.trail.jdbc.dialect;
