/**
 * Manual JDBC transaction management.
 *
 * <p>{@link io.trail.jdbc.tx.JdbcTransactionManager} provides a lightweight
 * try-with-resources API over {@link io.trail.jdbc.tx.ThreadLocalTxContext};
 * {@link io.trail.jdbc.tx.JdbcTransactionRunner} runs trail plans in such a transaction
 * or in one of its own.
 */
package io.trail.jdbc.tx;
