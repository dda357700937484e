/**
 * Service Provider Interfaces (SPI) for plugging storage, transactions and metrics into
 * the trail.
 *
 * @see io.trail.spi.EntityStore
 * @see io.trail.spi.VersionStore
 * @see io.trail.spi.TransactionRunner
 * @see io.trail.spi.MetricsExporter
 */
package io.trail.spi;
