/**
 * Micrometer bridge for the {@link io.trail.spi.MetricsExporter} SPI.
 *
 * @see io.trail.micrometer.MicrometerMetricsExporter
 */
package io.trail.micrometer;
