/**
 * Dialect SPI, loaded through {@link java.util.ServiceLoader}.
 */
package io.trail.jdbc.spi;
