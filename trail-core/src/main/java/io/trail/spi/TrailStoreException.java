package io.trail.spi;

/**
 * Unchecked exception wrapping storage errors raised by {@link EntityStore},
 * {@link VersionStore} and {@link TransactionRunner} implementations.
 */
public class TrailStoreException extends RuntimeException {
  public TrailStoreException(String message) {
    super(message);
  }

  public TrailStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
