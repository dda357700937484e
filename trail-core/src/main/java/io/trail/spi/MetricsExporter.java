package io.trail.spi;

/**
 * Observability hook for exporting trail counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Adds to the count of versions written by committed transactions.
   *
   * @param count number of versions, never negative
   */
  void incrementVersionsWritten(int count);

  /**
   * Increments the count of committed plans.
   */
  void incrementCommitted();

  /**
   * Increments the count of plans rolled back because a step failed.
   */
  void incrementRolledBack();

  /**
   * Increments the count of updates skipped because nothing changed.
   */
  default void incrementNoopUpdates() {
  }

  /**
   * Records the time spent inside the transaction.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordCommitDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementVersionsWritten(int count) {
    }

    @Override
    public void incrementCommitted() {
    }

    @Override
    public void incrementRolledBack() {
    }
  }
}
