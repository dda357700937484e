package io.trail.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.trail.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Datadog and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code trail.versions.written}: versions appended by committed plans</li>
 *   <li>{@code trail.tx.committed}: committed plans</li>
 *   <li>{@code trail.tx.rolledback}: plans rolled back after a failed step</li>
 *   <li>{@code trail.update.noop}: updates skipped because nothing changed</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code trail.commit.duration}: time spent inside the transaction</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter versionsWritten;
  private final Counter committed;
  private final Counter rolledBack;
  private final Counter noopUpdates;
  private final Timer commitDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "trail"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "trail");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.trail"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.versionsWritten = Counter.builder(namePrefix + ".versions.written")
        .description("Versions appended by committed plans")
        .register(registry);
    this.committed = Counter.builder(namePrefix + ".tx.committed")
        .description("Committed plans")
        .register(registry);
    this.rolledBack = Counter.builder(namePrefix + ".tx.rolledback")
        .description("Plans rolled back after a failed step")
        .register(registry);
    this.noopUpdates = Counter.builder(namePrefix + ".update.noop")
        .description("Updates skipped because nothing changed")
        .register(registry);
    this.commitDuration = Timer.builder(namePrefix + ".commit.duration")
        .description("Time spent inside the transaction")
        .register(registry);
  }

  @Override
  public void incrementVersionsWritten(int count) {
    if (closed || count <= 0) return;
    versionsWritten.increment(count);
  }

  @Override
  public void incrementCommitted() {
    if (closed) return;
    committed.increment();
  }

  @Override
  public void incrementRolledBack() {
    if (closed) return;
    rolledBack.increment();
  }

  @Override
  public void incrementNoopUpdates() {
    if (closed) return;
    noopUpdates.increment();
  }

  @Override
  public void recordCommitDurationMs(long durationMs) {
    if (closed) return;
    commitDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.<Meter>of(versionsWritten, committed, rolledBack, noopUpdates, commitDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
