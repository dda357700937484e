package io.trail;

import io.trail.spi.MetricsExporter;

final class RecordingMetrics implements MetricsExporter {
  int versionsWritten;
  int committed;
  int rolledBack;
  int noopUpdates;

  @Override
  public void incrementVersionsWritten(int count) {
    versionsWritten += count;
  }

  @Override
  public void incrementCommitted() {
    committed++;
  }

  @Override
  public void incrementRolledBack() {
    rolledBack++;
  }

  @Override
  public void incrementNoopUpdates() {
    noopUpdates++;
  }
}
