package io.trail.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a multi-row step: the number of affected rows and, when the step returns
 * rows, the rows themselves.
 *
 * @param count number of rows affected
 * @param rows  returned rows; empty when the step does not return rows
 * @param <T>   row type
 */
public record BulkResult<T>(int count, List<T> rows) {
  public BulkResult {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative");
    }
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
  }

  public static <T> BulkResult<T> of(int count) {
    return new BulkResult<>(count, List.of());
  }

  public static <T> BulkResult<T> of(List<T> rows) {
    return new BulkResult<>(rows.size(), rows);
  }

  public boolean hasRows() {
    return !rows.isEmpty();
  }
}
