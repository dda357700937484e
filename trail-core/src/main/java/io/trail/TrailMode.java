package io.trail;

/**
 * How single-row operations link entities to their versions.
 */
public enum TrailMode {
  /** Entity step, then version step. */
  DEFAULT,
  /**
   * Additionally maintains {@code first_version_id} and {@code current_version_id} on the
   * entity through a placeholder version written before the entity step. Bulk operations
   * are not supported.
   */
  STRICT
}
