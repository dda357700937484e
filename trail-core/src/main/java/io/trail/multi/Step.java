package io.trail.multi;

import io.trail.StepResults;

import java.sql.Connection;

/**
 * One named unit of work in a {@link Multi}.
 *
 * <p>Storage failures may be thrown as {@link io.trail.spi.TrailStoreException}; the
 * executor turns them into a failure of this step.
 */
@FunctionalInterface
public interface Step {

  /**
   * Runs the step.
   *
   * @param conn    connection of the enclosing transaction
   * @param results results of the steps that ran before this one
   */
  StepOutcome run(Connection conn, StepResults results);
}
