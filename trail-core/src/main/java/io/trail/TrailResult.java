package io.trail;

import java.util.Objects;

/**
 * Outcome of committing a plan.
 *
 * <p>Either every step succeeded ({@link Success}) or one step failed and the transaction
 * rolled back ({@link Failure}).
 *
 * <pre>{@code
 * TrailResult result = trail.insert(changeSet, options);
 * if (result instanceof TrailResult.Success success) {
 *   Entity company = success.results().entity("model");
 * } else if (result instanceof TrailResult.Failure failure) {
 *   log(failure.step(), failure.error());
 * }
 * }</pre>
 */
public sealed interface TrailResult permits TrailResult.Success, TrailResult.Failure {

  boolean isSuccess();

  /**
   * Returns the success value, or throws the failure.
   *
   * @throws TrailStepException if this is a {@link Failure}
   */
  Object orElseThrow();

  /**
   * Every step committed.
   *
   * @param results results of every surfaced step, in execution order
   * @param value   the results of the step named by the return operation, or {@code results}
   *                itself when no return operation was requested
   */
  record Success(StepResults results, Object value) implements TrailResult {
    public Success {
      Objects.requireNonNull(results, "results");
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public Object orElseThrow() {
      return value;
    }

    /** The value, checked against {@code type}. */
    public <T> T value(Class<T> type) {
      return type.cast(value);
    }
  }

  /**
   * A step failed; nothing was committed.
   *
   * @param step      name of the failing step
   * @param error     the value the step failed with, a {@link io.trail.model.ChangeSet}
   *                  for validation errors or the exception for storage errors
   * @param completed results of the steps that ran before the failure
   */
  record Failure(String step, Object error, StepResults completed) implements TrailResult {
    public Failure {
      Objects.requireNonNull(step, "step");
      Objects.requireNonNull(completed, "completed");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public Object orElseThrow() {
      throw new TrailStepException(this);
    }
  }
}
