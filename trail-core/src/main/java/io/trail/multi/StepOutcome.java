package io.trail.multi;

/**
 * What a single step produced: a value to record under the step's name, or an error
 * that stops the plan.
 */
public sealed interface StepOutcome permits StepOutcome.Ok, StepOutcome.Error {

  static StepOutcome ok(Object value) {
    return new Ok(value);
  }

  static StepOutcome error(Object error) {
    return new Error(error);
  }

  /** The step succeeded with {@code value}, which may be {@code null}. */
  record Ok(Object value) implements StepOutcome {
  }

  /** The step failed with {@code error}; the plan rolls back. */
  record Error(Object error) implements StepOutcome {
  }
}
