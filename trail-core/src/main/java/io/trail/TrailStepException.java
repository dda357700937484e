package io.trail;

/**
 * Thrown by {@link TrailResult#orElseThrow()} for a failed plan.
 */
public final class TrailStepException extends RuntimeException {
  private final transient TrailResult.Failure failure;

  public TrailStepException(TrailResult.Failure failure) {
    super("Step '" + failure.step() + "' failed: " + describe(failure.error()),
        failure.error() instanceof Throwable t ? t : null);
    this.failure = failure;
  }

  public TrailResult.Failure failure() {
    return failure;
  }

  public String step() {
    return failure.step();
  }

  private static String describe(Object error) {
    if (error instanceof Throwable t) {
      return t.getMessage();
    }
    return String.valueOf(error);
  }
}
