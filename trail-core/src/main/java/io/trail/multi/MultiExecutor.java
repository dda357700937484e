package io.trail.multi;

import io.trail.StepResults;
import io.trail.TrailResult;
import io.trail.spi.TrailStoreException;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the steps of a {@link Multi} sequentially on one connection.
 *
 * <p>The first step that returns {@link StepOutcome.Error} or throws
 * {@link TrailStoreException} stops execution; later steps never run. The executor does
 * not commit or roll back, that is up to the caller holding the transaction.
 */
public final class MultiExecutor {
  private static final Logger logger = Logger.getLogger(MultiExecutor.class.getName());

  /**
   * Checks the change sets of a plan before any transaction is opened.
   *
   * @return the failure of the first step whose change set is invalid
   */
  public Optional<TrailResult.Failure> preflight(Multi multi) {
    for (Multi.Operation operation : multi.operations()) {
      if (operation instanceof Multi.Run run && run.changeSet() != null && !run.changeSet().isValid()) {
        return Optional.of(new TrailResult.Failure(run.name(), run.changeSet(), StepResults.empty()));
      }
    }
    return Optional.empty();
  }

  /**
   * Runs every step of {@code multi}.
   *
   * @return a success carrying all step results as its value, or the first failure
   */
  public TrailResult execute(Multi multi, Connection conn) {
    Execution execution = new Execution(conn);
    TrailResult.Failure failure = execution.run(multi.operations());
    if (failure != null) {
      return failure;
    }
    return new TrailResult.Success(execution.results, execution.results);
  }

  private static final class Execution {
    private final Connection conn;
    private StepResults results = StepResults.empty();

    private Execution(Connection conn) {
      this.conn = conn;
    }

    private TrailResult.Failure run(List<Multi.Operation> operations) {
      for (Multi.Operation operation : operations) {
        TrailResult.Failure failure;
        if (operation instanceof Multi.Run step) {
          failure = runStep(step);
        } else {
          Multi subPlan = ((Multi.Merge) operation).function().build(conn, results);
          failure = run(subPlan.operations());
        }
        if (failure != null) {
          return failure;
        }
      }
      return null;
    }

    private TrailResult.Failure runStep(Multi.Run step) {
      if (results.contains(step.name())) {
        throw new IllegalStateException("Step " + step.name() + " is already part of the plan");
      }
      if (step.changeSet() != null && !step.changeSet().isValid()) {
        return new TrailResult.Failure(step.name(), step.changeSet(), results);
      }
      StepOutcome outcome;
      try {
        outcome = step.step().run(conn, results);
      } catch (TrailStoreException e) {
        logger.log(Level.FINE, "Step " + step.name() + " failed", e);
        return new TrailResult.Failure(step.name(), e, results);
      }
      if (outcome == null) {
        throw new IllegalStateException("Step " + step.name() + " returned no outcome");
      }
      if (outcome instanceof StepOutcome.Error error) {
        return new TrailResult.Failure(step.name(), error.error(), results);
      }
      results = results.with(step.name(), ((StepOutcome.Ok) outcome).value());
      return null;
    }
  }
}
