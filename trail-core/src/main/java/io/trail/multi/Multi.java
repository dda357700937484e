package io.trail.multi;

import io.trail.StepResults;
import io.trail.model.ChangeSet;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered plan of named steps that run in one transaction.
 *
 * <p>Step names are unique within a plan; adding a name twice fails immediately. Steps
 * contributed by a {@link #merge(MergeFunction)} are only known at execution time and
 * are checked then.
 */
public final class Multi {
  private static final Multi EMPTY = new Multi(List.of(), Set.of());

  private final List<Operation> operations;
  private final Set<String> names;

  private Multi(List<Operation> operations, Set<String> names) {
    this.operations = operations;
    this.names = names;
  }

  public static Multi empty() {
    return EMPTY;
  }

  /** Adds a step. */
  public Multi run(String name, Step step) {
    return add(new Run(name, null, step));
  }

  /**
   * Adds a step that persists {@code changeSet}. The change set is validated before the
   * transaction opens; when invalid, the plan fails at this step without running anything.
   */
  public Multi run(String name, ChangeSet changeSet, Step step) {
    Objects.requireNonNull(changeSet, "changeSet");
    return add(new Run(name, changeSet, step));
  }

  /** Adds a step that fails with {@code error}, rolling back the plan. */
  public Multi error(String name, Object error) {
    return run(name, (conn, results) -> StepOutcome.error(error));
  }

  /** Adds a step that builds more steps from the results so far and runs them in place. */
  public Multi merge(MergeFunction function) {
    Objects.requireNonNull(function, "function");
    List<Operation> copy = new ArrayList<>(operations);
    copy.add(new Merge(function));
    return new Multi(Collections.unmodifiableList(copy), names);
  }

  /** Returns a plan running this plan's steps, then {@code other}'s. */
  public Multi append(Multi other) {
    return concat(this, other);
  }

  /** Returns a plan running {@code other}'s steps, then this plan's. */
  public Multi prepend(Multi other) {
    return concat(other, this);
  }

  /** Names of the statically known steps, in order. */
  public List<String> names() {
    return List.copyOf(names);
  }

  public List<Operation> operations() {
    return operations;
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }

  private Multi add(Run run) {
    if (names.contains(run.name())) {
      throw new IllegalArgumentException("Step " + run.name() + " is already part of the plan");
    }
    List<Operation> copy = new ArrayList<>(operations);
    copy.add(run);
    Set<String> copyNames = new LinkedHashSet<>(names);
    copyNames.add(run.name());
    return new Multi(Collections.unmodifiableList(copy), Collections.unmodifiableSet(copyNames));
  }

  private static Multi concat(Multi first, Multi second) {
    Set<String> merged = new LinkedHashSet<>(first.names);
    for (String name : second.names) {
      if (!merged.add(name)) {
        throw new IllegalArgumentException("Step " + name + " is part of both plans");
      }
    }
    List<Operation> operations = new ArrayList<>(first.operations);
    operations.addAll(second.operations);
    return new Multi(Collections.unmodifiableList(operations), Collections.unmodifiableSet(merged));
  }

  @Override
  public String toString() {
    return "Multi" + operations;
  }

  /** Element of a plan. */
  public sealed interface Operation permits Run, Merge {
  }

  /**
   * A named step.
   *
   * @param name      step name
   * @param changeSet change set validated before the transaction, or {@code null}
   * @param step      the work
   */
  public record Run(String name, ChangeSet changeSet, Step step) implements Operation {
    public Run {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(step, "step");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("Step name must not be empty");
      }
    }

    @Override
    public String toString() {
      return "run(" + name + ")";
    }
  }

  /** Builds a sub-plan at execution time. */
  public record Merge(MergeFunction function) implements Operation {
    @Override
    public String toString() {
      return "merge";
    }
  }

  @FunctionalInterface
  public interface MergeFunction {
    Multi build(Connection conn, StepResults results);
  }
}
