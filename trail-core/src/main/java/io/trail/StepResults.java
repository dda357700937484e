package io.trail;

import io.trail.model.BulkResult;
import io.trail.model.Entity;
import io.trail.model.Version;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Values produced by the steps of a plan, keyed by step name in execution order.
 *
 * <p>A step may legitimately produce {@code null}, for example the version step of an
 * update that changed nothing, so {@link #contains(String)} and {@link #get(String)}
 * are distinct.
 */
public final class StepResults {
  private static final StepResults EMPTY = new StepResults(new LinkedHashMap<>());

  private final Map<String, Object> values;

  private StepResults(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static StepResults empty() {
    return EMPTY;
  }

  /**
   * Returns a copy with one more step result.
   *
   * @throws IllegalStateException if the step already has a result
   */
  public StepResults with(String step, Object value) {
    Objects.requireNonNull(step, "step");
    if (values.containsKey(step)) {
      throw new IllegalStateException("Duplicate step name: " + step);
    }
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.put(step, value);
    return new StepResults(copy);
  }

  /** Returns a copy without the given steps. */
  public StepResults without(Collection<String> steps) {
    if (steps.stream().noneMatch(values::containsKey)) {
      return this;
    }
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.keySet().removeAll(steps);
    return new StepResults(copy);
  }

  public boolean contains(String step) {
    return values.containsKey(step);
  }

  /**
   * Returns the value a step produced.
   *
   * @throws NoSuchElementException if the step has no result
   */
  public Object get(String step) {
    if (!values.containsKey(step)) {
      throw new NoSuchElementException("No result for step " + step);
    }
    return values.get(step);
  }

  /**
   * Returns the value a step produced, checked against {@code type}.
   *
   * @throws NoSuchElementException if the step has no result
   * @throws ClassCastException if the value is not a {@code type}
   */
  public <T> T get(String step, Class<T> type) {
    return type.cast(get(step));
  }

  public Entity entity(String step) {
    return get(step, Entity.class);
  }

  public Version version(String step) {
    return get(step, Version.class);
  }

  @SuppressWarnings("unchecked")
  public <T> BulkResult<T> bulk(String step) {
    return (BulkResult<T>) get(step, BulkResult.class);
  }

  /**
   * Versions written under {@code versionKey}: the step's own value and, for batch
   * inserts, every per-row step named {@code versionKey + ":" + id}.
   */
  public List<Version> versions(String versionKey) {
    List<Version> versions = new ArrayList<>();
    String rowPrefix = versionKey + ":";
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      if (entry.getKey().equals(versionKey) || entry.getKey().startsWith(rowPrefix)) {
        Object value = entry.getValue();
        if (value instanceof Version version) {
          versions.add(version);
        } else if (value instanceof BulkResult<?> bulk) {
          for (Object row : bulk.rows()) {
            if (row instanceof Version version) {
              versions.add(version);
            }
          }
        }
      }
    }
    return versions;
  }

  public Set<String> keys() {
    return values.keySet();
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof StepResults that && values.equals(that.values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "StepResults" + values;
  }
}
