package io.trail.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A proposed mutation: base entity state, the attributes that actually change and the
 * validation outcome.
 *
 * <p>Change sets are immutable. Every helper returns a new instance, so a change set can
 * be built up fluently:
 * <pre>{@code
 * ChangeSet cs = ChangeSet.forInsert(companies, Map.of("name", "Acme LLC", "city", "Greenwich"))
 *     .validateRequired("name");
 * }</pre>
 *
 * <p>The change mapping never contains an attribute whose coerced value holds the same data
 * as the base value (see {@link ColumnType#sameValue}), so an update whose mapping is empty
 * is a no-op.
 */
public final class ChangeSet {
  private final Entity data;
  private final Map<String, Object> changes;
  private final List<FieldError> errors;

  private ChangeSet(Entity data, Map<String, Object> changes, List<FieldError> errors) {
    this.data = data;
    this.changes = Collections.unmodifiableMap(changes);
    this.errors = List.copyOf(errors);
  }

  /** A change set over an empty entity, every non-null value counts as a change. */
  public static ChangeSet forInsert(EntitySchema schema, Map<String, ?> params) {
    return forUpdate(Entity.empty(schema), params);
  }

  /** A change set diffing {@code params} against the persisted {@code data}. */
  public static ChangeSet forUpdate(Entity data, Map<String, ?> params) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(params, "params");
    return new ChangeSet(data, Map.of(), List.of()).change(params);
  }

  /** Returns a copy with {@code params} diffed against the base entity and merged in. */
  public ChangeSet change(Map<String, ?> params) {
    Map<String, Object> merged = new LinkedHashMap<>(changes);
    for (Map.Entry<String, ?> param : params.entrySet()) {
      Column column = data.schema().requireColumn(param.getKey());
      Object value = column.type().coerce(param.getValue());
      if (column.type().sameValue(value, data.attributes().get(column.name()))) {
        merged.remove(column.name());
      } else {
        merged.put(column.name(), value);
      }
    }
    return new ChangeSet(data, ordered(merged), errors);
  }

  public ChangeSet change(String name, Object value) {
    Map<String, Object> param = new LinkedHashMap<>();
    param.put(name, value);
    return change(param);
  }

  /** Adds a "can't be blank" error for every listed attribute with no resulting value. */
  public ChangeSet validateRequired(String... fields) {
    ChangeSet result = this;
    for (String field : fields) {
      data.schema().requireColumn(field);
      Object value = changes.containsKey(field) ? changes.get(field) : data.attributes().get(field);
      if (value == null || (value instanceof String s && s.isBlank())) {
        result = result.addError(field, "can't be blank");
      }
    }
    return result;
  }

  public ChangeSet addError(String field, String message) {
    List<FieldError> updated = new ArrayList<>(errors);
    updated.add(new FieldError(field, message));
    return new ChangeSet(data, changes, updated);
  }

  /** Returns a copy with the named attributes removed from the change mapping. */
  public ChangeSet without(Collection<String> fields) {
    Map<String, Object> remaining = new LinkedHashMap<>(changes);
    remaining.keySet().removeAll(fields);
    return new ChangeSet(data, remaining, errors);
  }

  /** The base entity with every change applied. */
  public Entity apply() {
    return data.with(changes);
  }

  public Entity data() {
    return data;
  }

  public EntitySchema schema() {
    return data.schema();
  }

  public Map<String, Object> changes() {
    return changes;
  }

  public boolean hasChanges() {
    return !changes.isEmpty();
  }

  public List<FieldError> errors() {
    return errors;
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  private Map<String, Object> ordered(Map<String, Object> values) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (String name : data.schema().columnNames()) {
      if (values.containsKey(name)) {
        result.put(name, values.get(name));
      }
    }
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChangeSet that)) {
      return false;
    }
    return data.equals(that.data) && changes.equals(that.changes) && errors.equals(that.errors);
  }

  @Override
  public int hashCode() {
    return Objects.hash(data, changes, errors);
  }

  @Override
  public String toString() {
    return "ChangeSet{" + data.schema().itemType() + ", changes=" + changes
        + ", errors=" + errors + ", valid=" + isValid() + "}";
  }
}
