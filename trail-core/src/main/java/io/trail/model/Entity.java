package io.trail.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable state of one tracked record. Every schema column is present in
 * {@link #attributes()}, in schema order; absent values are {@code null}.
 */
public final class Entity {
  private final EntitySchema schema;
  private final Map<String, Object> attributes;

  private Entity(EntitySchema schema, Map<String, Object> attributes) {
    this.schema = schema;
    this.attributes = Collections.unmodifiableMap(attributes);
  }

  /**
   * Builds an entity from raw values, coercing each to its column type.
   *
   * @throws IllegalArgumentException if a key is not a column of {@code schema}
   */
  public static Entity of(EntitySchema schema, Map<String, ?> values) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(values, "values");
    for (String key : values.keySet()) {
      schema.requireColumn(key);
    }
    Map<String, Object> attributes = new LinkedHashMap<>();
    for (Column column : schema.columns()) {
      attributes.put(column.name(), column.type().coerce(values.get(column.name())));
    }
    return new Entity(schema, attributes);
  }

  /** An entity with every attribute unset, the base of an insert. */
  public static Entity empty(EntitySchema schema) {
    return of(schema, Map.of());
  }

  public EntitySchema schema() {
    return schema;
  }

  /** Primary key value, {@code null} until persisted. */
  public Long id() {
    return (Long) attributes.get(schema.primaryKey());
  }

  public Object get(String name) {
    schema.requireColumn(name);
    return attributes.get(name);
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  /** Returns a copy with {@code changes} applied on top of the current attributes. */
  public Entity with(Map<String, ?> changes) {
    Map<String, Object> merged = new LinkedHashMap<>(attributes);
    for (Map.Entry<String, ?> change : changes.entrySet()) {
      Column column = schema.requireColumn(change.getKey());
      merged.put(column.name(), column.type().coerce(change.getValue()));
    }
    return new Entity(schema, merged);
  }

  public Entity with(String name, Object value) {
    Map<String, Object> change = new LinkedHashMap<>();
    change.put(name, value);
    return with(change);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Entity that)) {
      return false;
    }
    return schema.equals(that.schema) && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, attributes);
  }

  @Override
  public String toString() {
    return schema.itemType() + attributes;
  }
}
