package io.trail.model;

import java.util.Objects;

/**
 * A named, typed column of an {@link EntitySchema}.
 *
 * @param name column name, a plain SQL identifier
 * @param type logical column type
 */
public record Column(String name, ColumnType type) {
  private static final String NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (!name.matches(NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid column name: " + name);
    }
  }
}
