package io.trail.model;

import java.util.Objects;

/**
 * A validation error attached to one attribute of a {@link ChangeSet}.
 *
 * @param field   the attribute name
 * @param message human-readable reason
 */
public record FieldError(String field, String message) {
  public FieldError {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(message, "message");
  }
}
