package io.trail.model;

/**
 * Kind of mutation a {@link Version} records. The {@link #code()} is the value persisted
 * in the {@code event} column.
 */
public enum VersionEvent {
  INSERT("insert"),
  UPDATE("update"),
  DELETE("delete"),
  SOFT_DELETE("soft_delete");

  private final String code;

  VersionEvent(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a persisted event code.
   *
   * @param code the stored code, e.g. {@code "soft_delete"}
   * @return the matching event
   * @throws IllegalArgumentException if the code is unknown
   */
  public static VersionEvent fromCode(String code) {
    for (VersionEvent event : values()) {
      if (event.code.equals(code)) {
        return event;
      }
    }
    throw new IllegalArgumentException("Unknown version event: " + code);
  }
}
