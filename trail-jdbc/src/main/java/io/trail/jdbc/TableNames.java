package io.trail.jdbc;

import java.util.Objects;

/**
 * Validation of table names that are concatenated into SQL.
 */
public final class TableNames {
  public static final String DEFAULT_VERSIONS_TABLE = "versions";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * @return {@code tableName}, unchanged
   * @throws IllegalArgumentException if the name is not a plain SQL identifier
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
