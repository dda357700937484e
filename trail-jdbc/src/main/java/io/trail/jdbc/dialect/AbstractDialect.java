package io.trail.jdbc.dialect;

import io.trail.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String jsonParameter() {
    return "?";
  }

  @Override
  public String typedParameter(ParameterType type) {
    return switch (type) {
      case VARCHAR -> "CAST(? AS VARCHAR(255))";
      case BIGINT -> "CAST(? AS BIGINT)";
      case TIMESTAMP -> "CAST(? AS TIMESTAMP)";
      case JSON -> jsonParameter();
    };
  }

  @Override
  public String insertVersionSql(String table) {
    return "INSERT INTO " + table + " (" + VERSION_COLUMNS + ") " +
        "VALUES (?,?,?," + jsonParameter() + ",?,?," + jsonParameter() + ",?)";
  }

  @Override
  public String updateVersionItemSql(String table) {
    return "UPDATE " + table + " SET item_id=?, item_changes=" + jsonParameter() + " WHERE id=?";
  }

  @Override
  public String projectVersionsSql(String versionTable, String entityTable, String primaryKey, String whereSql,
                                   boolean returning) {
    if (returning && !supportsInsertReturning()) {
      throw new UnsupportedOperationException(name() + " does not support INSERT ... RETURNING");
    }
    String sql = "INSERT INTO " + versionTable + " (" + VERSION_COLUMNS + ") " +
        "SELECT " +
        typedParameter(ParameterType.VARCHAR) + ", " +
        typedParameter(ParameterType.VARCHAR) + ", " +
        primaryKey + ", " +
        typedParameter(ParameterType.JSON) + ", " +
        typedParameter(ParameterType.BIGINT) + ", " +
        typedParameter(ParameterType.VARCHAR) + ", " +
        typedParameter(ParameterType.JSON) + ", " +
        typedParameter(ParameterType.TIMESTAMP) +
        " FROM " + entityTable + " WHERE " + whereSql +
        " ORDER BY " + primaryKey;
    return returning ? sql + " RETURNING id, " + VERSION_COLUMNS : sql;
  }
}
