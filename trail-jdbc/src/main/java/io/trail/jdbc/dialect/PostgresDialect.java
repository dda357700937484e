package io.trail.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect. JSON values are stored in {@code jsonb} columns, and projected
 * version inserts can return their rows in the same round-trip.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String jsonParameter() {
    return "CAST(? AS jsonb)";
  }

  @Override
  public String typedParameter(ParameterType type) {
    if (type == ParameterType.VARCHAR) {
      return "CAST(? AS VARCHAR)";
    }
    return super.typedParameter(type);
  }

  @Override
  public boolean supportsInsertReturning() {
    return true;
  }
}
