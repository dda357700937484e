package io.trail.jdbc.dialect;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * H2 dialect. Primarily for testing. JSON values are stored in {@code CLOB} columns.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String typedParameter(ParameterType type) {
    if (type == ParameterType.JSON) {
      return "CAST(? AS CLOB)";
    }
    return super.typedParameter(type);
  }

  @Override
  public PreparedStatement prepareInsert(Connection conn, String sql, String keyColumn) throws SQLException {
    // identifiers are upper-cased by default, request the identity column instead of a name
    return conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
  }
}
