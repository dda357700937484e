package io.trail.jdbc.dialect;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * MySQL dialect, also used for MariaDB URLs.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public String typedParameter(ParameterType type) {
    return switch (type) {
      case VARCHAR -> "CAST(? AS CHAR)";
      case BIGINT -> "CAST(? AS SIGNED)";
      case TIMESTAMP -> "CAST(? AS DATETIME(6))";
      case JSON -> "CAST(? AS JSON)";
    };
  }

  @Override
  public PreparedStatement prepareInsert(Connection conn, String sql, String keyColumn) throws SQLException {
    return conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
  }
}
