package io.trail.jdbc;

import io.trail.model.Column;
import io.trail.util.JsonCodec;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Conversion between column values and JDBC parameters or result columns.
 */
final class JdbcValues {

  private JdbcValues() {}

  static Object toJdbc(Column column, Object value, JsonCodec codec) {
    Object coerced = column.type().coerce(value);
    if (coerced == null) {
      return null;
    }
    return switch (column.type()) {
      case TIMESTAMP -> Timestamp.from((Instant) coerced);
      case DATE -> Date.valueOf((LocalDate) coerced);
      case JSON -> codec.toJson(coerced);
      default -> coerced;
    };
  }

  static Object read(ResultSet rs, Column column, JsonCodec codec) throws SQLException {
    String name = column.name();
    switch (column.type()) {
      case STRING:
        return rs.getString(name);
      case LONG: {
        long value = rs.getLong(name);
        return rs.wasNull() ? null : value;
      }
      case INTEGER: {
        int value = rs.getInt(name);
        return rs.wasNull() ? null : value;
      }
      case BOOLEAN: {
        boolean value = rs.getBoolean(name);
        return rs.wasNull() ? null : value;
      }
      case DECIMAL:
        return rs.getBigDecimal(name);
      case DATE: {
        Date value = rs.getDate(name);
        return value == null ? null : value.toLocalDate();
      }
      case TIMESTAMP:
        return readInstant(rs, name);
      case JSON:
        return codec.parse(rs.getString(name));
      default:
        throw new IllegalStateException("Unhandled column type " + column.type());
    }
  }

  static Instant readInstant(ResultSet rs, String name) throws SQLException {
    Timestamp value = rs.getTimestamp(name);
    return value == null ? null : value.toInstant();
  }

  static Long readLong(ResultSet rs, String name) throws SQLException {
    long value = rs.getLong(name);
    return rs.wasNull() ? null : value;
  }
}
