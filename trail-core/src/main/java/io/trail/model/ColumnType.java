package io.trail.model;

import io.trail.util.JsonCodec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Logical type of an entity column.
 *
 * <p>{@link #coerce(Object)} normalizes caller-supplied values the same way regardless of
 * where they came from (application code, JDBC rows, bulk payloads), so that change
 * detection compares like with like.
 */
public enum ColumnType {
  STRING,
  LONG,
  INTEGER,
  BOOLEAN,
  DECIMAL,
  DATE,
  TIMESTAMP,
  JSON;

  /**
   * Converts {@code value} to the canonical Java type of this column.
   *
   * @param value the raw value, may be {@code null}
   * @return the coerced value, or {@code null}
   * @throws IllegalArgumentException if the value cannot represent this type
   */
  public Object coerce(Object value) {
    if (value == null) {
      return null;
    }
    switch (this) {
      case STRING:
        if (value instanceof String || value instanceof Character || value instanceof Enum<?>) {
          return value.toString();
        }
        break;
      case LONG:
        if (value instanceof Number n) {
          return exactLong(n);
        }
        if (value instanceof String s) {
          return Long.parseLong(s.trim());
        }
        break;
      case INTEGER:
        if (value instanceof Number n) {
          long l = exactLong(n);
          if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(value + " is out of range for " + name());
          }
          return (int) l;
        }
        if (value instanceof String s) {
          return Integer.parseInt(s.trim());
        }
        break;
      case BOOLEAN:
        if (value instanceof Boolean) {
          return value;
        }
        if (value instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
          return Boolean.parseBoolean(s);
        }
        break;
      case DECIMAL:
        if (value instanceof BigDecimal) {
          return value;
        }
        if (value instanceof Number || value instanceof String) {
          return new BigDecimal(value.toString());
        }
        break;
      case DATE:
        if (value instanceof LocalDate) {
          return value;
        }
        if (value instanceof java.sql.Date d) {
          return d.toLocalDate();
        }
        if (value instanceof String s) {
          return LocalDate.parse(s);
        }
        break;
      case TIMESTAMP:
        if (value instanceof Instant) {
          return value;
        }
        if (value instanceof Timestamp ts) {
          return ts.toInstant();
        }
        if (value instanceof OffsetDateTime odt) {
          return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
          return zdt.toInstant();
        }
        if (value instanceof String s) {
          return Instant.parse(s);
        }
        break;
      case JSON:
        if (value instanceof Map<?, ?> || value instanceof List<?> || value instanceof String
            || value instanceof Number || value instanceof Boolean) {
          return value;
        }
        break;
      default:
        break;
    }
    throw new IllegalArgumentException(
        "Cannot coerce " + value.getClass().getName() + " to " + name());
  }

  /**
   * Whether two values of this column hold the same data. Decimals compare numerically,
   * ignoring scale, and JSON values compare in their JSON-normal form.
   */
  public boolean sameValue(Object a, Object b) {
    if (a == null || b == null) {
      return a == b;
    }
    switch (this) {
      case DECIMAL:
        if (a instanceof Number x && b instanceof Number y) {
          return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString())) == 0;
        }
        break;
      case JSON:
        return Objects.equals(jsonNormal(a), jsonNormal(b));
      default:
        break;
    }
    return a.equals(b);
  }

  private static Object jsonNormal(Object value) {
    return JsonCodec.getDefault().normalize(Collections.singletonMap("value", value)).get("value");
  }

  private static long exactLong(Number n) {
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
      return n.longValue();
    }
    try {
      if (n instanceof BigInteger big) {
        return big.longValueExact();
      }
      return new BigDecimal(n.toString()).longValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(n + " is not an exact integral value", e);
    }
  }
}
