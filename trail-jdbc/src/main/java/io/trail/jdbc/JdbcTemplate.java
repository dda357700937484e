package io.trail.jdbc;

import io.trail.jdbc.spi.Dialect;
import io.trail.spi.TrailStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in the entity and version stores.
 * Every {@link SQLException} is rethrown as {@link TrailStoreException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new TrailStoreException("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        return mapAll(rs, mapper);
      }
    } catch (SQLException e) {
      throw new TrailStoreException("Failed to execute query", e);
    }
  }

  /** Execute a SELECT returning a single number. */
  public static long queryForLong(Connection conn, String sql, Object... params) {
    List<Long> values = query(conn, sql, rs -> rs.getLong(1), params);
    if (values.isEmpty()) {
      throw new TrailStoreException("Query returned no rows: " + sql);
    }
    return values.get(0);
  }

  /** Execute INSERT ... RETURNING, map returned rows (PostgreSQL). */
  public static <T> List<T> insertReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        return mapAll(rs, mapper);
      }
    } catch (SQLException e) {
      throw new TrailStoreException("Failed to execute insertReturning", e);
    }
  }

  /** Execute a single-row INSERT, return the generated key. */
  public static long insertReturningKey(Connection conn, Dialect dialect, String sql, String keyColumn,
                                        Object... params) {
    try (PreparedStatement ps = dialect.prepareInsert(conn, sql, keyColumn)) {
      bindParams(ps, params);
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new TrailStoreException("Insert returned no generated key");
        }
        return keys.getLong(1);
      }
    } catch (SQLException e) {
      throw new TrailStoreException("Failed to execute insert", e);
    }
  }

  /** Execute a batched INSERT, return the generated keys in batch order. */
  public static List<Long> batchInsertReturningKeys(Connection conn, Dialect dialect, String sql, String keyColumn,
                                                    List<Object[]> batch) {
    if (batch.isEmpty()) {
      return List.of();
    }
    try (PreparedStatement ps = dialect.prepareInsert(conn, sql, keyColumn)) {
      for (Object[] params : batch) {
        bindParams(ps, params);
        ps.addBatch();
      }
      ps.executeBatch();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        return mapAll(keys, rs -> rs.getLong(1));
      }
    } catch (SQLException e) {
      throw new TrailStoreException("Failed to execute batch insert", e);
    }
  }

  private static <T> List<T> mapAll(ResultSet rs, RowMapper<T> mapper) throws SQLException {
    List<T> results = new ArrayList<>();
    while (rs.next()) {
      results.add(mapper.map(rs));
    }
    return results;
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
