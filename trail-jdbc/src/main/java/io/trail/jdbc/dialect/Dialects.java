package io.trail.jdbc.dialect;

import io.trail.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for database dialects with auto-detection support.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.trail.jdbc.spi.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * Dialect dialect = Dialects.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * Dialect dialect = Dialects.detect("jdbc:postgresql://localhost/ledger");
 *
 * // Get by name
 * Dialect dialect = Dialects.get("h2");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS;
  private static final Map<String, Dialect> BY_NAME = new ConcurrentHashMap<>();

  static {
    DIALECTS = ServiceLoader.load(Dialect.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  /**
   * Returns all registered dialects.
   */
  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the dialect
   * @throws IllegalArgumentException if no dialect found
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Auto-detects the dialect of a DataSource, using one short-lived connection.
   *
   * @throws IllegalStateException if the connection fails or no dialect matches
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
  }

  /**
   * Auto-detects the dialect of an open connection from its URL, falling back to the
   * product name reported by the driver.
   *
   * @throws IllegalStateException if the metadata cannot be read or no dialect matches
   */
  public static Dialect detect(Connection conn) {
    try {
      String url = conn.getMetaData().getURL();
      Dialect byUrl = url == null ? null : matchUrl(url);
      if (byUrl != null) {
        return byUrl;
      }
      String product = conn.getMetaData().getDatabaseProductName();
      Dialect byProduct = product == null ? null : BY_NAME.get(product.toLowerCase(Locale.ROOT));
      if (byProduct == null) {
        throw new IllegalStateException("No dialect found for " + product + " at " + url);
      }
      return byProduct;
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read connection metadata", e);
    }
  }

  /**
   * Auto-detects dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching dialect found
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    Dialect dialect = matchUrl(jdbcUrl);
    if (dialect == null) {
      throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl +
          ". Supported prefixes: " + allPrefixes());
    }
    return dialect;
  }

  private static Dialect matchUrl(String jdbcUrl) {
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    return null;
  }

  private static List<String> allPrefixes() {
    return DIALECTS.stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList();
  }
}
