package io.trail.spring.boot;

import io.trail.TrailMode;
import io.trail.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for change versioning.
 *
 * @see TrailAutoConfiguration
 */
@ConfigurationProperties(prefix = "trail")
public class TrailProperties {

  /**
   * Versioning mode. STRICT links every entity to its first and current version.
   */
  private TrailMode mode = TrailMode.DEFAULT;

  /**
   * Table holding the versions.
   */
  private String versionsTable = TableNames.DEFAULT_VERSIONS_TABLE;

  /**
   * Dialect name (h2, mysql, postgresql). Detected from the DataSource when unset.
   */
  private String dialect;

  private final Metrics metrics = new Metrics();

  public TrailMode getMode() {
    return mode;
  }

  public void setMode(TrailMode mode) {
    this.mode = mode;
  }

  public String getVersionsTable() {
    return versionsTable;
  }

  public void setVersionsTable(String versionsTable) {
    this.versionsTable = versionsTable;
  }

  public String getDialect() {
    return dialect;
  }

  public void setDialect(String dialect) {
    this.dialect = dialect;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Metrics {
    /**
     * Whether to export Micrometer metrics when a MeterRegistry is present.
     */
    private boolean enabled = true;

    /**
     * Prefix of every meter name.
     */
    private String namePrefix = "trail";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
