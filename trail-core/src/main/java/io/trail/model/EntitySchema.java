package io.trail.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes a tracked entity type: its logical item type, backing table, primary key and
 * typed columns in persistence order.
 *
 * <p>Use {@link #builder(String, String)} to construct:
 * <pre>{@code
 * EntitySchema companies = EntitySchema.builder("SimpleCompany", "simple_companies")
 *     .column("name", ColumnType.STRING)
 *     .column("city", ColumnType.STRING)
 *     .timestamps()
 *     .versionLinks()
 *     .build();
 * }</pre>
 */
public final class EntitySchema {
  public static final String INSERTED_AT = "inserted_at";
  public static final String UPDATED_AT = "updated_at";
  public static final String DELETED_AT = "deleted_at";
  public static final String FIRST_VERSION_ID = "first_version_id";
  public static final String CURRENT_VERSION_ID = "current_version_id";

  private static final String NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private final String itemType;
  private final String table;
  private final String primaryKey;
  private final Map<String, Column> columns;
  private final boolean timestamps;
  private final boolean softDelete;
  private final boolean versionLinks;

  private EntitySchema(Builder builder) {
    this.itemType = builder.itemType;
    this.table = builder.table;
    this.primaryKey = builder.primaryKey;
    this.timestamps = builder.timestamps;
    this.softDelete = builder.softDelete;
    this.versionLinks = builder.versionLinks;

    Map<String, Column> ordered = new LinkedHashMap<>();
    ordered.put(primaryKey, new Column(primaryKey, ColumnType.LONG));
    for (Column column : builder.columns) {
      if (ordered.putIfAbsent(column.name(), column) != null) {
        throw new IllegalArgumentException("Duplicate column: " + column.name());
      }
    }
    if (versionLinks) {
      addImplicit(ordered, FIRST_VERSION_ID, ColumnType.LONG);
      addImplicit(ordered, CURRENT_VERSION_ID, ColumnType.LONG);
    }
    if (softDelete) {
      addImplicit(ordered, DELETED_AT, ColumnType.TIMESTAMP);
    }
    if (timestamps) {
      addImplicit(ordered, INSERTED_AT, ColumnType.TIMESTAMP);
      addImplicit(ordered, UPDATED_AT, ColumnType.TIMESTAMP);
    }
    this.columns = Collections.unmodifiableMap(ordered);
  }

  private static void addImplicit(Map<String, Column> columns, String name, ColumnType type) {
    Column existing = columns.putIfAbsent(name, new Column(name, type));
    if (existing != null && existing.type() != type) {
      throw new IllegalArgumentException("Column " + name + " must be of type " + type);
    }
  }

  public static Builder builder(String itemType, String table) {
    return new Builder(itemType, table);
  }

  /** Logical type name recorded as {@code item_type} on versions. */
  public String itemType() {
    return itemType;
  }

  public String table() {
    return table;
  }

  public String primaryKey() {
    return primaryKey;
  }

  /** All columns in persistence order, primary key first. */
  public List<Column> columns() {
    return List.copyOf(columns.values());
  }

  public List<String> columnNames() {
    return List.copyOf(columns.keySet());
  }

  public Optional<Column> column(String name) {
    return Optional.ofNullable(columns.get(name));
  }

  /**
   * Returns the column with the given name.
   *
   * @throws IllegalArgumentException if the schema has no such column
   */
  public Column requireColumn(String name) {
    Column column = columns.get(name);
    if (column == null) {
      throw new IllegalArgumentException("Unknown column " + name + " for " + itemType);
    }
    return column;
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  public boolean hasTimestamps() {
    return timestamps;
  }

  public boolean hasSoftDelete() {
    return softDelete;
  }

  public boolean hasVersionLinks() {
    return versionLinks;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EntitySchema that)) {
      return false;
    }
    return itemType.equals(that.itemType) && table.equals(that.table)
        && columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(itemType, table, columns);
  }

  @Override
  public String toString() {
    return "EntitySchema{" + itemType + " -> " + table + "}";
  }

  public static final class Builder {
    private final String itemType;
    private final String table;
    private String primaryKey = "id";
    private final List<Column> columns = new ArrayList<>();
    private boolean timestamps;
    private boolean softDelete;
    private boolean versionLinks;

    private Builder(String itemType, String table) {
      this.itemType = Objects.requireNonNull(itemType, "itemType");
      this.table = Objects.requireNonNull(table, "table");
      if (itemType.isEmpty()) {
        throw new IllegalArgumentException("itemType must not be empty");
      }
      if (!table.matches(NAME_PATTERN)) {
        throw new IllegalArgumentException("Invalid table name: " + table);
      }
    }

    public Builder primaryKey(String primaryKey) {
      this.primaryKey = Objects.requireNonNull(primaryKey, "primaryKey");
      if (!primaryKey.matches(NAME_PATTERN)) {
        throw new IllegalArgumentException("Invalid primary key name: " + primaryKey);
      }
      return this;
    }

    public Builder column(String name, ColumnType type) {
      columns.add(new Column(name, type));
      return this;
    }

    /** Adds {@code inserted_at} and {@code updated_at}, maintained on every write. */
    public Builder timestamps() {
      this.timestamps = true;
      return this;
    }

    /** Adds {@code deleted_at}, set by soft deletes. */
    public Builder softDelete() {
      this.softDelete = true;
      return this;
    }

    /** Adds {@code first_version_id} and {@code current_version_id}, required by strict mode. */
    public Builder versionLinks() {
      this.versionLinks = true;
      return this;
    }

    public EntitySchema build() {
      return new EntitySchema(this);
    }
  }
}
