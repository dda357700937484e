package io.trail.jdbc;

import io.trail.jdbc.spi.Dialect;
import io.trail.model.BulkResult;
import io.trail.model.ChangeSet;
import io.trail.model.Column;
import io.trail.model.ColumnType;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Filter;
import io.trail.spi.EntityStore;
import io.trail.spi.StaleEntityException;
import io.trail.spi.TrailStoreException;
import io.trail.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link EntityStore}. SQL is built from the {@link io.trail.model.EntitySchema},
 * whose table and column names are validated identifiers.
 *
 * <p>{@code inserted_at} and {@code updated_at} are maintained for schemas with
 * timestamps. Every write re-reads the row, so returned entities reflect column defaults
 * and triggers.
 */
public final class JdbcEntityStore implements EntityStore {
  private static final Logger logger = Logger.getLogger(JdbcEntityStore.class.getName());

  private final Dialect dialect;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public JdbcEntityStore(Dialect dialect) {
    this(dialect, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JdbcEntityStore(Dialect dialect, JsonCodec jsonCodec, Clock clock) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Entity insert(Connection conn, ChangeSet changeSet) {
    EntitySchema schema = changeSet.schema();
    Entity entity = changeSet.apply();
    Map<String, Object> values = insertValues(entity, now());
    String sql = insertSql(schema, values.keySet());
    Object[] params = params(schema, values);

    long id;
    if (entity.id() != null) {
      JdbcTemplate.update(conn, sql, params);
      id = entity.id();
    } else {
      id = JdbcTemplate.insertReturningKey(conn, dialect, sql, schema.primaryKey(), params);
    }
    logger.log(Level.FINE, "Inserted {0} {1}", new Object[] {schema.itemType(), id});
    return reload(conn, schema, id);
  }

  @Override
  public Entity update(Connection conn, ChangeSet changeSet) {
    if (!changeSet.hasChanges()) {
      return changeSet.data();
    }
    return updateRow(conn, changeSet.data(), changeSet.changes());
  }

  @Override
  public Entity delete(Connection conn, Entity entity) {
    EntitySchema schema = entity.schema();
    int rows = JdbcTemplate.update(conn,
        "DELETE FROM " + schema.table() + " WHERE " + schema.primaryKey() + "=?", requireId(entity));
    if (rows == 0) {
      throw new StaleEntityException(schema.itemType(), entity.id());
    }
    return entity;
  }

  @Override
  public Entity softDelete(Connection conn, Entity entity, Instant deletedAt) {
    if (!entity.schema().hasSoftDelete()) {
      throw new IllegalArgumentException(entity.schema().itemType() + " does not support soft deletes");
    }
    Map<String, Object> set = new LinkedHashMap<>();
    set.put(EntitySchema.DELETED_AT, Objects.requireNonNull(deletedAt, "deletedAt"));
    return updateRow(conn, entity, set);
  }

  @Override
  public BulkResult<Entity> insertAll(Connection conn, EntitySchema schema, List<Map<String, Object>> rows) {
    if (rows.isEmpty()) {
      return BulkResult.of(List.of());
    }
    Instant now = now();
    List<String> columns = new ArrayList<>(schema.columnNames());
    columns.remove(schema.primaryKey());
    List<Object[]> batch = new ArrayList<>();
    for (Map<String, Object> row : rows) {
      Entity entity = Entity.of(schema, row);
      if (entity.id() != null) {
        throw new IllegalArgumentException("insert_all generates primary keys, got " + entity.id());
      }
      Map<String, Object> values = insertValues(entity, now);
      batch.add(params(schema, values));
    }

    List<Long> keys = JdbcTemplate.batchInsertReturningKeys(
        conn, dialect, insertSql(schema, columns), schema.primaryKey(), batch);
    if (keys.size() < rows.size()) {
      logger.log(Level.FINE, "Batch insert into {0} returned {1} of {2} keys",
          new Object[] {schema.table(), keys.size(), rows.size()});
    }
    return new BulkResult<>(rows.size(), findAllById(conn, schema, keys));
  }

  @Override
  public int updateAll(Connection conn, EntitySchema schema, Filter where, Map<String, Object> set) {
    if (set.isEmpty()) {
      throw new IllegalArgumentException("update_all requires at least one attribute to set");
    }
    Map<String, Object> values = new LinkedHashMap<>(set);
    if (schema.hasTimestamps()) {
      values.putIfAbsent(EntitySchema.UPDATED_AT, now());
    }
    FilterSql.Fragment filter = FilterSql.render(where, schema, jsonCodec);
    List<Object> params = new ArrayList<>(Arrays.asList(params(schema, values)));
    params.addAll(filter.params());
    String sql = "UPDATE " + schema.table() + " SET " + assignments(schema, values.keySet())
        + " WHERE " + filter.sql();
    return JdbcTemplate.update(conn, sql, params.toArray());
  }

  @Override
  public Optional<Entity> findById(Connection conn, EntitySchema schema, long id) {
    List<Entity> found = JdbcTemplate.query(conn,
        selectSql(schema) + " WHERE " + schema.primaryKey() + "=?", rs -> mapRow(schema, rs), id);
    return found.stream().findFirst();
  }

  /** Rows with the given keys, ordered by key. */
  public List<Entity> findAllById(Connection conn, EntitySchema schema, List<Long> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    StringJoiner markers = new StringJoiner(",", " WHERE " + schema.primaryKey() + " IN (", ")");
    ids.forEach(id -> markers.add("?"));
    return JdbcTemplate.query(conn,
        selectSql(schema) + markers + " ORDER BY " + schema.primaryKey(),
        rs -> mapRow(schema, rs), ids.toArray());
  }

  @Override
  public long count(Connection conn, EntitySchema schema) {
    return JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + schema.table());
  }

  @Override
  public long nextIdHint(Connection conn, EntitySchema schema) {
    return JdbcTemplate.queryForLong(conn, dialect.nextIdSql(schema.table(), schema.primaryKey()));
  }

  private Entity updateRow(Connection conn, Entity entity, Map<String, Object> changes) {
    EntitySchema schema = entity.schema();
    Map<String, Object> values = new LinkedHashMap<>(changes);
    if (schema.hasTimestamps()) {
      values.putIfAbsent(EntitySchema.UPDATED_AT, now());
    }
    List<Object> params = new ArrayList<>(Arrays.asList(params(schema, values)));
    params.add(requireId(entity));
    String sql = "UPDATE " + schema.table() + " SET " + assignments(schema, values.keySet())
        + " WHERE " + schema.primaryKey() + "=?";
    if (JdbcTemplate.update(conn, sql, params.toArray()) == 0) {
      throw new StaleEntityException(schema.itemType(), entity.id());
    }
    return reload(conn, schema, entity.id());
  }

  private Entity reload(Connection conn, EntitySchema schema, long id) {
    return findById(conn, schema, id).orElseThrow(() ->
        new TrailStoreException("Written " + schema.itemType() + " " + id + " could not be read back"));
  }

  private Map<String, Object> insertValues(Entity entity, Instant now) {
    EntitySchema schema = entity.schema();
    Map<String, Object> values = new LinkedHashMap<>(entity.attributes());
    if (entity.id() == null) {
      values.remove(schema.primaryKey());
    }
    if (schema.hasTimestamps()) {
      if (values.get(EntitySchema.INSERTED_AT) == null) {
        values.put(EntitySchema.INSERTED_AT, now);
      }
      if (values.get(EntitySchema.UPDATED_AT) == null) {
        values.put(EntitySchema.UPDATED_AT, now);
      }
    }
    return values;
  }

  private String insertSql(EntitySchema schema, Iterable<String> columns) {
    StringJoiner names = new StringJoiner(", ", "(", ")");
    StringJoiner markers = new StringJoiner(", ", "(", ")");
    for (String name : columns) {
      names.add(name);
      markers.add(marker(schema.requireColumn(name)));
    }
    return "INSERT INTO " + schema.table() + " " + names + " VALUES " + markers;
  }

  private String assignments(EntitySchema schema, Iterable<String> columns) {
    StringJoiner assignments = new StringJoiner(", ");
    for (String name : columns) {
      assignments.add(name + "=" + marker(schema.requireColumn(name)));
    }
    return assignments.toString();
  }

  private String marker(Column column) {
    return column.type() == ColumnType.JSON ? dialect.jsonParameter() : "?";
  }

  private Object[] params(EntitySchema schema, Map<String, Object> values) {
    List<Object> params = new ArrayList<>(values.size());
    for (Map.Entry<String, Object> value : values.entrySet()) {
      params.add(JdbcValues.toJdbc(schema.requireColumn(value.getKey()), value.getValue(), jsonCodec));
    }
    return params.toArray();
  }

  private String selectSql(EntitySchema schema) {
    return "SELECT " + String.join(", ", schema.columnNames()) + " FROM " + schema.table();
  }

  private Entity mapRow(EntitySchema schema, ResultSet rs) throws SQLException {
    Map<String, Object> values = new LinkedHashMap<>();
    for (Column column : schema.columns()) {
      values.put(column.name(), JdbcValues.read(rs, column, jsonCodec));
    }
    return Entity.of(schema, values);
  }

  private static long requireId(Entity entity) {
    if (entity.id() == null) {
      throw new IllegalArgumentException("Entity " + entity.schema().itemType() + " was never persisted");
    }
    return entity.id();
  }

  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
  }
}
