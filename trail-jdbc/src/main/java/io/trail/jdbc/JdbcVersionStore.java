package io.trail.jdbc;

import io.trail.capture.VersionProjection;
import io.trail.jdbc.spi.Dialect;
import io.trail.model.BulkResult;
import io.trail.model.EntitySchema;
import io.trail.model.Filter;
import io.trail.model.Version;
import io.trail.model.VersionEvent;
import io.trail.spi.StaleEntityException;
import io.trail.spi.VersionStore;
import io.trail.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link VersionStore} writing to the {@code versions} table (or a custom one).
 *
 * <p>Projected bulk versions are written with one {@code INSERT ... SELECT}. When the
 * caller wants the rows back and the dialect cannot return them from that statement,
 * the matching keys are selected first and the versions inserted as a batch.
 */
public final class JdbcVersionStore implements VersionStore {
  private static final Logger logger = Logger.getLogger(JdbcVersionStore.class.getName());

  private static final String SELECT_COLUMNS = "id, " + Dialect.VERSION_COLUMNS;

  private final Dialect dialect;
  private final String table;
  private final JsonCodec jsonCodec;
  private final Clock clock;
  private final JdbcTemplate.RowMapper<Version> rowMapper;

  public JdbcVersionStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_VERSIONS_TABLE);
  }

  public JdbcVersionStore(Dialect dialect, String table) {
    this(dialect, table, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JdbcVersionStore(Dialect dialect, String table, JsonCodec jsonCodec, Clock clock) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.rowMapper = rs -> new Version(
        rs.getLong("id"),
        VersionEvent.fromCode(rs.getString("event")),
        rs.getString("item_type"),
        JdbcValues.readLong(rs, "item_id"),
        jsonCodec.parseObject(rs.getString("item_changes")),
        JdbcValues.readLong(rs, "originator_id"),
        rs.getString("origin"),
        jsonCodec.parseObject(rs.getString("meta")),
        JdbcValues.readInstant(rs, "inserted_at"));
  }

  public String table() {
    return table;
  }

  @Override
  public Version insert(Connection conn, Version version) {
    if (version.isPersisted()) {
      throw new IllegalArgumentException("Version " + version.id() + " is already persisted");
    }
    Instant insertedAt = version.insertedAt() != null ? version.insertedAt() : now();
    long id = JdbcTemplate.insertReturningKey(conn, dialect, dialect.insertVersionSql(table), "id",
        insertParams(version, version.itemId(), insertedAt));
    logger.log(Level.FINE, "Appended {0} version {1} for {2} {3}",
        new Object[] {version.event().code(), id, version.itemType(), version.itemId()});
    return version.withId(id, insertedAt);
  }

  @Override
  public Version updateItem(Connection conn, Version version) {
    if (!version.isPersisted()) {
      throw new IllegalArgumentException("Version is not persisted");
    }
    int rows = JdbcTemplate.update(conn, dialect.updateVersionItemSql(table),
        version.itemId(), jsonCodec.toJson(version.itemChanges()), version.id());
    if (rows == 0) {
      throw new StaleEntityException("Version", version.id());
    }
    return version;
  }

  @Override
  public BulkResult<Version> insertProjected(Connection conn, VersionProjection projection, Filter where,
                                             boolean returning) {
    EntitySchema schema = projection.schema();
    FilterSql.Fragment filter = FilterSql.render(where, schema, jsonCodec);
    Instant insertedAt = now();

    if (returning && !dialect.supportsInsertReturning()) {
      return insertProjectedByKey(conn, projection, filter, insertedAt);
    }

    List<Object> params = new ArrayList<>();
    params.add(projection.event().code());
    params.add(schema.itemType());
    params.add(jsonCodec.toJson(projection.itemChanges()));
    params.add(projection.originatorId());
    params.add(projection.origin());
    params.add(jsonCodec.toJson(projection.meta()));
    params.add(Timestamp.from(insertedAt));
    params.addAll(filter.params());
    String sql = dialect.projectVersionsSql(table, schema.table(), schema.primaryKey(), filter.sql(), returning);

    if (returning) {
      return BulkResult.of(JdbcTemplate.insertReturning(conn, sql, rowMapper, params.toArray()));
    }
    return BulkResult.of(JdbcTemplate.update(conn, sql, params.toArray()));
  }

  @Override
  public List<Version> findByItem(Connection conn, String itemType, long itemId) {
    return JdbcTemplate.query(conn,
        "SELECT " + SELECT_COLUMNS + " FROM " + table + " WHERE item_type=? AND item_id=? ORDER BY id",
        rowMapper, itemType, itemId);
  }

  @Override
  public Optional<Version> findById(Connection conn, long id) {
    return JdbcTemplate.query(conn, "SELECT " + SELECT_COLUMNS + " FROM " + table + " WHERE id=?", rowMapper, id)
        .stream()
        .findFirst();
  }

  @Override
  public long count(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + table);
  }

  @Override
  public long nextIdHint(Connection conn) {
    return JdbcTemplate.queryForLong(conn, dialect.nextIdSql(table, "id"));
  }

  private BulkResult<Version> insertProjectedByKey(Connection conn, VersionProjection projection,
                                                   FilterSql.Fragment filter, Instant insertedAt) {
    EntitySchema schema = projection.schema();
    List<Long> itemIds = JdbcTemplate.query(conn,
        "SELECT " + schema.primaryKey() + " FROM " + schema.table() + " WHERE " + filter.sql()
            + " ORDER BY " + schema.primaryKey(),
        rs -> rs.getLong(1), filter.params().toArray());

    List<Version> templates = new ArrayList<>();
    List<Object[]> batch = new ArrayList<>();
    for (Long itemId : itemIds) {
      Version version = new Version(null, projection.event(), schema.itemType(), itemId, projection.itemChanges(),
          projection.originatorId(), projection.origin(), projection.meta(), insertedAt);
      templates.add(version);
      batch.add(insertParams(version, itemId, insertedAt));
    }
    List<Long> keys = JdbcTemplate.batchInsertReturningKeys(conn, dialect, dialect.insertVersionSql(table), "id", batch);

    List<Version> inserted = new ArrayList<>();
    for (int i = 0; i < keys.size(); i++) {
      inserted.add(templates.get(i).withId(keys.get(i), insertedAt));
    }
    return new BulkResult<>(itemIds.size(), inserted);
  }

  private Object[] insertParams(Version version, Long itemId, Instant insertedAt) {
    return new Object[] {
        version.event().code(),
        version.itemType(),
        itemId,
        jsonCodec.toJson(version.itemChanges()),
        version.originatorId(),
        version.origin(),
        jsonCodec.toJson(version.meta()),
        Timestamp.from(insertedAt)
    };
  }

  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
  }
}
