package io.trail.multi;

import io.trail.TrailOptions;
import io.trail.capture.ChangeCapture;
import io.trail.capture.VersionProjection;
import io.trail.model.BulkResult;
import io.trail.model.Column;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Filter;
import io.trail.model.VersionEvent;
import io.trail.spi.EntityStore;
import io.trail.spi.VersionStore;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plans multi-row mutations and their versions.
 *
 * <p>Batch inserts write the rows first and then one version per persisted row, each
 * under its own step {@code versionKey + ":" + id}. Filtered updates write the projected
 * versions first and then update the rows, so no updated row is ever visible without its
 * version.
 */
public final class BulkPlanner {
  private final ChangeCapture capture;
  private final EntityStore entityStore;
  private final VersionStore versionStore;
  private final Clock clock;

  public BulkPlanner(ChangeCapture capture, EntityStore entityStore, VersionStore versionStore, Clock clock) {
    this.capture = Objects.requireNonNull(capture, "capture");
    this.entityStore = Objects.requireNonNull(entityStore, "entityStore");
    this.versionStore = Objects.requireNonNull(versionStore, "versionStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Step name of the version recorded for the row with {@code id}. */
  public static String rowVersionKey(String versionKey, Long id) {
    return versionKey + ":" + id;
  }

  public Multi insertAll(Multi multi, EntitySchema schema, List<? extends Map<String, ?>> rows,
                         TrailOptions options) {
    Objects.requireNonNull(schema, "schema");
    List<Map<String, Object>> payload = new ArrayList<>();
    for (Map<String, ?> row : rows) {
      payload.add(coerce(schema, row));
    }
    String modelKey = options.modelKey();

    return multi
        .run(modelKey, (conn, results) -> StepOutcome.ok(entityStore.insertAll(conn, schema, payload)))
        .merge((conn, results) -> {
          BulkResult<Entity> inserted = results.bulk(modelKey);
          Multi versions = Multi.empty();
          for (Entity row : inserted.rows()) {
            if (row.id() == null) {
              continue;
            }
            versions = versions.run(rowVersionKey(options.versionKey(), row.id()), (c, r) ->
                StepOutcome.ok(versionStore.insert(c, capture.capture(VersionEvent.INSERT, row, options))));
          }
          return versions;
        });
  }

  public Multi updateAll(Multi multi, EntitySchema schema, Filter where, Map<String, ?> set,
                         TrailOptions options) {
    Objects.requireNonNull(where, "where");
    Map<String, Object> changes = coerce(schema, set);
    if (changes.isEmpty()) {
      throw new IllegalArgumentException("update_all requires at least one attribute to set");
    }
    return projectThenUpdate(multi, VersionEvent.UPDATE, schema, where, changes, options);
  }

  /**
   * @throws IllegalStateException if the schema has no {@code deleted_at} column
   */
  public Multi softDeleteAll(Multi multi, EntitySchema schema, Filter where, TrailOptions options) {
    Objects.requireNonNull(where, "where");
    if (!schema.hasSoftDelete()) {
      throw new IllegalStateException(schema.itemType() + " does not support soft deletes");
    }
    Map<String, Object> changes = new LinkedHashMap<>();
    changes.put(EntitySchema.DELETED_AT, Instant.now(clock).truncatedTo(ChronoUnit.MILLIS));
    return projectThenUpdate(multi, VersionEvent.SOFT_DELETE, schema, where, changes, options);
  }

  private Multi projectThenUpdate(Multi multi, VersionEvent event, EntitySchema schema, Filter where,
                                  Map<String, Object> changes, TrailOptions options) {
    VersionProjection projection = capture.project(event, schema, changes, options);
    boolean returning = options.returnsVersionRows();
    return multi
        .run(options.versionKey(), (conn, results) ->
            StepOutcome.ok(versionStore.insertProjected(conn, projection, where, returning)))
        .run(options.modelKey(), (conn, results) ->
            StepOutcome.ok(BulkResult.of(entityStore.updateAll(conn, schema, where, changes))));
  }

  private static Map<String, Object> coerce(EntitySchema schema, Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    Map<String, Object> coerced = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      Column column = schema.requireColumn(entry.getKey());
      coerced.put(column.name(), column.type().coerce(entry.getValue()));
    }
    return coerced;
  }
}
