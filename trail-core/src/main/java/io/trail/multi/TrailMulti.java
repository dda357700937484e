package io.trail.multi;

import io.trail.TrailMode;
import io.trail.TrailOptions;
import io.trail.capture.ChangeCapture;
import io.trail.model.ChangeSet;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Filter;
import io.trail.model.VersionEvent;
import io.trail.spi.EntityStore;
import io.trail.spi.VersionStore;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Composes versioned mutations into a {@link Multi}. Instances are immutable; each call
 * returns a new composer with the operation's steps appended.
 *
 * <p>Every single-row operation adds a model step and a version step, named by
 * {@link TrailOptions#modelKey()} and {@link TrailOptions#versionKey()}:
 * <pre>{@code
 * TrailMulti plan = trail.multi()
 *     .insert(company, TrailOptions.defaults())
 *     .update(person, TrailOptions.builder().modelKey("person").versionKey("person_version").build());
 * TrailResult result = trail.commit(plan, TrailOptions.defaults());
 * }</pre>
 *
 * <p>In {@link TrailMode#STRICT} single-row inserts and updates are delegated to the
 * {@link SequenceLinker}, and bulk operations fail with
 * {@link UnsupportedOperationException} before any step is added.
 */
public final class TrailMulti {
  private final TrailMode mode;
  private final ChangeCapture capture;
  private final EntityStore entityStore;
  private final VersionStore versionStore;
  private final Clock clock;
  private final SequenceLinker linker;
  private final BulkPlanner bulkPlanner;
  private final Multi multi;

  public TrailMulti(TrailMode mode, ChangeCapture capture, EntityStore entityStore, VersionStore versionStore,
                    Clock clock) {
    this(mode, capture, entityStore, versionStore, clock,
        new SequenceLinker(capture, entityStore, versionStore),
        new BulkPlanner(capture, entityStore, versionStore, clock),
        Multi.empty());
  }

  private TrailMulti(TrailMode mode, ChangeCapture capture, EntityStore entityStore, VersionStore versionStore,
                     Clock clock, SequenceLinker linker, BulkPlanner bulkPlanner, Multi multi) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.capture = Objects.requireNonNull(capture, "capture");
    this.entityStore = Objects.requireNonNull(entityStore, "entityStore");
    this.versionStore = Objects.requireNonNull(versionStore, "versionStore");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.linker = linker;
    this.bulkPlanner = bulkPlanner;
    this.multi = multi;
  }

  public TrailMulti insert(ChangeSet changeSet, TrailOptions options) {
    Objects.requireNonNull(changeSet, "changeSet");
    Objects.requireNonNull(options, "options");
    if (mode == TrailMode.STRICT) {
      return with(linker.insert(multi, changeSet, options));
    }
    String modelKey = options.modelKey();
    return with(multi
        .run(modelKey, changeSet, (conn, results) -> StepOutcome.ok(entityStore.insert(conn, changeSet)))
        .run(options.versionKey(), (conn, results) -> {
          Entity model = results.entity(modelKey);
          return StepOutcome.ok(versionStore.insert(conn, capture.capture(VersionEvent.INSERT, model, options)));
        }));
  }

  /**
   * Adds an update. When the change set has no changes the model step returns the entity
   * unchanged and the version step produces {@code null}; nothing is written.
   */
  public TrailMulti update(ChangeSet changeSet, TrailOptions options) {
    Objects.requireNonNull(changeSet, "changeSet");
    Objects.requireNonNull(options, "options");
    if (changeSet.data().id() == null) {
      throw new IllegalArgumentException("Cannot update an entity that was never persisted");
    }
    if (mode == TrailMode.STRICT) {
      return with(linker.update(multi, changeSet, options));
    }
    return with(multi
        .run(options.modelKey(), changeSet, (conn, results) -> StepOutcome.ok(entityStore.update(conn, changeSet)))
        .run(options.versionKey(), (conn, results) -> {
          if (!changeSet.hasChanges()) {
            return StepOutcome.ok(null);
          }
          return StepOutcome.ok(versionStore.insert(conn, capture.capture(VersionEvent.UPDATE, changeSet, options)));
        }));
  }

  /** Adds a delete; the version records the entity as it was before removal. */
  public TrailMulti delete(Entity entity, TrailOptions options) {
    requirePersisted(entity);
    Objects.requireNonNull(options, "options");
    return with(multi
        .run(options.modelKey(), (conn, results) -> StepOutcome.ok(entityStore.delete(conn, entity)))
        .run(options.versionKey(), (conn, results) ->
            StepOutcome.ok(versionStore.insert(conn, capture.capture(VersionEvent.DELETE, entity, options)))));
  }

  /** Adds a delete of the change set's base entity, failing the model step if the change set is invalid. */
  public TrailMulti delete(ChangeSet changeSet, TrailOptions options) {
    Objects.requireNonNull(changeSet, "changeSet");
    Entity entity = changeSet.data();
    requirePersisted(entity);
    return with(multi
        .run(options.modelKey(), changeSet, (conn, results) -> StepOutcome.ok(entityStore.delete(conn, entity)))
        .run(options.versionKey(), (conn, results) ->
            StepOutcome.ok(versionStore.insert(conn, capture.capture(VersionEvent.DELETE, changeSet, options)))));
  }

  /**
   * Adds a soft delete setting {@code deleted_at} to now. The version records the entity
   * as it was before the update.
   *
   * @throws IllegalStateException if the schema has no {@code deleted_at} column
   */
  public TrailMulti softDelete(Entity entity, TrailOptions options) {
    requirePersisted(entity);
    Objects.requireNonNull(options, "options");
    if (!entity.schema().hasSoftDelete()) {
      throw new IllegalStateException(entity.schema().itemType() + " does not support soft deletes");
    }
    return with(multi
        .run(options.modelKey(), (conn, results) -> {
          Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
          return StepOutcome.ok(entityStore.softDelete(conn, entity, now));
        })
        .run(options.versionKey(), (conn, results) ->
            StepOutcome.ok(versionStore.insert(conn, capture.capture(VersionEvent.SOFT_DELETE, entity, options)))));
  }

  public TrailMulti insertAll(EntitySchema schema, List<? extends Map<String, ?>> rows, TrailOptions options) {
    requireBulkSupported("insert_all");
    return with(bulkPlanner.insertAll(multi, schema, rows, options));
  }

  public TrailMulti updateAll(EntitySchema schema, Filter where, Map<String, ?> set, TrailOptions options) {
    requireBulkSupported("update_all");
    return with(bulkPlanner.updateAll(multi, schema, where, set, options));
  }

  public TrailMulti softDeleteAll(EntitySchema schema, Filter where, TrailOptions options) {
    requireBulkSupported("soft_delete_all");
    return with(bulkPlanner.softDeleteAll(multi, schema, where, options));
  }

  /** Adds an arbitrary step. */
  public TrailMulti run(String name, Step step) {
    return with(multi.run(name, step));
  }

  public TrailMulti merge(Multi.MergeFunction function) {
    return with(multi.merge(function));
  }

  public TrailMulti error(String name, Object error) {
    return with(multi.error(name, error));
  }

  public TrailMulti append(Multi other) {
    return with(multi.append(other));
  }

  public TrailMulti prepend(Multi other) {
    return with(multi.prepend(other));
  }

  public TrailMode mode() {
    return mode;
  }

  public Multi toMulti() {
    return multi;
  }

  private TrailMulti with(Multi next) {
    return new TrailMulti(mode, capture, entityStore, versionStore, clock, linker, bulkPlanner, next);
  }

  private void requireBulkSupported(String operation) {
    if (mode == TrailMode.STRICT) {
      throw new UnsupportedOperationException("Strict mode not implemented for " + operation);
    }
  }

  private static void requirePersisted(Entity entity) {
    Objects.requireNonNull(entity, "entity");
    if (entity.id() == null) {
      throw new IllegalArgumentException("Entity " + entity.schema().itemType() + " was never persisted");
    }
  }
}
