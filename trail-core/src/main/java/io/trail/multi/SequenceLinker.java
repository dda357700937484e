package io.trail.multi;

import io.trail.TrailOptions;
import io.trail.capture.ChangeCapture;
import io.trail.model.ChangeSet;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Version;
import io.trail.model.VersionEvent;
import io.trail.spi.EntityStore;
import io.trail.spi.VersionStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Strict-mode choreography linking an entity to its versions.
 *
 * <p>Each operation adds three steps to the plan:
 * <ol>
 *   <li>{@value #INITIAL_VERSION}: insert a placeholder version. Its generated id is the
 *       id the entity will point to.</li>
 *   <li>the model step: write the entity with {@code current_version_id} (and, for
 *       inserts, {@code first_version_id}) set to the placeholder's id.</li>
 *   <li>the version step: rewrite the placeholder with the entity's final state.</li>
 * </ol>
 *
 * <p>The {@code max(id) + 1} values read in the first step only fill the placeholder's
 * provisional payload. Every id the entity stores comes from the ledger's own key
 * generator, so two concurrent writers can never link to the same version.
 */
public final class SequenceLinker {
  /** Internal step holding the placeholder version; never surfaced to callers. */
  public static final String INITIAL_VERSION = "initial_version";

  /** Link columns owned by the linker. */
  public static final List<String> LINK_COLUMNS =
      List.of(EntitySchema.FIRST_VERSION_ID, EntitySchema.CURRENT_VERSION_ID);

  private final ChangeCapture capture;
  private final EntityStore entityStore;
  private final VersionStore versionStore;

  public SequenceLinker(ChangeCapture capture, EntityStore entityStore, VersionStore versionStore) {
    this.capture = Objects.requireNonNull(capture, "capture");
    this.entityStore = Objects.requireNonNull(entityStore, "entityStore");
    this.versionStore = Objects.requireNonNull(versionStore, "versionStore");
  }

  /**
   * Adds the steps of a linked insert.
   *
   * @throws IllegalStateException if the schema has no link columns
   */
  public Multi insert(Multi multi, ChangeSet changeSet, TrailOptions options) {
    requireLinks(changeSet.schema());
    String modelKey = options.modelKey();
    ChangeSet unlinked = changeSet.without(LINK_COLUMNS);

    return multi
        .run(INITIAL_VERSION, (conn, results) -> {
          long versionHint = versionStore.nextIdHint(conn);
          long itemHint = entityStore.nextIdHint(conn, changeSet.schema());
          Map<String, Object> provisional = new LinkedHashMap<>();
          provisional.put(changeSet.schema().primaryKey(), itemHint);
          provisional.put(EntitySchema.FIRST_VERSION_ID, versionHint);
          provisional.put(EntitySchema.CURRENT_VERSION_ID, versionHint);
          Entity predicted = unlinked.apply().with(provisional);
          Version placeholder = capture.capture(VersionEvent.INSERT, predicted, options);
          return StepOutcome.ok(versionStore.insert(conn, placeholder));
        })
        .run(modelKey, unlinked, (conn, results) -> {
          Version initial = results.version(INITIAL_VERSION);
          ChangeSet linked = unlinked.change(links(initial.id(), true));
          return StepOutcome.ok(entityStore.insert(conn, linked));
        })
        .run(options.versionKey(), (conn, results) -> {
          Version initial = results.version(INITIAL_VERSION);
          Entity model = results.entity(modelKey);
          Version persisted = capture.capture(VersionEvent.INSERT, model, options);
          return StepOutcome.ok(versionStore.updateItem(conn, initial.withItem(model.id(), persisted.itemChanges())));
        });
  }

  /**
   * Adds the steps of a linked update. An update without changes adds the model and
   * version steps only; neither writes anything.
   *
   * @throws IllegalStateException if the schema has no link columns
   * @throws IllegalArgumentException if the change set changes {@code first_version_id}
   */
  public Multi update(Multi multi, ChangeSet changeSet, TrailOptions options) {
    requireLinks(changeSet.schema());
    if (changeSet.changes().containsKey(EntitySchema.FIRST_VERSION_ID)) {
      throw new IllegalArgumentException("first_version_id cannot be changed after creation");
    }
    ChangeSet unlinked = changeSet.without(List.of(EntitySchema.CURRENT_VERSION_ID));
    if (!unlinked.hasChanges()) {
      return multi
          .run(options.modelKey(), unlinked, (conn, results) -> StepOutcome.ok(entityStore.update(conn, unlinked)))
          .run(options.versionKey(), (conn, results) -> StepOutcome.ok(null));
    }

    return multi
        .run(INITIAL_VERSION, (conn, results) -> {
          Version placeholder = capture.capture(VersionEvent.UPDATE, unlinked, options);
          return StepOutcome.ok(versionStore.insert(conn, placeholder));
        })
        .run(options.modelKey(), unlinked, (conn, results) -> {
          Version initial = results.version(INITIAL_VERSION);
          ChangeSet linked = unlinked.change(links(initial.id(), false));
          return StepOutcome.ok(entityStore.update(conn, linked));
        })
        .run(options.versionKey(), (conn, results) -> {
          Version initial = results.version(INITIAL_VERSION);
          Map<String, Object> itemChanges = new LinkedHashMap<>(initial.itemChanges());
          itemChanges.put(EntitySchema.CURRENT_VERSION_ID, initial.id());
          Version linked = initial.withItem(initial.itemId(), capture.normalize(itemChanges));
          return StepOutcome.ok(versionStore.updateItem(conn, linked));
        });
  }

  private static Map<String, Object> links(Long versionId, boolean first) {
    Map<String, Object> links = new LinkedHashMap<>();
    if (first) {
      links.put(EntitySchema.FIRST_VERSION_ID, versionId);
    }
    links.put(EntitySchema.CURRENT_VERSION_ID, versionId);
    return links;
  }

  private static void requireLinks(EntitySchema schema) {
    if (!schema.hasVersionLinks()) {
      throw new IllegalStateException(
          "Strict mode requires first_version_id and current_version_id on " + schema.itemType());
    }
  }
}
