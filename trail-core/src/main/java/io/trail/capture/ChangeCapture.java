package io.trail.capture;

import io.trail.TrailOptions;
import io.trail.model.ChangeSet;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Version;
import io.trail.model.VersionEvent;
import io.trail.util.JsonCodec;

import java.util.Map;
import java.util.Objects;

/**
 * Computes the {@code item_changes} payload of a version.
 *
 * <p>Inserts, deletes and soft deletes record a full snapshot of the entity. Updates
 * record exactly the change mapping of the change set. Values are converted to their
 * JSON-normal form, so a captured version equals the same version read back from storage.
 *
 * <p>Captured versions are unsaved: {@code id} and {@code insertedAt} are {@code null}.
 */
public final class ChangeCapture {
  private final JsonCodec jsonCodec;

  public ChangeCapture(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Captures a version from a change set. For {@link VersionEvent#INSERT} the snapshot is
   * the change set applied to its base; for deletes it is the base entity.
   */
  public Version capture(VersionEvent event, ChangeSet changeSet, TrailOptions options) {
    Objects.requireNonNull(changeSet, "changeSet");
    Map<String, ?> itemChanges = switch (event) {
      case INSERT -> changeSet.apply().attributes();
      case UPDATE -> changeSet.changes();
      case DELETE, SOFT_DELETE -> changeSet.data().attributes();
    };
    return build(event, changeSet.schema(), changeSet.data().id(), itemChanges, options);
  }

  /**
   * Captures a snapshot version of a persisted entity.
   *
   * @throws IllegalArgumentException for {@link VersionEvent#UPDATE}, which needs a change set
   */
  public Version capture(VersionEvent event, Entity entity, TrailOptions options) {
    Objects.requireNonNull(entity, "entity");
    Map<String, ?> itemChanges = switch (event) {
      case INSERT, DELETE, SOFT_DELETE -> entity.attributes();
      case UPDATE -> throw new IllegalArgumentException("Update versions are captured from a change set");
    };
    return build(event, entity.schema(), entity.id(), itemChanges, options);
  }

  /** Builds the shared template of the versions a bulk operation writes. */
  public VersionProjection project(VersionEvent event, EntitySchema schema, Map<String, ?> changes,
                                   TrailOptions options) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(options, "options");
    return new VersionProjection(
        event,
        schema,
        jsonCodec.normalize(changes),
        options.originatorId(),
        options.origin(),
        jsonCodec.normalize(options.meta()));
  }

  /** Converts raw item changes to their JSON-normal form. */
  public Map<String, Object> normalize(Map<String, ?> itemChanges) {
    return jsonCodec.normalize(itemChanges);
  }

  private Version build(VersionEvent event, EntitySchema schema, Long itemId, Map<String, ?> itemChanges,
                        TrailOptions options) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(options, "options");
    return new Version(
        null,
        event,
        schema.itemType(),
        itemId,
        jsonCodec.normalize(itemChanges),
        options.originatorId(),
        options.origin(),
        jsonCodec.normalize(options.meta()),
        null);
  }
}
