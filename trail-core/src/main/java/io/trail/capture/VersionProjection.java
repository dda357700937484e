package io.trail.capture;

import io.trail.model.EntitySchema;
import io.trail.model.VersionEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Template of the version rows a bulk operation writes: every field except {@code item_id},
 * which the store fills in from each matching row.
 *
 * @param event        event recorded on every projected version
 * @param schema       schema of the entity table the projection reads
 * @param itemChanges  JSON-normal item changes shared by all projected versions
 * @param originatorId acting user, may be {@code null}
 * @param origin       source tag, may be {@code null}
 * @param meta         JSON-normal annotation, may be {@code null}
 */
public record VersionProjection(
    VersionEvent event,
    EntitySchema schema,
    Map<String, Object> itemChanges,
    Long originatorId,
    String origin,
    Map<String, Object> meta) {

  public VersionProjection {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(schema, "schema");
    itemChanges = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(itemChanges, "itemChanges")));
    if (meta != null) {
      meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }
  }
}
