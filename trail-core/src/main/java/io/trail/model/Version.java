package io.trail.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable entry of the version ledger.
 *
 * <p>{@code id} and {@code insertedAt} are {@code null} until the version is persisted.
 * {@code itemChanges} holds a full snapshot for insert, delete and soft-delete events and
 * the diff for update events.
 *
 * @param id           ledger-assigned identifier
 * @param event        kind of mutation
 * @param itemType     logical type of the tracked entity
 * @param itemId       identifier of the tracked entity
 * @param itemChanges  snapshot or diff, JSON-normal values
 * @param originatorId acting user, may be {@code null}
 * @param origin       free-text source tag, may be {@code null}
 * @param meta         arbitrary annotation, may be {@code null}
 * @param insertedAt   creation time, never updated
 */
public record Version(
    Long id,
    VersionEvent event,
    String itemType,
    Long itemId,
    Map<String, Object> itemChanges,
    Long originatorId,
    String origin,
    Map<String, Object> meta,
    Instant insertedAt) {

  public Version {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(itemType, "itemType");
    itemChanges = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(itemChanges, "itemChanges")));
    if (meta != null) {
      meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }
  }

  public boolean isPersisted() {
    return id != null;
  }

  public Version withId(long id, Instant insertedAt) {
    return new Version(id, event, itemType, itemId, itemChanges, originatorId, origin, meta, insertedAt);
  }

  /** Returns a copy describing {@code itemId} with new item changes. */
  public Version withItem(Long itemId, Map<String, Object> itemChanges) {
    return new Version(id, event, itemType, itemId, itemChanges, originatorId, origin, meta, insertedAt);
  }
}
