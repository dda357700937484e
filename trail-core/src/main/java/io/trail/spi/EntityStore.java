package io.trail.spi;

import io.trail.model.BulkResult;
import io.trail.model.ChangeSet;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Filter;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence boundary for tracked entities. All methods operate on the caller-supplied
 * connection and never commit.
 *
 * @see VersionStore
 */
public interface EntityStore {

  /**
   * Inserts the applied change set and returns the persisted row, generated key included.
   *
   * @throws TrailStoreException on storage failure
   */
  Entity insert(Connection conn, ChangeSet changeSet);

  /**
   * Writes the changed attributes and returns the persisted row. Writes nothing and
   * returns the base entity when the change set has no changes.
   *
   * @throws StaleEntityException if the row no longer exists
   */
  Entity update(Connection conn, ChangeSet changeSet);

  /**
   * Deletes the row.
   *
   * @return the entity as it was before removal
   * @throws StaleEntityException if the row no longer exists
   */
  Entity delete(Connection conn, Entity entity);

  /**
   * Sets {@code deleted_at} on the row.
   *
   * @return the persisted row after the update
   * @throws StaleEntityException if the row no longer exists
   */
  Entity softDelete(Connection conn, Entity entity, Instant deletedAt);

  /**
   * Inserts all rows in one batch and returns the persisted rows that could be re-read
   * by their generated key.
   */
  BulkResult<Entity> insertAll(Connection conn, EntitySchema schema, List<Map<String, Object>> rows);

  /**
   * Applies {@code set} to every row matching {@code where}.
   *
   * @return the number of rows updated
   */
  int updateAll(Connection conn, EntitySchema schema, Filter where, Map<String, Object> set);

  Optional<Entity> findById(Connection conn, EntitySchema schema, long id);

  long count(Connection conn, EntitySchema schema);

  /**
   * Returns {@code max(id) + 1} for the entity table. Only a hint: concurrent writers may
   * observe the same value.
   */
  long nextIdHint(Connection conn, EntitySchema schema);
}
