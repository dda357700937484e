package io.trail.spi;

import io.trail.capture.VersionProjection;
import io.trail.model.BulkResult;
import io.trail.model.Filter;
import io.trail.model.Version;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for the version ledger. All methods operate on the caller-supplied
 * connection and never commit.
 */
public interface VersionStore {

  /**
   * Appends an unsaved version.
   *
   * @return the version with its generated id and insertion time
   * @throws TrailStoreException on storage failure
   */
  Version insert(Connection conn, Version version);

  /**
   * Rewrites {@code item_id} and {@code item_changes} of a persisted version. Used only to
   * finalize a strict-mode placeholder inside the transaction that created it.
   *
   * @throws StaleEntityException if the version does not exist
   */
  Version updateItem(Connection conn, Version version);

  /**
   * Appends one version per entity row matching {@code where}, projected from the current
   * row state before any bulk update runs.
   *
   * @param returning whether to return the inserted versions
   * @return the number of versions inserted, with the versions themselves if requested
   */
  BulkResult<Version> insertProjected(Connection conn, VersionProjection projection, Filter where, boolean returning);

  /** Versions of one entity, oldest first. */
  List<Version> findByItem(Connection conn, String itemType, long itemId);

  Optional<Version> findById(Connection conn, long id);

  long count(Connection conn);

  /**
   * Returns {@code max(id) + 1} for the ledger. Only a hint: concurrent writers may
   * observe the same value.
   */
  long nextIdHint(Connection conn);
}
