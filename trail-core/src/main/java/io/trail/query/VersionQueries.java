package io.trail.query;

import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Version;
import io.trail.spi.TransactionRunner;
import io.trail.spi.VersionStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read access to the version ledger. Each call runs in its own transaction, or joins the
 * one already active on the current thread.
 */
public final class VersionQueries {
  private final VersionStore versionStore;
  private final TransactionRunner transactionRunner;

  public VersionQueries(VersionStore versionStore, TransactionRunner transactionRunner) {
    this.versionStore = Objects.requireNonNull(versionStore, "versionStore");
    this.transactionRunner = Objects.requireNonNull(transactionRunner, "transactionRunner");
  }

  /** Versions of an entity, newest first. */
  public List<Version> versions(EntitySchema schema, long itemId) {
    List<Version> versions = new ArrayList<>(chain(schema, itemId));
    Collections.reverse(versions);
    return versions;
  }

  public List<Version> versions(Entity entity) {
    return versions(entity.schema(), requireId(entity));
  }

  /** Most recent version of an entity. */
  public Optional<Version> latest(EntitySchema schema, long itemId) {
    List<Version> chain = chain(schema, itemId);
    return chain.isEmpty() ? Optional.empty() : Optional.of(chain.get(chain.size() - 1));
  }

  public Optional<Version> latest(Entity entity) {
    return latest(entity.schema(), requireId(entity));
  }

  public Optional<Version> version(long id) {
    return transactionRunner.execute(scope -> versionStore.findById(scope.connection(), id));
  }

  /** Number of versions in the ledger. */
  public long count() {
    return transactionRunner.execute(scope -> versionStore.count(scope.connection()));
  }

  /** Versions of an entity, oldest first. */
  public List<Version> chain(EntitySchema schema, long itemId) {
    Objects.requireNonNull(schema, "schema");
    return transactionRunner.execute(scope ->
        versionStore.findByItem(scope.connection(), schema.itemType(), itemId));
  }

  public List<Version> chain(Entity entity) {
    return chain(entity.schema(), requireId(entity));
  }

  /**
   * Checks that the chain starts at {@code first_version_id}, ends at
   * {@code current_version_id}, and that the first version links to itself.
   *
   * @throws IllegalArgumentException if the entity's schema has no link columns
   */
  public ChainVerification verifyChain(Entity entity) {
    if (!entity.schema().hasVersionLinks()) {
      throw new IllegalArgumentException(entity.schema().itemType() + " has no version links");
    }
    List<Version> chain = chain(entity);
    List<String> problems = new ArrayList<>();
    Object firstVersionId = entity.get(EntitySchema.FIRST_VERSION_ID);
    Object currentVersionId = entity.get(EntitySchema.CURRENT_VERSION_ID);
    if (chain.isEmpty()) {
      problems.add("no versions recorded");
      return new ChainVerification(chain, problems);
    }
    Version first = chain.get(0);
    Version last = chain.get(chain.size() - 1);
    if (!Objects.equals(first.id(), firstVersionId)) {
      problems.add("first_version_id " + firstVersionId + " is not the first version " + first.id());
    }
    if (!Objects.equals(last.id(), currentVersionId)) {
      problems.add("current_version_id " + currentVersionId + " is not the latest version " + last.id());
    }
    Object selfLink = first.itemChanges().get(EntitySchema.CURRENT_VERSION_ID);
    if (!Objects.equals(first.id(), selfLink)) {
      problems.add("first version " + first.id() + " links to " + selfLink);
    }
    return new ChainVerification(chain, problems);
  }

  private static long requireId(Entity entity) {
    Objects.requireNonNull(entity, "entity");
    if (entity.id() == null) {
      throw new IllegalArgumentException("Entity was never persisted");
    }
    return entity.id();
  }
}
