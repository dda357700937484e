package io.trail.spi;

/**
 * Thrown when a single-row write matched no row, because the row was deleted or never
 * existed.
 */
public final class StaleEntityException extends TrailStoreException {
  private final String itemType;
  private final Long id;

  public StaleEntityException(String itemType, Long id) {
    super("Attempted to write stale " + itemType + " with id " + id);
    this.itemType = itemType;
    this.id = id;
  }

  public String itemType() {
    return itemType;
  }

  public Long id() {
    return id;
  }
}
