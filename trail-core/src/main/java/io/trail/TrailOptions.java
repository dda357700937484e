package io.trail;

import io.trail.model.Entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call options: who made the change, where it came from, how result steps are named
 * and which result to surface.
 *
 * <pre>{@code
 * TrailOptions options = TrailOptions.builder()
 *     .originator(user)
 *     .origin("admin")
 *     .meta(Map.of("linkname", "izelnakri"))
 *     .build();
 * }</pre>
 */
public final class TrailOptions {
  public static final String DEFAULT_MODEL_KEY = "model";
  public static final String DEFAULT_VERSION_KEY = "version";

  private static final TrailOptions DEFAULTS = builder().build();

  private final Long originatorId;
  private final String origin;
  private final Map<String, Object> meta;
  private final String modelKey;
  private final String versionKey;
  private final String returnOperation;
  private final boolean returning;

  private TrailOptions(Builder builder) {
    this.originatorId = builder.originatorId;
    this.origin = builder.origin;
    this.meta = builder.meta == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.meta));
    this.modelKey = builder.modelKey;
    this.versionKey = builder.versionKey;
    this.returnOperation = builder.returnOperation;
    this.returning = builder.returning;
    if (modelKey.equals(versionKey)) {
      throw new IllegalArgumentException("modelKey and versionKey must differ: " + modelKey);
    }
  }

  public static TrailOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .originatorId(originatorId)
        .origin(origin)
        .meta(meta)
        .modelKey(modelKey)
        .versionKey(versionKey)
        .returnOperation(returnOperation)
        .returning(returning);
  }

  public Long originatorId() {
    return originatorId;
  }

  public String origin() {
    return origin;
  }

  public Map<String, Object> meta() {
    return meta;
  }

  public String modelKey() {
    return modelKey;
  }

  public String versionKey() {
    return versionKey;
  }

  /** Name of the single step whose value a successful commit returns, or {@code null}. */
  public String returnOperation() {
    return returnOperation;
  }

  /** Whether bulk version steps return the inserted versions. */
  public boolean returning() {
    return returning;
  }

  /** {@code true} when bulk version steps should return rows: returning is on and the version step is the one returned. */
  public boolean returnsVersionRows() {
    return returning && versionKey.equals(returnOperation);
  }

  public static final class Builder {
    private Long originatorId;
    private String origin;
    private Map<String, Object> meta;
    private String modelKey = DEFAULT_MODEL_KEY;
    private String versionKey = DEFAULT_VERSION_KEY;
    private String returnOperation;
    private boolean returning;

    private Builder() {
    }

    public Builder originatorId(Long originatorId) {
      this.originatorId = originatorId;
      return this;
    }

    /** Records the persisted {@code originator} as the acting user. */
    public Builder originator(Entity originator) {
      Objects.requireNonNull(originator, "originator");
      if (originator.id() == null) {
        throw new IllegalArgumentException("originator must be persisted");
      }
      this.originatorId = originator.id();
      return this;
    }

    public Builder origin(String origin) {
      this.origin = origin;
      return this;
    }

    public Builder meta(Map<String, ?> meta) {
      this.meta = meta == null ? null : new LinkedHashMap<>(meta);
      return this;
    }

    public Builder modelKey(String modelKey) {
      this.modelKey = requireKey(modelKey, "modelKey");
      return this;
    }

    public Builder versionKey(String versionKey) {
      this.versionKey = requireKey(versionKey, "versionKey");
      return this;
    }

    public Builder returnOperation(String returnOperation) {
      this.returnOperation = returnOperation;
      return this;
    }

    public Builder returning(boolean returning) {
      this.returning = returning;
      return this;
    }

    public TrailOptions build() {
      return new TrailOptions(this);
    }

    private static String requireKey(String key, String name) {
      Objects.requireNonNull(key, name);
      if (key.isEmpty()) {
        throw new IllegalArgumentException(name + " must not be empty");
      }
      return key;
    }
  }
}
