package io.trail;

import io.trail.capture.ChangeCapture;
import io.trail.model.BulkResult;
import io.trail.model.ChangeSet;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Filter;
import io.trail.model.Version;
import io.trail.multi.Multi;
import io.trail.multi.MultiExecutor;
import io.trail.multi.SequenceLinker;
import io.trail.multi.TrailMulti;
import io.trail.query.VersionQueries;
import io.trail.spi.EntityStore;
import io.trail.spi.MetricsExporter;
import io.trail.spi.TransactionRunner;
import io.trail.spi.VersionStore;
import io.trail.util.JsonCodec;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for versioned writes. Every operation runs its entity step and version step
 * in one transaction: both commit or neither does.
 *
 * <pre>{@code
 * Trail trail = Trail.builder()
 *     .entityStore(new JdbcEntityStore(dialect))
 *     .versionStore(new JdbcVersionStore(dialect))
 *     .transactionRunner(new JdbcTransactionRunner(connectionProvider, txContext))
 *     .build();
 *
 * TrailResult result = trail.insert(
 *     ChangeSet.forInsert(companies, Map.of("name", "Acme LLC", "city", "Greenwich")),
 *     TrailOptions.builder().originator(user).build());
 * }</pre>
 *
 * <p>Invalid change sets fail before a transaction is opened. Storage errors fail the
 * step that raised them and roll the transaction back.
 */
public final class Trail {
  private static final Logger logger = Logger.getLogger(Trail.class.getName());

  private final EntityStore entityStore;
  private final VersionStore versionStore;
  private final TransactionRunner transactionRunner;
  private final TrailMode mode;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ChangeCapture capture;
  private final MultiExecutor executor = new MultiExecutor();

  private Trail(Builder builder) {
    this.entityStore = Objects.requireNonNull(builder.entityStore, "entityStore");
    this.versionStore = Objects.requireNonNull(builder.versionStore, "versionStore");
    this.transactionRunner = Objects.requireNonNull(builder.transactionRunner, "transactionRunner");
    this.mode = builder.mode;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.capture = new ChangeCapture(builder.jsonCodec);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts an empty plan in this trail's mode. */
  public TrailMulti multi() {
    return new TrailMulti(mode, capture, entityStore, versionStore, clock);
  }

  public TrailResult insert(ChangeSet changeSet) {
    return insert(changeSet, TrailOptions.defaults());
  }

  public TrailResult insert(ChangeSet changeSet, TrailOptions options) {
    return commit(multi().insert(changeSet, options), options);
  }

  public TrailResult update(ChangeSet changeSet) {
    return update(changeSet, TrailOptions.defaults());
  }

  public TrailResult update(ChangeSet changeSet, TrailOptions options) {
    return commit(multi().update(changeSet, options), options);
  }

  public TrailResult delete(Entity entity) {
    return delete(entity, TrailOptions.defaults());
  }

  public TrailResult delete(Entity entity, TrailOptions options) {
    return commit(multi().delete(entity, options), options);
  }

  public TrailResult delete(ChangeSet changeSet, TrailOptions options) {
    return commit(multi().delete(changeSet, options), options);
  }

  public TrailResult softDelete(Entity entity) {
    return softDelete(entity, TrailOptions.defaults());
  }

  public TrailResult softDelete(Entity entity, TrailOptions options) {
    return commit(multi().softDelete(entity, options), options);
  }

  public TrailResult insertAll(EntitySchema schema, List<? extends Map<String, ?>> rows, TrailOptions options) {
    return commit(multi().insertAll(schema, rows, options), options);
  }

  public TrailResult updateAll(EntitySchema schema, Filter where, Map<String, ?> set, TrailOptions options) {
    return commit(multi().updateAll(schema, where, set, options), options);
  }

  public TrailResult softDeleteAll(EntitySchema schema, Filter where, TrailOptions options) {
    return commit(multi().softDeleteAll(schema, where, options), options);
  }

  public TrailResult commit(TrailMulti multi, TrailOptions options) {
    return commit(multi.toMulti(), options);
  }

  /**
   * Runs every step of {@code multi} in one transaction.
   *
   * <p>{@code options} decide the shape of the result: {@link TrailOptions#returnOperation()}
   * selects a single step's value, and in strict mode {@link TrailOptions#modelKey()}
   * names the step whose failed change set is stripped of the link columns.
   *
   * @return the success, or the failure of the first step that failed
   * @throws IllegalArgumentException if {@code returnOperation} names no step of the plan
   * @throws io.trail.spi.TrailStoreException if the transaction itself cannot be opened or committed
   */
  public TrailResult commit(Multi multi, TrailOptions options) {
    Objects.requireNonNull(multi, "multi");
    Objects.requireNonNull(options, "options");
    requireReturnableStep(multi, options.returnOperation());

    Optional<TrailResult.Failure> invalid = executor.preflight(multi);
    if (invalid.isPresent()) {
      logger.log(Level.FINE, "Step {0} has an invalid change set, nothing written", invalid.get().step());
      return shape(invalid.get(), options);
    }

    long start = System.nanoTime();
    TrailResult result;
    try {
      result = transactionRunner.execute(scope -> {
        TrailResult executed = executor.execute(multi, scope.connection());
        if (executed instanceof TrailResult.Failure) {
          scope.setRollbackOnly();
        }
        return executed;
      });
    } catch (RuntimeException e) {
      metrics.incrementRolledBack();
      logger.log(Level.WARNING, "Plan " + multi.names() + " rolled back", e);
      throw e;
    }
    metrics.recordCommitDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));

    TrailResult shaped = shape(result, options);
    if (shaped instanceof TrailResult.Failure failure) {
      metrics.incrementRolledBack();
      logger.log(Level.WARNING, "Rolled back, step {0} failed: {1}", new Object[] {failure.step(), failure.error()});
    } else if (shaped instanceof TrailResult.Success success) {
      int written = versionsWritten(success.results(), options.versionKey());
      metrics.incrementCommitted();
      metrics.incrementVersionsWritten(written);
      if (success.results().contains(options.versionKey()) && success.results().get(options.versionKey()) == null) {
        metrics.incrementNoopUpdates();
      }
      logger.log(Level.FINE, "Committed {0} step(s), {1} version(s) written",
          new Object[] {success.results().size(), written});
    }
    return shaped;
  }

  /** Read access to the ledger. */
  public VersionQueries queries() {
    return new VersionQueries(versionStore, transactionRunner);
  }

  public TrailMode mode() {
    return mode;
  }

  private TrailResult shape(TrailResult result, TrailOptions options) {
    List<String> internal = List.of(SequenceLinker.INITIAL_VERSION);
    if (result instanceof TrailResult.Failure failure) {
      Object error = failure.error();
      if (mode == TrailMode.STRICT && failure.step().equals(options.modelKey()) && error instanceof ChangeSet changeSet) {
        error = changeSet.without(SequenceLinker.LINK_COLUMNS);
      }
      return new TrailResult.Failure(failure.step(), error, failure.completed().without(internal));
    }
    StepResults results = ((TrailResult.Success) result).results().without(internal);
    String returnOperation = options.returnOperation();
    if (returnOperation == null) {
      return new TrailResult.Success(results, results);
    }
    if (!results.contains(returnOperation)) {
      logger.log(Level.WARNING, "Return operation {0} is not among the steps {1}",
          new Object[] {returnOperation, results.keys()});
    }
    return new TrailResult.Success(results, results.asMap().get(returnOperation));
  }

  // Steps added by merge are only named at execution time, shape() covers those.
  private static void requireReturnableStep(Multi multi, String returnOperation) {
    if (returnOperation == null) {
      return;
    }
    if (returnOperation.equals(SequenceLinker.INITIAL_VERSION)) {
      throw new IllegalArgumentException(returnOperation + " is internal and cannot be returned");
    }
    boolean dynamic = multi.operations().stream().anyMatch(op -> op instanceof Multi.Merge);
    if (!dynamic && !multi.names().contains(returnOperation)) {
      throw new IllegalArgumentException(
          "Return operation " + returnOperation + " is not a step of the plan " + multi.names());
    }
  }

  private static int versionsWritten(StepResults results, String versionKey) {
    int written = 0;
    for (Map.Entry<String, Object> entry : results.asMap().entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Version) {
        written++;
      } else if (value instanceof BulkResult<?> bulk && entry.getKey().equals(versionKey)) {
        written += bulk.count();
      }
    }
    return written;
  }

  public static final class Builder {
    private EntityStore entityStore;
    private VersionStore versionStore;
    private TransactionRunner transactionRunner;
    private TrailMode mode = TrailMode.DEFAULT;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private JsonCodec jsonCodec = JsonCodec.getDefault();
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    public Builder entityStore(EntityStore entityStore) {
      this.entityStore = entityStore;
      return this;
    }

    public Builder versionStore(VersionStore versionStore) {
      this.versionStore = versionStore;
      return this;
    }

    public Builder transactionRunner(TransactionRunner transactionRunner) {
      this.transactionRunner = transactionRunner;
      return this;
    }

    public Builder mode(TrailMode mode) {
      this.mode = Objects.requireNonNull(mode, "mode");
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
      return this;
    }

    /** Clock used for {@code deleted_at} values. */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Trail build() {
      return new Trail(this);
    }
  }
}
