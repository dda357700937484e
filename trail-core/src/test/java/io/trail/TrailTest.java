package io.trail;

import io.trail.model.BulkResult;
import io.trail.model.ChangeSet;
import io.trail.model.Entity;
import io.trail.model.Filter;
import io.trail.model.Version;
import io.trail.model.VersionEvent;
import io.trail.multi.TrailMulti;
import io.trail.util.JsonCodec;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.trail.Schemas.COMPANIES;
import static io.trail.Schemas.USERS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrailTest {
  private final JsonCodec codec = JsonCodec.getDefault();

  private InMemoryEntityStore entities;
  private InMemoryVersionStore versions;
  private SnapshotTransactionRunner runner;
  private RecordingMetrics metrics;
  private Trail trail;

  @BeforeEach
  void setUp() {
    entities = new InMemoryEntityStore();
    versions = new InMemoryVersionStore(entities);
    runner = new SnapshotTransactionRunner(entities, versions);
    metrics = new RecordingMetrics();
    trail = Trail.builder()
        .entityStore(entities)
        .versionStore(versions)
        .transactionRunner(runner)
        .metrics(metrics)
        .build();
  }

  @Test
  void insertRecordsFullSnapshot() {
    Entity user = insertUser("izelnakri");
    TrailOptions options = TrailOptions.builder()
        .originator(user)
        .origin("admin")
        .meta(Map.of("linkname", "izelnakri"))
        .build();

    TrailResult.Success result = (TrailResult.Success) trail.insert(acme(), options);

    Entity company = result.results().entity("model");
    Version version = result.results().version("version");
    assertEquals("Acme LLC", company.get("name"));
    assertEquals(1, entities.count(null, COMPANIES));
    assertEquals(VersionEvent.INSERT, version.event());
    assertEquals("SimpleCompany", version.itemType());
    assertEquals(company.id(), version.itemId());
    assertEquals(codec.normalize(company.attributes()), version.itemChanges());
    assertEquals(user.id(), version.originatorId());
    assertEquals("admin", version.origin());
    assertEquals(Map.of("linkname", "izelnakri"), version.meta());
    assertEquals(List.of("model", "version"), List.copyOf(result.results().keys()));
  }

  @Test
  void updateRecordsExactlyTheChangedAttributes() {
    Entity company = insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.update(
        ChangeSet.forUpdate(company, Map.of("city", "Hong Kong", "name", "Acme LLC")));

    Version version = result.results().version("version");
    assertEquals(VersionEvent.UPDATE, version.event());
    assertEquals(Map.of("city", "Hong Kong"), version.itemChanges());
    assertEquals("Hong Kong", result.results().entity("model").get("city"));
    assertEquals(2, versions.count(null));
  }

  @Test
  void updateWithoutChangesWritesNothing() {
    Entity company = insertAcme();
    int writes = entities.writes;

    TrailResult.Success result = (TrailResult.Success) trail.update(ChangeSet.forUpdate(company, Map.of()));

    assertTrue(result.results().contains("version"));
    assertNull(result.results().get("version"));
    assertEquals(company, result.results().entity("model"));
    assertEquals(1, versions.count(null));
    assertEquals(writes, entities.writes);
    assertEquals(1, metrics.noopUpdates);
  }

  @Test
  void invalidChangeSetFailsWithoutOpeningTransaction() {
    ChangeSet invalid = ChangeSet.forInsert(COMPANIES, Map.of("city", "Greenwich")).validateRequired("name");

    TrailResult result = trail.insert(invalid);

    TrailResult.Failure failure = assertInstanceOf(TrailResult.Failure.class, result);
    assertEquals("model", failure.step());
    assertSame(invalid, failure.error());
    assertTrue(failure.completed().isEmpty());
    assertEquals(0, runner.transactions);
    assertEquals(0, versions.count(null));
  }

  @Test
  void versionStepFailureRollsBackEntity() {
    versions.failInserts = true;

    TrailResult result = trail.insert(acme());

    TrailResult.Failure failure = assertInstanceOf(TrailResult.Failure.class, result);
    assertEquals("version", failure.step());
    assertTrue(failure.completed().contains("model"));
    assertEquals(0, entities.count(null, COMPANIES));
    assertEquals(1, runner.rollbacks);
    assertEquals(1, metrics.rolledBack);
    assertEquals(0, metrics.committed);
  }

  @Test
  void entityStepFailureSkipsVersionStep() {
    entities.failInserts = true;

    TrailResult.Failure failure = (TrailResult.Failure) trail.insert(acme());

    assertEquals("model", failure.step());
    assertFalse(failure.completed().contains("version"));
    assertEquals(0, versions.count(null));
  }

  @Test
  void deleteRecordsSnapshotBeforeRemoval() {
    Entity company = insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.delete(company);

    Version version = result.results().version("version");
    assertEquals(VersionEvent.DELETE, version.event());
    assertEquals(codec.normalize(company.attributes()), version.itemChanges());
    assertEquals(0, entities.count(null, COMPANIES));
  }

  @Test
  void softDeleteMarksEntityAndRecordsSnapshot() {
    Entity company = insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.softDelete(company);

    assertEquals(VersionEvent.SOFT_DELETE, result.results().version("version").event());
    assertNull(result.results().version("version").itemChanges().get("deleted_at"));
    assertTrue(result.results().entity("model").get("deleted_at") != null);
    assertEquals(1, entities.count(null, COMPANIES));
  }

  @Test
  void softDeleteRequiresDeletedAtColumn() {
    Entity user = insertUser("isaac");

    assertThrows(IllegalStateException.class, () -> trail.softDelete(user));
  }

  @Test
  void returnOperationSelectsSingleStep() {
    TrailOptions options = TrailOptions.builder().returnOperation("version").build();

    TrailResult.Success result = (TrailResult.Success) trail.insert(acme(), options);

    Version version = result.value(Version.class);
    assertEquals(VersionEvent.INSERT, version.event());
    assertSame(version, result.orElseThrow());
  }

  @Test
  void unknownReturnOperationRejectedBeforeWriting() {
    TrailOptions options = TrailOptions.builder().returnOperation("verison").build();

    assertThrows(IllegalArgumentException.class, () -> trail.insert(acme(), options));
    assertEquals(0, entities.count(null, COMPANIES));
    assertEquals(0, versions.count(null));
  }

  @Test
  void internalStepCannotBeReturned() {
    TrailOptions options = TrailOptions.builder().returnOperation("initial_version").build();

    assertThrows(IllegalArgumentException.class, () -> trail.insert(acme(), options));
  }

  @Test
  void returnOperationOfNoopUpdateIsNull() {
    Entity company = insertAcme();
    TrailOptions options = TrailOptions.builder().returnOperation("version").build();

    TrailResult.Success result = (TrailResult.Success) trail.update(
        ChangeSet.forUpdate(company, Map.of("name", "Acme LLC")), options);

    assertNull(result.value());
  }

  @Test
  void returnOperationMissingFromMergedStepsIsNull() {
    TrailOptions options = TrailOptions.builder().returnOperation("version").build();

    TrailResult.Success result = (TrailResult.Success) trail.insertAll(USERS, List.of(
        Map.of("token", "a", "username", "isaac")), options);

    assertNull(result.value());
    assertEquals(1, versions.count(null));
  }

  @Test
  void withoutReturnOperationValueIsAllResults() {
    TrailResult.Success result = (TrailResult.Success) trail.insert(acme());

    assertSame(result.results(), result.value());
  }

  @Test
  void customStepKeys() {
    TrailOptions options = TrailOptions.builder().modelKey("company").versionKey("company_version").build();

    TrailResult.Success result = (TrailResult.Success) trail.insert(acme(), options);

    assertEquals(List.of("company", "company_version"), List.copyOf(result.results().keys()));
    assertEquals("Acme LLC", result.results().entity("company").get("name"));
  }

  @Test
  void composedPlanCommitsAllOperations() {
    Entity company = insertAcme();
    TrailMulti plan = trail.multi()
        .update(ChangeSet.forUpdate(company, Map.of("city", "Hong Kong")), TrailOptions.defaults())
        .insert(ChangeSet.forInsert(USERS, Map.of("token", "t1", "username", "isaac")),
            TrailOptions.builder().modelKey("user").versionKey("user_version").build());

    TrailResult.Success result = (TrailResult.Success) trail.commit(plan, TrailOptions.defaults());

    assertEquals(List.of("model", "version", "user", "user_version"), List.copyOf(result.results().keys()));
    assertEquals(3, versions.count(null));
  }

  @Test
  void composedPlanRollsBackEarlierOperations() {
    TrailMulti plan = trail.multi()
        .insert(acme(), TrailOptions.defaults())
        .error("check", "nope");

    TrailResult.Failure failure = (TrailResult.Failure) trail.commit(plan, TrailOptions.defaults());

    assertEquals("check", failure.step());
    assertEquals("nope", failure.error());
    assertEquals(List.of("model", "version"), List.copyOf(failure.completed().keys()));
    assertEquals(0, entities.count(null, COMPANIES));
    assertEquals(0, versions.count(null));
  }

  @Test
  void updateAllProjectsVersionsBeforeUpdating() {
    insertUser("izelnakri");
    insertUser("jane");

    TrailResult.Success result = (TrailResult.Success) trail.updateAll(
        USERS, Filter.all(), Map.of("username", "isaac"), TrailOptions.defaults());

    assertEquals(List.of("version", "model"), List.copyOf(result.results().keys()));
    BulkResult<Version> projected = result.results().bulk("version");
    assertEquals(2, projected.count());
    assertEquals(2, result.results().<Entity>bulk("model").count());
    assertTrue(entities.rows(USERS).stream().allMatch(u -> "isaac".equals(u.get("username"))));
    for (Version version : versions.versions.values()) {
      if (version.event() == VersionEvent.UPDATE) {
        assertEquals(Map.of("username", "isaac"), version.itemChanges());
      }
    }
    assertEquals(4, metrics.versionsWritten);
  }

  @Test
  void updateAllReturnsVersionsWhenRequested() {
    insertUser("izelnakri");
    TrailOptions options = TrailOptions.builder().returning(true).returnOperation("version").build();

    TrailResult.Success result = (TrailResult.Success) trail.updateAll(
        USERS, Filter.eq("username", "izelnakri"), Map.of("username", "isaac"), options);

    BulkResult<?> returned = result.value(BulkResult.class);
    assertEquals(1, returned.rows().size());
    assertInstanceOf(Version.class, returned.rows().get(0));
  }

  @Test
  void insertAllRecordsOneVersionPerRow() {
    TrailResult.Success result = (TrailResult.Success) trail.insertAll(USERS, List.of(
        Map.of("token", "a", "username", "isaac"),
        Map.of("token", "b", "username", "izel")), TrailOptions.defaults());

    BulkResult<Entity> inserted = result.results().bulk("model");
    assertEquals(2, inserted.count());
    for (Entity row : inserted.rows()) {
      Version version = result.results().version("version:" + row.id());
      assertEquals(row.id(), version.itemId());
      assertEquals(codec.normalize(row.attributes()), version.itemChanges());
    }
    assertEquals(2, result.results().versions("version").size());
  }

  @Test
  void softDeleteAllRecordsDeletedAt() {
    insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.softDeleteAll(
        COMPANIES, Filter.isNull("deleted_at"), TrailOptions.defaults());

    Version version = versions.versions.lastEntry().getValue();
    assertEquals(VersionEvent.SOFT_DELETE, version.event());
    assertTrue(version.itemChanges().containsKey("deleted_at"));
    assertEquals(1, result.results().<Entity>bulk("model").count());
  }

  @Test
  void runnerExceptionIsCountedAndRethrown() {
    TrailMulti plan = trail.multi().run("boom", (conn, results) -> {
      throw new IllegalStateException("boom");
    });

    assertThrows(IllegalStateException.class, () -> trail.commit(plan, TrailOptions.defaults()));
    assertEquals(1, metrics.rolledBack);
  }

  @Test
  void orElseThrowRaisesStepException() {
    versions.failInserts = true;

    TrailResult result = trail.insert(acme());

    TrailStepException e = assertThrows(TrailStepException.class, result::orElseThrow);
    assertEquals("version", e.step());
  }

  private ChangeSet acme() {
    return ChangeSet.forInsert(COMPANIES, Map.of("name", "Acme LLC", "is_active", true, "city", "Greenwich"));
  }

  private Entity insertAcme() {
    return ((TrailResult.Success) trail.insert(acme())).results().entity("model");
  }

  private Entity insertUser(String username) {
    ChangeSet cs = ChangeSet.forInsert(USERS, Map.of("token", "fake-token", "username", username));
    return ((TrailResult.Success) trail.insert(cs)).results().entity("model");
  }
}
