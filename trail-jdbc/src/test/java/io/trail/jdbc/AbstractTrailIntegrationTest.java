package io.trail.jdbc;

import io.trail.Trail;
import io.trail.TrailOptions;
import io.trail.TrailResult;
import io.trail.jdbc.dialect.Dialects;
import io.trail.jdbc.spi.Dialect;
import io.trail.jdbc.tx.JdbcTransactionRunner;
import io.trail.jdbc.tx.ThreadLocalTxContext;
import io.trail.model.BulkResult;
import io.trail.model.ChangeSet;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Filter;
import io.trail.model.Version;
import io.trail.model.VersionEvent;
import io.trail.multi.TrailMulti;
import io.trail.spi.TrailStoreException;
import io.trail.util.JsonCodec;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.trail.jdbc.TestSchemas.COMPANIES;
import static io.trail.jdbc.TestSchemas.PEOPLE;
import static io.trail.jdbc.TestSchemas.USERS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Default-mode scenarios against a real database. Subclasses provide a clean database
 * with the versions table and the fixture tables.
 */
abstract class AbstractTrailIntegrationTest {
  private final JsonCodec codec = JsonCodec.getDefault();

  private DataSource dataSource;
  private Dialect dialect;
  private DataSourceConnectionProvider connectionProvider;
  private ThreadLocalTxContext txContext;
  private Trail trail;

  /** Returns a data source over an empty database with every table created. */
  abstract DataSource prepareDatabase() throws Exception;

  @BeforeEach
  void setUpTrail() throws Exception {
    dataSource = prepareDatabase();
    dialect = Dialects.detect(dataSource);
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    txContext = new ThreadLocalTxContext();
    trail = trail(new JdbcVersionStore(dialect));
  }

  @Test
  void insertRecordsFullSnapshotWithOriginator() {
    Entity user = insertUser("izelnakri");
    TrailOptions options = TrailOptions.builder()
        .originator(user)
        .origin("admin")
        .meta(Map.of("linkname", "izelnakri"))
        .build();

    TrailResult.Success result = (TrailResult.Success) trail.insert(acme(), options);

    Entity company = result.results().entity("model");
    assertNotNull(company.id());
    assertNotNull(company.get("inserted_at"));
    Version stored = trail.queries().latest(company).orElseThrow();
    assertEquals(result.results().version("version").id(), stored.id());
    assertEquals(VersionEvent.INSERT, stored.event());
    assertEquals("SimpleCompany", stored.itemType());
    assertEquals(company.id(), stored.itemId());
    assertEquals(codec.normalize(company.attributes()), stored.itemChanges());
    assertEquals(user.id(), stored.originatorId());
    assertEquals("admin", stored.origin());
    assertEquals(Map.of("linkname", "izelnakri"), stored.meta());
    assertNotNull(stored.insertedAt());
  }

  @Test
  void updateRecordsOnlyChangedAttributes() {
    Entity company = insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.update(
        ChangeSet.forUpdate(company, Map.of("city", "Hong Kong", "name", "Acme LLC")));

    assertEquals("Hong Kong", result.results().entity("model").get("city"));
    List<Version> versions = trail.queries().versions(company);
    assertEquals(2, versions.size());
    assertEquals(VersionEvent.UPDATE, versions.get(0).event());
    assertEquals(Map.of("city", "Hong Kong"), versions.get(0).itemChanges());
    assertEquals(VersionEvent.INSERT, versions.get(1).event());
  }

  @Test
  void updateWithoutChangesWritesNothing() {
    Entity company = insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.update(
        ChangeSet.forUpdate(company, Map.of("name", "Acme LLC")));

    assertNull(result.results().get("version"));
    assertEquals(company, result.results().entity("model"));
    assertEquals(1, trail.queries().count());
  }

  @Test
  void sameValuesInAnotherRepresentationWriteNothing() {
    Entity company = insertAcme();
    Entity person = insertPerson(company, Map.of("hourly_rate", 10.5, "preferences", Map.of("n", 1)));
    assertEquals(new BigDecimal("10.50"), person.get("hourly_rate"));
    long versionsBefore = trail.queries().count();

    TrailResult.Success result = (TrailResult.Success) trail.update(ChangeSet.forUpdate(person,
        Map.of("hourly_rate", 10.5, "preferences", Map.of("n", 1))));

    assertNull(result.results().get("version"));
    assertEquals(versionsBefore, trail.queries().count());
    assertEquals(1, trail.queries().versions(person).size());
  }

  @Test
  void invalidChangeSetWritesNothing() {
    TrailResult result = trail.insert(
        ChangeSet.forInsert(COMPANIES, Map.of("city", "Greenwich")).validateRequired("name"));

    TrailResult.Failure failure = assertInstanceOf(TrailResult.Failure.class, result);
    assertEquals("model", failure.step());
    assertEquals(0, count(COMPANIES.table()));
    assertEquals(0, trail.queries().count());
  }

  @Test
  void deleteRecordsSnapshotBeforeRemoval() {
    Entity company = insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.delete(company);

    Version version = result.results().version("version");
    assertEquals(VersionEvent.DELETE, version.event());
    assertEquals(codec.normalize(company.attributes()), version.itemChanges());
    assertEquals(0, count(COMPANIES.table()));
    assertEquals(2, trail.queries().versions(COMPANIES, company.id()).size());
  }

  @Test
  void deleteFailureRollsBackAndKeepsEntity() {
    Entity company = insertAcme();
    insertPerson(company);
    long versionsBefore = trail.queries().count();

    TrailResult result = trail.delete(company);

    TrailResult.Failure failure = assertInstanceOf(TrailResult.Failure.class, result);
    assertEquals("model", failure.step());
    assertInstanceOf(TrailStoreException.class, failure.error());
    assertEquals(1, count(COMPANIES.table()));
    assertEquals(versionsBefore, trail.queries().count());
  }

  @Test
  void versionFailureRollsBackEntityWrite() throws SQLException {
    Trail broken = trail(new JdbcVersionStore(dialect, "missing_versions"));

    TrailResult result = broken.insert(acme());

    TrailResult.Failure failure = assertInstanceOf(TrailResult.Failure.class, result);
    assertEquals("version", failure.step());
    assertTrue(failure.completed().contains("model"));
    assertEquals(0, count(COMPANIES.table()));
  }

  @Test
  void softDeleteKeepsRowAndRecordsSnapshot() {
    Entity company = insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.softDelete(company);

    assertNotNull(result.results().entity("model").get("deleted_at"));
    Version version = result.results().version("version");
    assertEquals(VersionEvent.SOFT_DELETE, version.event());
    assertNull(version.itemChanges().get("deleted_at"));
    assertEquals(1, count(COMPANIES.table()));
  }

  @Test
  void updateAllProjectsVersionsThenUpdates() {
    Entity izel = insertUser("izelnakri");
    Entity jane = insertUser("jane");

    TrailResult.Success result = (TrailResult.Success) trail.updateAll(
        USERS, Filter.all(), Map.of("username", "isaac"), TrailOptions.defaults());

    assertEquals(List.of("version", "model"), List.copyOf(result.results().keys()));
    assertEquals(2, result.results().bulk("version").count());
    assertEquals(2, result.results().bulk("model").count());
    for (Entity user : List.of(izel, jane)) {
      Version latest = trail.queries().latest(user).orElseThrow();
      assertEquals(VersionEvent.UPDATE, latest.event());
      assertEquals(Map.of("username", "isaac"), latest.itemChanges());
    }
    assertEquals(2, countWhere(USERS.table(), "username = 'isaac'"));
  }

  @Test
  void updateAllReturnsProjectedVersions() {
    Entity izel = insertUser("izelnakri");
    insertUser("jane");
    TrailOptions options = TrailOptions.builder().returning(true).returnOperation("version").build();

    TrailResult.Success result = (TrailResult.Success) trail.updateAll(
        USERS, Filter.eq("username", "izelnakri"), Map.of("username", "isaac"), options);

    BulkResult<?> returned = result.value(BulkResult.class);
    assertEquals(1, returned.count());
    Version version = (Version) returned.rows().get(0);
    assertNotNull(version.id());
    assertEquals(izel.id(), version.itemId());
    assertEquals(Map.of("username", "isaac"), version.itemChanges());
    assertEquals(1, countWhere(USERS.table(), "username = 'jane'"));
  }

  @Test
  void softDeleteAllRecordsDeletedAt() {
    insertAcme();
    insertAcme();

    TrailResult.Success result = (TrailResult.Success) trail.softDeleteAll(
        COMPANIES, Filter.isNull("deleted_at"), TrailOptions.defaults());

    assertEquals(2, result.results().bulk("model").count());
    assertEquals(0, countWhere(COMPANIES.table(), "deleted_at IS NULL"));
    assertEquals(2, countWhere("versions", "event = 'soft_delete'"));
  }

  @Test
  void insertAllRecordsOneVersionPerRow() {
    TrailResult.Success result = (TrailResult.Success) trail.insertAll(USERS, List.of(
        Map.of("token", "a", "username", "isaac"),
        Map.of("token", "b", "username", "izel")), TrailOptions.defaults());

    BulkResult<Entity> inserted = result.results().bulk("model");
    assertEquals(2, inserted.rows().size());
    for (Entity row : inserted.rows()) {
      Version version = result.results().version("version:" + row.id());
      assertEquals(row.id(), version.itemId());
      assertEquals(codec.normalize(row.attributes()), version.itemChanges());
    }
    assertEquals(2, trail.queries().count());
  }

  @Test
  void typedColumnsRoundTrip() {
    Entity company = insertAcme();

    Entity person = insertPerson(company);

    assertEquals(LocalDate.of(1992, 4, 1), person.get("birthdate"));
    assertEquals(Map.of("theme", "dark", "emails", true), person.get("preferences"));
    assertEquals(3, person.get("visit_count"));
    Version version = trail.queries().latest(person).orElseThrow();
    assertEquals("1992-04-01", version.itemChanges().get("birthdate"));
    assertEquals(company.id(), version.itemChanges().get("company_id"));
  }

  @Test
  void composedPlanRollsBackEveryOperation() {
    Entity company = insertAcme();
    TrailMulti plan = trail.multi()
        .update(ChangeSet.forUpdate(company, Map.of("city", "Hong Kong")), TrailOptions.defaults())
        .insert(ChangeSet.forInsert(USERS, Map.of("token", "t", "username", "isaac")),
            TrailOptions.builder().modelKey("user").versionKey("user_version").build())
        .error("approval", "rejected");

    TrailResult.Failure failure = (TrailResult.Failure) trail.commit(plan, TrailOptions.defaults());

    assertEquals("approval", failure.step());
    assertEquals(List.of("model", "version", "user", "user_version"), List.copyOf(failure.completed().keys()));
    assertEquals(0, count(USERS.table()));
    assertEquals(0, countWhere(COMPANIES.table(), "city = 'Hong Kong'"));
    assertEquals(1, trail.queries().count());
  }

  private Trail trail(JdbcVersionStore versionStore) {
    return Trail.builder()
        .entityStore(new JdbcEntityStore(dialect))
        .versionStore(versionStore)
        .transactionRunner(new JdbcTransactionRunner(connectionProvider, txContext))
        .build();
  }

  private ChangeSet acme() {
    return ChangeSet.forInsert(COMPANIES, Map.of("name", "Acme LLC", "is_active", true, "city", "Greenwich"));
  }

  private Entity insertAcme() {
    return ((TrailResult.Success) trail.insert(acme())).results().entity("model");
  }

  private Entity insertUser(String username) {
    ChangeSet changeSet = ChangeSet.forInsert(USERS, Map.of("token", "fake-token", "username", username));
    return ((TrailResult.Success) trail.insert(changeSet)).results().entity("model");
  }

  private Entity insertPerson(Entity company) {
    return insertPerson(company, Map.of(
        "visit_count", 3,
        "gender", true,
        "birthdate", LocalDate.of(1992, 4, 1),
        "preferences", Map.of("theme", "dark", "emails", true)));
  }

  private Entity insertPerson(Entity company, Map<String, ?> attributes) {
    Map<String, Object> params = new HashMap<>(attributes);
    params.put("first_name", "Izel");
    params.put("last_name", "Nakri");
    params.put("company_id", company.id());
    ChangeSet changeSet = ChangeSet.forInsert(PEOPLE, params);
    return ((TrailResult.Success) trail.insert(changeSet)).results().entity("model");
  }

  private long count(String table) {
    return countWhere(table, "1=1");
  }

  private long countWhere(String table, String condition) {
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + table + " WHERE " + condition);
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }
}
