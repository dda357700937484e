package io.trail.capture;

import io.trail.TrailOptions;
import io.trail.model.ChangeSet;
import io.trail.model.ColumnType;
import io.trail.model.Entity;
import io.trail.model.EntitySchema;
import io.trail.model.Version;
import io.trail.model.VersionEvent;
import io.trail.util.JsonCodec;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChangeCaptureTest {
  private static final EntitySchema COMPANIES = EntitySchema.builder("SimpleCompany", "simple_companies")
      .column("name", ColumnType.STRING)
      .column("city", ColumnType.STRING)
      .column("employees", ColumnType.INTEGER)
      .column("location", ColumnType.JSON)
      .timestamps()
      .build();

  private static final Instant NOW = Instant.parse("2024-03-01T10:15:30.123Z");

  private final ChangeCapture capture = new ChangeCapture(JsonCodec.getDefault());

  private final TrailOptions options = TrailOptions.builder()
      .originatorId(7L)
      .origin("scraper")
      .meta(Map.of("linkname", "izelnakri"))
      .build();

  @Test
  void insertSnapshotsEveryAttribute() {
    Entity company = acme();

    Version version = capture.capture(VersionEvent.INSERT, company, options);

    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("id", 1L);
    expected.put("name", "Acme LLC");
    expected.put("city", "Greenwich");
    expected.put("employees", 12L);
    expected.put("location", Map.of("country", "US"));
    expected.put("inserted_at", "2024-03-01T10:15:30.123Z");
    expected.put("updated_at", "2024-03-01T10:15:30.123Z");
    assertEquals(expected, version.itemChanges());
    assertEquals(List.copyOf(expected.keySet()), List.copyOf(version.itemChanges().keySet()));
    assertEquals("SimpleCompany", version.itemType());
    assertEquals(1L, version.itemId());
    assertNull(version.id());
    assertNull(version.insertedAt());
  }

  @Test
  void updateRecordsOnlyTheChangeMapping() {
    ChangeSet cs = ChangeSet.forUpdate(acme(), Map.of("city", "Hong Kong", "name", "Acme LLC"));

    Version version = capture.capture(VersionEvent.UPDATE, cs, options);

    assertEquals(Map.of("city", "Hong Kong"), version.itemChanges());
    assertEquals(1L, version.itemId());
  }

  @Test
  void deleteSnapshotsBaseEntity() {
    ChangeSet cs = ChangeSet.forUpdate(acme(), Map.of("city", "Hong Kong"));

    Version version = capture.capture(VersionEvent.DELETE, cs, options);

    assertEquals("Greenwich", version.itemChanges().get("city"));
    assertEquals(1L, version.itemChanges().get("id"));
  }

  @Test
  void optionsAreCopiedVerbatim() {
    Version version = capture.capture(VersionEvent.SOFT_DELETE, acme(), options);

    assertEquals(7L, version.originatorId());
    assertEquals("scraper", version.origin());
    assertEquals(Map.of("linkname", "izelnakri"), version.meta());
  }

  @Test
  void updateFromEntityRejected() {
    assertThrows(IllegalArgumentException.class, () -> capture.capture(VersionEvent.UPDATE, acme(), options));
  }

  @Test
  void projectionCarriesNormalizedChanges() {
    VersionProjection projection = capture.project(VersionEvent.SOFT_DELETE, COMPANIES,
        Map.of("updated_at", NOW), TrailOptions.defaults());

    assertEquals(Map.of("updated_at", "2024-03-01T10:15:30.123Z"), projection.itemChanges());
    assertNull(projection.meta());
    assertNull(projection.originatorId());
  }

  private static Entity acme() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("id", 1L);
    values.put("name", "Acme LLC");
    values.put("city", "Greenwich");
    values.put("employees", 12);
    values.put("location", Map.of("country", "US"));
    values.put("inserted_at", NOW);
    values.put("updated_at", NOW);
    return Entity.of(COMPANIES, values);
  }
}
