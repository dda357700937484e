package io.trail.multi;

import io.trail.TrailResult;
import io.trail.model.ChangeSet;
import io.trail.model.ColumnType;
import io.trail.model.EntitySchema;
import io.trail.spi.TrailStoreException;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MultiTest {
  private static final EntitySchema TAGS = EntitySchema.builder("Tag", "tags")
      .column("label", ColumnType.STRING)
      .build();

  private final MultiExecutor executor = new MultiExecutor();

  @Test
  void duplicateStepNameRejected() {
    Multi multi = Multi.empty().run("a", ok("1"));

    assertThrows(IllegalArgumentException.class, () -> multi.run("a", ok("2")));
  }

  @Test
  void appendAndPrependKeepOrder() {
    Multi middle = Multi.empty().run("b", ok("b"));

    Multi multi = middle.append(Multi.empty().run("c", ok("c"))).prepend(Multi.empty().run("a", ok("a")));

    assertEquals(List.of("a", "b", "c"), multi.names());
  }

  @Test
  void appendRejectsOverlappingNames() {
    Multi first = Multi.empty().run("a", ok("1"));
    Multi second = Multi.empty().run("a", ok("2"));

    assertThrows(IllegalArgumentException.class, () -> first.append(second));
  }

  @Test
  void stepsSeePreviousResults() {
    Multi multi = Multi.empty()
        .run("a", ok(1L))
        .run("b", (conn, results) -> StepOutcome.ok(results.get("a", Long.class) + 1));

    TrailResult.Success result = (TrailResult.Success) executor.execute(multi, null);

    assertEquals(2L, result.results().get("b"));
  }

  @Test
  void firstErrorStopsExecution() {
    List<String> ran = new ArrayList<>();
    Multi multi = Multi.empty()
        .run("a", record(ran, "a"))
        .error("b", "invalid")
        .run("c", record(ran, "c"));

    TrailResult.Failure failure = (TrailResult.Failure) executor.execute(multi, null);

    assertEquals("b", failure.step());
    assertEquals("invalid", failure.error());
    assertEquals(List.of("a"), ran);
    assertEquals(List.of("a"), List.copyOf(failure.completed().keys()));
  }

  @Test
  void storeExceptionFailsTheStep() {
    TrailStoreException boom = new TrailStoreException("boom");
    Multi multi = Multi.empty().run("a", (conn, results) -> {
      throw boom;
    });

    TrailResult.Failure failure = (TrailResult.Failure) executor.execute(multi, null);

    assertEquals("a", failure.step());
    assertEquals(boom, failure.error());
  }

  @Test
  void otherExceptionsPropagate() {
    Multi multi = Multi.empty().run("a", (conn, results) -> {
      throw new IllegalArgumentException("bug");
    });

    assertThrows(IllegalArgumentException.class, () -> executor.execute(multi, null));
  }

  @Test
  void mergeAddsStepsFromEarlierResults() {
    Multi multi = Multi.empty()
        .run("count", ok(2))
        .merge((conn, results) -> {
          Multi sub = Multi.empty();
          for (int i = 0; i < results.get("count", Integer.class); i++) {
            sub = sub.run("item:" + i, ok(i));
          }
          return sub;
        })
        .run("done", ok(true));

    TrailResult.Success result = (TrailResult.Success) executor.execute(multi, null);

    assertEquals(List.of("count", "item:0", "item:1", "done"), List.copyOf(result.results().keys()));
  }

  @Test
  void mergeCollidingWithExistingStepFails() {
    Multi multi = Multi.empty()
        .run("a", ok(1))
        .merge((conn, results) -> Multi.empty().run("a", ok(2)));

    assertThrows(IllegalStateException.class, () -> executor.execute(multi, null));
  }

  @Test
  void nullStepValuesAreRecorded() {
    TrailResult.Success result = (TrailResult.Success) executor.execute(Multi.empty().run("a", ok(null)), null);

    assertTrue(result.results().contains("a"));
    assertEquals(null, result.results().get("a"));
  }

  @Test
  void preflightReportsFirstInvalidChangeSet() {
    ChangeSet valid = ChangeSet.forInsert(TAGS, Map.of("label", "x"));
    ChangeSet invalid = ChangeSet.forInsert(TAGS, Map.of()).validateRequired("label");
    Multi multi = Multi.empty()
        .run("first", valid, ok(1))
        .run("second", invalid, ok(2));

    TrailResult.Failure failure = executor.preflight(multi).orElseThrow();

    assertEquals("second", failure.step());
    assertInstanceOf(ChangeSet.class, failure.error());
    assertTrue(executor.preflight(Multi.empty().run("first", valid, ok(1))).isEmpty());
  }

  private static Step ok(Object value) {
    return (conn, results) -> StepOutcome.ok(value);
  }

  private static Step record(List<String> ran, String name) {
    return (conn, results) -> {
      ran.add(name);
      return StepOutcome.ok(name);
    };
  }
}
