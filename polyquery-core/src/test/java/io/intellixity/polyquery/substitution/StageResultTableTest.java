package io.intellixity.polyquery.substitution;

import io.intellixity.polyquery.row.Row;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class StageResultTableTest {

  @Test
  void projectsDeclaredKeysColumnWiseInRowOrder() {
    StageResultTable t = new StageResultTable();
    t.record(1, List.of("id", "title"), List.of(
        Row.of("id", 3L, "title", "Heat", "year", 1995L),
        Row.of("id", 1L, "title", "Ran", "year", 1985L)));

    assertEquals(Optional.of(List.of(3L, 1L)), t.values(1, "id"));
    assertEquals(Optional.of(List.of("Heat", "Ran")), t.values(1, "title"));
    assertEquals(Optional.empty(), t.values(1, "year"));
    assertEquals(Optional.empty(), t.values(2, "id"));
  }

  @Test
  void rowsMissingAKeyContributeNothingForThatKey() {
    StageResultTable t = new StageResultTable();
    t.record(1, List.of("id", "gross"), List.of(
        Row.of("id", 1L, "gross", 10.0),
        Row.of("id", 2L),
        Row.of("id", 3L, "gross", null)));

    assertEquals(List.of(1L, 2L, 3L), t.values(1, "id").orElseThrow());
    assertEquals(java.util.Arrays.asList(10.0, null), t.values(1, "gross").orElseThrow());
  }

  @Test
  void declaredKeyWithNoRowsRecordsEmptyList() {
    StageResultTable t = new StageResultTable();
    t.record(1, List.of("id"), List.of());
    assertEquals(Optional.of(List.of()), t.values(1, "id"));
    assertTrue(t.contains(1));
  }

  @Test
  void stagesMustBeRecordedInIncreasingOrder() {
    StageResultTable t = new StageResultTable();
    t.record(2, List.of(), List.of());
    assertThrows(IllegalStateException.class, () -> t.record(1, List.of(), List.of()));
    assertThrows(IllegalStateException.class, () -> t.record(2, List.of(), List.of()));
  }
}
