package io.intellixity.polyquery.merge;

import io.intellixity.polyquery.row.Row;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ResultMergerTest {
  private final ResultMerger merger = new ResultMerger();

  private static Map<String, List<Row>> sets(Object... namesAndRows) {
    LinkedHashMap<String, List<Row>> m = new LinkedHashMap<>();
    for (int i = 0; i < namesAndRows.length; i += 2) {
      @SuppressWarnings("unchecked")
      List<Row> rows = (List<Row>) namesAndRows[i + 1];
      m.put((String) namesAndRows[i], rows);
    }
    return m;
  }

  @Test
  void innerJoinKeepsOnlyMatchingKeys() {
    List<Row> a = List.of(Row.of("id", 1, "x", "a"), Row.of("id", 2, "x", "b"));
    List<Row> b = List.of(Row.of("id", 2, "y", "c"), Row.of("id", 3, "y", "d"));

    List<Row> out = merger.merge(sets("A", a, "B", b), List.of("id"));

    assertEquals(List.of(Row.of("id", 2, "x", "b", "y", "c")), out);
  }

  @Test
  void laterSetOverridesSameNamedFields() {
    List<Row> a = List.of(Row.of("id", 1, "title", "old", "year", 1995));
    List<Row> b = List.of(Row.of("id", 1, "title", "new"));

    List<Row> out = merger.merge(sets("A", a, "B", b), List.of("id"));

    assertEquals(List.of(Row.of("id", 1, "title", "new", "year", 1995)), out);
  }

  @Test
  void threeSetsJoinLeftToRight() {
    List<Row> a = List.of(Row.of("id", 1, "a", 1), Row.of("id", 2, "a", 2));
    List<Row> b = List.of(Row.of("id", 2, "b", 2), Row.of("id", 1, "b", 1));
    List<Row> c = List.of(Row.of("id", 1, "c", 1));

    List<Row> out = merger.merge(sets("A", a, "B", b, "C", c), List.of("id"));

    assertEquals(List.of(Row.of("id", 1, "a", 1, "b", 1, "c", 1)), out);
  }

  @Test
  void compositeKeysCompareByTextualForm() {
    List<Row> a = List.of(Row.of("id", 7L, "lang", "en", "x", 1));
    List<Row> b = List.of(Row.of("id", 7, "lang", "en", "y", 2), Row.of("id", 7, "lang", "fr", "y", 3));

    List<Row> out = merger.merge(sets("A", a, "B", b), List.of("id", "lang"));

    assertEquals(1, out.size());
    assertEquals(2, out.get(0).get("y"));
  }

  @Test
  void missingMergeKeyYieldsEmptyResult() {
    List<Row> a = List.of(Row.of("id", 1));
    List<Row> b = List.of(Row.of("movie_id", 1));

    assertEquals(List.of(), merger.merge(sets("A", a, "B", b), List.of("id")));
  }

  @Test
  void emptyInputAndEmptySets() {
    assertEquals(List.of(), merger.merge(Map.of(), List.of("id")));
    List<Row> a = List.of(Row.of("id", 1));
    assertEquals(List.of(), merger.merge(sets("A", a, "B", List.of()), List.of("id")));
  }

  @Test
  void singleSetIsReturnedAsIs() {
    List<Row> a = List.of(Row.of("id", 1), Row.of("id", 2));
    assertEquals(a, merger.merge(sets("A", a), List.of("id")));
  }

  @Test
  void emptyMergeKeysRejected() {
    assertThrows(IllegalArgumentException.class, () -> merger.merge(sets("A", List.of()), List.of()));
  }
}
