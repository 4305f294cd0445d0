package io.intellixity.polyquery.substitution;

import io.intellixity.polyquery.plan.Placeholder;
import io.intellixity.polyquery.row.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-run accumulator of each stage's declared outputs, read by placeholder resolution.\n
 *
 * Values are collected column-wise in row order. A row lacking a declared key contributes
 * nothing to that key, so value lists of one stage may differ in length.
 */
public final class StageResultTable {
  private final LinkedHashMap<Integer, Map<String, List<Object>>> byStage = new LinkedHashMap<>();
  private int lastStage;

  /**
   * Records the projection of {@code rows} onto {@code outputKeys} for {@code stage}.
   *
   * @throws IllegalStateException if {@code stage} is not greater than the last recorded stage
   */
  public void record(int stage, List<String> outputKeys, List<Row> rows) {
    Objects.requireNonNull(outputKeys, "outputKeys");
    Objects.requireNonNull(rows, "rows");
    if (stage <= lastStage) {
      throw new IllegalStateException("Stage " + stage + " recorded after stage " + lastStage);
    }

    LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
    for (String key : outputKeys) {
      List<Object> values = new ArrayList<>();
      for (Row r : rows) {
        if (r.has(key)) values.add(r.get(key));
      }
      columns.put(key, Collections.unmodifiableList(values));
    }
    byStage.put(stage, Collections.unmodifiableMap(columns));
    lastStage = stage;
  }

  public Optional<List<Object>> values(int stage, String key) {
    Map<String, List<Object>> columns = byStage.get(stage);
    if (columns == null) return Optional.empty();
    return Optional.ofNullable(columns.get(key));
  }

  public Optional<List<Object>> values(Placeholder p) {
    return values(p.stage(), p.key());
  }

  public boolean contains(int stage) { return byStage.containsKey(stage); }

  public boolean isEmpty() { return byStage.isEmpty(); }

  /** Read-only view: stage number -> (output key -> values). */
  public Map<Integer, Map<String, List<Object>>> asMap() {
    return Collections.unmodifiableMap(byStage);
  }

  @Override
  public String toString() {
    return "StageResultTable" + byStage;
  }
}
