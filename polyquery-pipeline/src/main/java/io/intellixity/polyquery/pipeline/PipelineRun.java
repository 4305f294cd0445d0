package io.intellixity.polyquery.pipeline;

import io.intellixity.polyquery.row.Row;
import io.intellixity.polyquery.substitution.StageResultTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one successful plan execution.
 *
 * @param rows rows of the last stage
 * @param stageRows every stage's rows keyed {@code stage_<N>}, in stage order
 * @param table projected outputs used for substitution during the run
 */
public record PipelineRun(List<Row> rows, Map<String, List<Row>> stageRows, StageResultTable table) {
  public PipelineRun {
    rows = List.copyOf(rows);
    stageRows = Collections.unmodifiableMap(new LinkedHashMap<>(stageRows));
  }

  static String stageKey(int stage) {
    return "stage_" + stage;
  }
}
