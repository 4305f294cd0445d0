package io.intellixity.polyquery.examples.offline;

import io.intellixity.polyquery.controller.ResultSummarizer;
import io.intellixity.polyquery.row.Row;

import java.util.List;
import java.util.StringJoiner;

/** Plain-text listing of the rows, one line each; stands in for a language-model summary. */
public final class TabularSummarizer implements ResultSummarizer {
  private final int maxRows;

  public TabularSummarizer(int maxRows) {
    if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
    this.maxRows = maxRows;
  }

  @Override
  public String summarize(String requestText, List<Row> rows) {
    if (rows.isEmpty()) return "No results found for \"" + requestText + "\".";
    StringBuilder sb = new StringBuilder();
    sb.append(rows.size()).append(rows.size() == 1 ? " result" : " results")
        .append(" for \"").append(requestText).append("\":");
    int n = Math.min(rows.size(), maxRows);
    for (int i = 0; i < n; i++) {
      StringJoiner line = new StringJoiner(", ", "\n- ", "");
      for (String f : rows.get(i).fieldNames()) line.add(f + ": " + rows.get(i).get(f));
      sb.append(line);
    }
    if (rows.size() > n) sb.append("\n... and ").append(rows.size() - n).append(" more");
    return sb.toString();
  }
}
