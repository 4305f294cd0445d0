package io.intellixity.polyquery.controller;

import io.intellixity.polyquery.row.Row;

import java.util.List;

/**
 * @param summary natural-language rendering of {@code rows}; null unless requested
 * @param attempts attempts spent; 0 when answered from cache
 */
public record QueryAnswer(List<Row> rows, String summary, boolean fromCache, int attempts) {
  public QueryAnswer {
    rows = List.copyOf(rows);
  }
}
