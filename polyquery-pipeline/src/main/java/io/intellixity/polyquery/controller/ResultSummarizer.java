package io.intellixity.polyquery.controller;

import io.intellixity.polyquery.row.Row;

import java.util.List;

/** Renders final rows as prose for the requester. Implemented by the application. */
@FunctionalInterface
public interface ResultSummarizer {
  String FALLBACK = "Sorry, I couldn't generate a human-readable response for these results.";

  String summarize(String requestText, List<Row> rows);
}
