package io.intellixity.polyquery.controller;

import java.util.List;
import java.util.Objects;

/**
 * One natural-language question.
 *
 * @param mergeKeys when non-empty, all stage results are joined on these fields instead of
 *                  returning the last stage's rows
 */
public record QueryRequest(String text, boolean humanReadable, List<String> mergeKeys) {
  public QueryRequest {
    Objects.requireNonNull(text, "text");
    if (text.isBlank()) throw new IllegalArgumentException("text is blank");
    mergeKeys = (mergeKeys == null) ? List.of() : List.copyOf(mergeKeys);
  }

  public static QueryRequest of(String text) {
    return new QueryRequest(text, false, List.of());
  }
}
