package io.intellixity.polyquery.plan;

import java.util.List;
import java.util.Objects;

/**
 * One query step of a {@link QueryPlan}, bound to a single store kind.
 *
 * @param number      1-based position in the plan
 * @param storeKind   store the query runs against
 * @param query       text for relational/graph stages, filter for document stages
 * @param outputKeys  columns published to later stages through the stage result table
 * @param description free text from the planner
 */
public record Stage(int number,
                    StoreKind storeKind,
                    StoreQuery query,
                    List<String> outputKeys,
                    String description) {
  public Stage {
    if (number < 1) throw new PlanValidationException("Stage number must be >= 1, got " + number);
    Objects.requireNonNull(storeKind, "storeKind");
    Objects.requireNonNull(query, "query");
    StoreQuery.Kind expected = storeKind.textual() ? StoreQuery.Kind.TEXT : StoreQuery.Kind.FILTER;
    if (query.kind() != expected) {
      throw new PlanValidationException("Stage " + number + " targets " + storeKind.wireName()
          + " and needs a " + expected + " query, got " + query.kind());
    }
    outputKeys = List.copyOf(outputKeys == null ? List.of() : outputKeys);
    description = (description == null) ? "" : description;
  }
}
