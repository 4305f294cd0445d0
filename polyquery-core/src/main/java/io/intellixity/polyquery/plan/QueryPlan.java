package io.intellixity.polyquery.plan;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered stages produced by the planner.\n
 *
 * Structural rules checked on construction:\n
 * - at least one stage\n
 * - stage numbers start at 1 and strictly increase\n
 * - a stage only references placeholders of strictly smaller stage numbers\n
 */
@JsonSerialize(using = QueryPlanJsonSerializer.class)
@JsonDeserialize(using = QueryPlanJsonDeserializer.class)
public final class QueryPlan implements Iterable<Stage> {
  private final List<Stage> stages;

  public QueryPlan(List<Stage> stages) {
    Objects.requireNonNull(stages, "stages");
    if (stages.isEmpty()) throw new PlanValidationException("Plan has no stages");
    int prev = 0;
    for (Stage s : stages) {
      Objects.requireNonNull(s, "stage");
      if (prev == 0 && s.number() != 1) {
        throw new PlanValidationException("First stage must be numbered 1, got " + s.number());
      }
      if (s.number() <= prev) {
        throw new PlanValidationException("Stage numbers must strictly increase: " + s.number() + " after " + prev);
      }
      for (Placeholder p : Placeholder.findIn(s.query())) {
        if (p.stage() >= s.number()) {
          throw new PlanValidationException("Stage " + s.number() + " references " + p.token()
              + " which is not an earlier stage");
        }
      }
      prev = s.number();
    }
    this.stages = List.copyOf(stages);
  }

  public static QueryPlan of(Stage... stages) {
    return new QueryPlan(List.of(stages));
  }

  public List<Stage> stages() { return stages; }

  public int size() { return stages.size(); }

  public Stage last() { return stages.get(stages.size() - 1); }

  @Override
  public Iterator<Stage> iterator() {
    return stages.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof QueryPlan p && stages.equals(p.stages);
  }

  @Override
  public int hashCode() {
    return stages.hashCode();
  }

  @Override
  public String toString() {
    return "QueryPlan" + stages;
  }
}
