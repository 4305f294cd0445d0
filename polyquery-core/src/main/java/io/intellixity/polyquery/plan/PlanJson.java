package io.intellixity.polyquery.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/** Reads and writes the planner's JSON wire format. */
public final class PlanJson {
  private static final ObjectMapper JSON = new ObjectMapper();

  private PlanJson() {}

  /**
   * Parses planner output into a plan.
   *
   * @throws PlanAcquisitionException if the text is not valid JSON or is not a well-formed plan
   */
  public static QueryPlan read(String text) {
    Objects.requireNonNull(text, "text");
    try {
      QueryPlan plan = JSON.readValue(text, QueryPlan.class);
      if (plan == null) throw new PlanValidationException("Plan JSON is null");
      return plan;
    } catch (PlanAcquisitionException e) {
      throw e;
    } catch (JsonProcessingException e) {
      if (e.getCause() instanceof PlanAcquisitionException pae) throw pae;
      throw new PlanAcquisitionException("Generated query was not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static String write(QueryPlan plan) {
    Objects.requireNonNull(plan, "plan");
    try {
      return JSON.writeValueAsString(plan);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize plan", e);
    }
  }
}
