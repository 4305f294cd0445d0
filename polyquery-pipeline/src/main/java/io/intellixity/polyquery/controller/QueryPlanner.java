package io.intellixity.polyquery.controller;

import io.intellixity.polyquery.plan.PlanAcquisitionException;
import io.intellixity.polyquery.plan.QueryPlan;

/** Turns a request into an executable plan. Implemented by the application (typically an LLM client). */
@FunctionalInterface
public interface QueryPlanner {
  /**
   * @param feedback accumulated failure descriptions of earlier attempts, or null on the first attempt
   * @throws PlanAcquisitionException if no usable plan can be produced
   */
  QueryPlan plan(String requestText, String feedback);
}
