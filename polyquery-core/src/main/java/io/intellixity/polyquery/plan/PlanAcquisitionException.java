package io.intellixity.polyquery.plan;

/**
 * Raised when a query plan could not be obtained: the planner failed, or its output could not be
 * turned into a {@link QueryPlan}.
 */
public class PlanAcquisitionException extends RuntimeException {
  public PlanAcquisitionException(String message) {
    super(message);
  }

  public PlanAcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
