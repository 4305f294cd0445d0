package io.intellixity.polyquery.plan;

/** Raised when a plan violates a structural rule (stage numbering, forward references, query shape). */
public final class PlanValidationException extends PlanAcquisitionException {
  public PlanValidationException(String message) {
    super(message);
  }
}
