package io.intellixity.polyquery.controller;

public enum FailureKind {
  /** Planner failed or produced an unusable plan. */
  PLAN_ACQUISITION,
  /** A store rejected or failed a stage query. */
  STORE_EXECUTION,
  /** Anything else raised while answering. */
  INTERNAL
}
