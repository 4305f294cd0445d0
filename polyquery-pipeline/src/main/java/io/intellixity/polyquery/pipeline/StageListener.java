package io.intellixity.polyquery.pipeline;

import io.intellixity.polyquery.plan.Stage;

/**
 * Receives executor state transitions.\n
 *
 * DONE is reported with the last stage of the plan, FAILED with the stage that failed.
 */
@FunctionalInterface
public interface StageListener {
  StageListener NONE = (stage, state) -> {};

  void onTransition(Stage stage, StageState state);
}
