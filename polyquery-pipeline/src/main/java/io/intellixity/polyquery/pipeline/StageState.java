package io.intellixity.polyquery.pipeline;

/** Per-stage lifecycle reported to a {@link StageListener}; DONE and FAILED are terminal for the run. */
public enum StageState {
  PENDING,
  SUBSTITUTING,
  EXECUTING,
  RECORDED,
  DONE,
  FAILED
}
