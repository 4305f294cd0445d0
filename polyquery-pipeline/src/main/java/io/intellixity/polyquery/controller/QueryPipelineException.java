package io.intellixity.polyquery.controller;

import java.util.Objects;

/** Every attempt to answer a request failed. */
public final class QueryPipelineException extends RuntimeException {
  private final int attempts;
  private final AttemptFailure lastFailure;

  public QueryPipelineException(int attempts, AttemptFailure lastFailure, Throwable cause) {
    super("Failed to process query after " + attempts + " attempts. Last error: "
        + Objects.requireNonNull(lastFailure, "lastFailure").message(), cause);
    this.attempts = attempts;
    this.lastFailure = lastFailure;
  }

  public int attempts() { return attempts; }

  public AttemptFailure lastFailure() { return lastFailure; }

  public FailureKind lastFailureKind() { return lastFailure.kind(); }
}
