package io.intellixity.polyquery.controller;

import java.util.Objects;

/** Why one attempt of the retry loop failed. */
public record AttemptFailure(int attempt, FailureKind kind, String message) {
  public AttemptFailure {
    Objects.requireNonNull(kind, "kind");
    message = (message == null) ? "" : message;
  }
}
