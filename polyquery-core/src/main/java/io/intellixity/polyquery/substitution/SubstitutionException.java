package io.intellixity.polyquery.substitution;

/** Raised when a substituted structured filter can no longer be read back. */
public final class SubstitutionException extends RuntimeException {
  public SubstitutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
