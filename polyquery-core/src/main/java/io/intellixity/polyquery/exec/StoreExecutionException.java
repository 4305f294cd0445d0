package io.intellixity.polyquery.exec;

import io.intellixity.polyquery.plan.StoreKind;

import java.util.Objects;

/** A backing store rejected or failed a query. */
public final class StoreExecutionException extends RuntimeException {
  private final StoreKind storeKind;
  private final String storeMessage;

  public StoreExecutionException(StoreKind storeKind, String storeMessage) {
    this(storeKind, storeMessage, null);
  }

  public StoreExecutionException(StoreKind storeKind, String storeMessage, Throwable cause) {
    super(Objects.requireNonNull(storeKind, "storeKind").wireName() + " query failed: " + storeMessage, cause);
    this.storeKind = storeKind;
    this.storeMessage = storeMessage;
  }

  public StoreKind storeKind() { return storeKind; }

  /** Message reported by the store (or driver), without the store prefix. */
  public String storeMessage() { return storeMessage; }
}
