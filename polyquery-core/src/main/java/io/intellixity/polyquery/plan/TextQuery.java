package io.intellixity.polyquery.plan;

import java.util.Objects;

public record TextQuery(String text) implements StoreQuery {
  public TextQuery {
    Objects.requireNonNull(text, "text");
  }

  @Override public Kind kind() { return Kind.TEXT; }
}
