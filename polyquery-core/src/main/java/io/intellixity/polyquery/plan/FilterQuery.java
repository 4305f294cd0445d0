package io.intellixity.polyquery.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Document-store query: find documents in {@code collection} matching {@code predicate}. */
public record FilterQuery(String collection, Map<String, Object> predicate) implements StoreQuery {
  public FilterQuery {
    Objects.requireNonNull(collection, "collection");
    if (collection.isBlank()) throw new IllegalArgumentException("collection is blank");
    predicate = Collections.unmodifiableMap(new LinkedHashMap<>(predicate == null ? Map.of() : predicate));
  }

  @Override public Kind kind() { return Kind.FILTER; }
}
