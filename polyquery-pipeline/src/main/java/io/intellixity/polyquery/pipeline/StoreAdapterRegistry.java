package io.intellixity.polyquery.pipeline;

import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.spi.StoreAdapter;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Immutable mapping from store kind to the adapter serving it (at most one per kind). */
public final class StoreAdapterRegistry {
  private final Map<StoreKind, StoreAdapter> byKind;

  public StoreAdapterRegistry(Collection<? extends StoreAdapter> adapters) {
    Objects.requireNonNull(adapters, "adapters");
    EnumMap<StoreKind, StoreAdapter> m = new EnumMap<>(StoreKind.class);
    for (StoreAdapter a : adapters) {
      Objects.requireNonNull(a, "adapter");
      StoreAdapter prev = m.put(Objects.requireNonNull(a.kind(), "adapter.kind"), a);
      if (prev != null) throw new IllegalArgumentException("Duplicate adapter for store kind " + a.kind());
    }
    this.byKind = Collections.unmodifiableMap(m);
  }

  public static StoreAdapterRegistry of(StoreAdapter... adapters) {
    return new StoreAdapterRegistry(List.of(adapters));
  }

  public Optional<StoreAdapter> find(StoreKind kind) {
    return Optional.ofNullable(byKind.get(kind));
  }

  public boolean supports(StoreKind kind) { return byKind.containsKey(kind); }
}
