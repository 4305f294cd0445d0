package io.intellixity.polyquery.pipeline;

import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.row.Row;
import io.intellixity.polyquery.spi.StoreAdapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/** Scripted adapter that records every query it receives. */
public final class FakeStoreAdapter implements StoreAdapter {
  private final StoreKind kind;
  private final Function<StoreQuery, List<Row>> body;
  private final List<StoreQuery> received = Collections.synchronizedList(new ArrayList<>());

  public FakeStoreAdapter(StoreKind kind, Function<StoreQuery, List<Row>> body) {
    this.kind = kind;
    this.body = body;
  }

  public static FakeStoreAdapter returning(StoreKind kind, List<Row> rows) {
    return new FakeStoreAdapter(kind, q -> rows);
  }

  @Override public StoreKind kind() { return kind; }

  @Override
  public List<Row> execute(StoreQuery query) {
    received.add(query);
    return body.apply(query);
  }

  public List<StoreQuery> received() {
    synchronized (received) {
      return List.copyOf(received);
    }
  }
}
