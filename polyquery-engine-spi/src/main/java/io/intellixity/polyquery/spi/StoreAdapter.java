package io.intellixity.polyquery.spi;

import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.row.Row;

import java.util.List;

/** Executes one already-substituted stage query against one store. */
public interface StoreAdapter {
  StoreKind kind();

  /**
   * Runs {@code query} and returns its rows in store order.
   *
   * @throws StoreExecutionException on any store-level failure or a query of the wrong shape
   */
  List<Row> execute(StoreQuery query);
}
