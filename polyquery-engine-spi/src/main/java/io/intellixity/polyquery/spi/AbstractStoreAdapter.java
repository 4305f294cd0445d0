package io.intellixity.polyquery.spi;

import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.row.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Template-method base for store adapters.\n
 *
 * Responsibilities:\n
 * - Reject queries whose shape does not match the store kind\n
 * - Debug logging of the query, duration and row count\n
 * - Wrap unexpected runtime failures into {@link StoreExecutionException}\n
 */
public abstract class AbstractStoreAdapter<H extends StoreHandle<?>> implements StoreAdapter {
  private static final Logger log = LoggerFactory.getLogger(AbstractStoreAdapter.class);

  private final StoreKind kind;
  private final H handle;

  protected AbstractStoreAdapter(StoreKind kind, H handle) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override
  public final StoreKind kind() { return kind; }

  public final H handle() { return handle; }

  @Override
  public final List<Row> execute(StoreQuery query) {
    Objects.requireNonNull(query, "query");
    StoreQuery.Kind expected = kind.textual() ? StoreQuery.Kind.TEXT : StoreQuery.Kind.FILTER;
    if (query.kind() != expected) {
      throw new StoreExecutionException(kind, "expected a " + expected + " query but got " + query.kind());
    }

    long start = System.nanoTime();
    debugQuery(query);
    try {
      List<Row> rows = doExecute(query);
      debugDone(rows.size(), System.nanoTime() - start);
      return List.copyOf(rows);
    } catch (StoreExecutionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreExecutionException(kind, describe(e), e);
    }
  }

  /** Backend-specific execution; the query kind has already been checked. */
  protected abstract List<Row> doExecute(StoreQuery query);

  /** Message text for a wrapped failure; adapters may unwrap driver-specific detail. */
  protected String describe(RuntimeException e) {
    String m = e.getMessage();
    return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
  }

  private void debugQuery(StoreQuery query) {
    if (!log.isDebugEnabled()) return;
    log.debug("polyquery.store op=EXECUTE store={} handleId={} namespace={} query={}",
        kind.wireName(), handle.id(), handle.namespace(), query);
  }

  private void debugDone(int rows, long nanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("polyquery.store_done store={} handleId={} durationMs={} rows={}",
        kind.wireName(), handle.id(), nanos / 1_000_000, rows);
  }
}
