package io.intellixity.polyquery.spi;

import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.FilterQuery;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.plan.TextQuery;
import io.intellixity.polyquery.row.Row;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractStoreAdapterTest {

  private record FakeHandle() implements StoreHandle<Object> {
    @Override public String id() { return "fake"; }
    @Override public Object client() { return new Object(); }
    @Override public String namespace() { return "ns"; }
  }

  private static final class FakeAdapter extends AbstractStoreAdapter<FakeHandle> {
    private final Function<StoreQuery, List<Row>> body;
    private final List<StoreQuery> seen = new ArrayList<>();

    FakeAdapter(StoreKind kind, Function<StoreQuery, List<Row>> body) {
      super(kind, new FakeHandle());
      this.body = body;
    }

    @Override
    protected List<Row> doExecute(StoreQuery query) {
      seen.add(query);
      return body.apply(query);
    }
  }

  @Test
  void returnsRowsFromBackend() {
    FakeAdapter a = new FakeAdapter(StoreKind.RELATIONAL, q -> List.of(Row.of("id", 1L)));
    assertEquals(List.of(Row.of("id", 1L)), a.execute(new TextQuery("SELECT 1")));
    assertEquals(StoreKind.RELATIONAL, a.kind());
    assertEquals("fake", a.handle().id());
  }

  @Test
  void wrongQueryShapeIsAStoreFailureAndNeverReachesBackend() {
    FakeAdapter graph = new FakeAdapter(StoreKind.GRAPH, q -> List.of());
    StoreExecutionException e = assertThrows(StoreExecutionException.class,
        () -> graph.execute(new FilterQuery("movies", Map.of())));
    assertEquals(StoreKind.GRAPH, e.storeKind());
    assertTrue(graph.seen.isEmpty());

    FakeAdapter doc = new FakeAdapter(StoreKind.DOCUMENT, q -> List.of());
    assertThrows(StoreExecutionException.class, () -> doc.execute(new TextQuery("{}")));
  }

  @Test
  void runtimeFailuresAreWrappedWithStoreKind() {
    FakeAdapter a = new FakeAdapter(StoreKind.DOCUMENT, q -> { throw new IllegalStateException("connection refused"); });
    StoreExecutionException e = assertThrows(StoreExecutionException.class,
        () -> a.execute(new FilterQuery("movies", Map.of())));
    assertEquals(StoreKind.DOCUMENT, e.storeKind());
    assertEquals("connection refused", e.storeMessage());
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void storeFailuresPassThroughUnchanged() {
    StoreExecutionException original = new StoreExecutionException(StoreKind.GRAPH, "syntax error");
    FakeAdapter a = new FakeAdapter(StoreKind.GRAPH, q -> { throw original; });
    assertSame(original, assertThrows(StoreExecutionException.class, () -> a.execute(new TextQuery("MATCH"))));
  }

  @Test
  void failureWithoutMessageUsesExceptionName() {
    FakeAdapter a = new FakeAdapter(StoreKind.RELATIONAL, q -> { throw new NullPointerException(); });
    StoreExecutionException e = assertThrows(StoreExecutionException.class, () -> a.execute(new TextQuery("x")));
    assertEquals("NullPointerException", e.storeMessage());
  }
}
