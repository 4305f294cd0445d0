package io.intellixity.polyquery.neo4j;

import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.TextQuery;
import io.intellixity.polyquery.row.Row;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.internal.InternalRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

final class Neo4jStoreAdapterTest {

  /** Nothing listens on port 1; the driver connects lazily. */
  private final Driver driver = GraphDatabase.driver("bolt://127.0.0.1:1",
      Config.builder().withConnectionTimeout(200, TimeUnit.MILLISECONDS).build());
  private final Neo4jHandle handle = new Neo4jHandle("test", driver, null);

  @AfterEach
  void tearDown() {
    driver.close();
  }

  static final class FakeSession implements Neo4jStoreAdapter.GraphSession {
    private final Function<String, List<Record>> results;
    final List<String> ran = new ArrayList<>();
    boolean closed;

    FakeSession(Function<String, List<Record>> results) {
      this.results = results;
    }

    @Override
    public List<Record> run(String cypher) {
      ran.add(cypher);
      return results.apply(cypher);
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  private static Record record(List<String> keys, Value... values) {
    return new InternalRecord(keys, values);
  }

  @Test
  void recordsBecomeRowsNamedByReturnClauseAndSessionIsClosed() {
    FakeSession session = new FakeSession(c -> List.of(
        record(List.of("id", "title"), Values.value(7), Values.value("Heat")),
        record(List.of("id", "title"), Values.value(9), Values.NULL)));
    Neo4jStoreAdapter adapter = new Neo4jStoreAdapter(handle, () -> session);

    List<Row> rows = adapter.execute(new TextQuery("MATCH (m:Movie) RETURN m.id AS id, m.title AS title"));

    assertEquals(List.of(Row.of("id", 7L, "title", "Heat"), Row.of("id", 9L, "title", null)), rows);
    assertEquals(List.of("MATCH (m:Movie) RETURN m.id AS id, m.title AS title"), session.ran);
    assertTrue(session.closed);
  }

  @Test
  void cypherErrorIsWrappedAndSessionClosed() {
    FakeSession session = new FakeSession(c -> { throw new ClientException("Invalid input 'RETRN'"); });
    Neo4jStoreAdapter adapter = new Neo4jStoreAdapter(handle, () -> session);

    StoreExecutionException e = assertThrows(StoreExecutionException.class,
        () -> adapter.execute(new TextQuery("MATCH (m) RETRN m")));

    assertEquals(StoreKind.GRAPH, e.storeKind());
    assertEquals("neo4j query failed: Invalid input 'RETRN'", e.getMessage());
    assertTrue(session.closed);
  }

  @Test
  void unreachableServerIsAStoreFailure() {
    Neo4jStoreAdapter adapter = new Neo4jStoreAdapter(handle);

    StoreExecutionException e = assertThrows(StoreExecutionException.class,
        () -> adapter.execute(new TextQuery("RETURN 1 AS one")));

    assertEquals(StoreKind.GRAPH, e.storeKind());
    assertInstanceOf(Neo4jException.class, e.getCause());
  }
}
