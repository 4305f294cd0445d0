package io.intellixity.polyquery.neo4j;

import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.plan.TextQuery;
import io.intellixity.polyquery.row.Row;
import io.intellixity.polyquery.spi.AbstractStoreAdapter;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.Neo4jException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Graph adapter: runs Cypher text in a session opened per call on the handle's database.\n
 *
 * One row per result record, fields named by the RETURN clause.
 */
public final class Neo4jStoreAdapter extends AbstractStoreAdapter<Neo4jHandle> {
  /** The part of a driver session this adapter uses. */
  interface GraphSession extends AutoCloseable {
    List<Record> run(String cypher);

    @Override
    void close();
  }

  private final Supplier<GraphSession> sessions;

  public Neo4jStoreAdapter(Neo4jHandle handle) {
    this(handle, sessionsFor(handle.client(), SessionConfig.forDatabase(handle.database())));
  }

  Neo4jStoreAdapter(Neo4jHandle handle, Supplier<GraphSession> sessions) {
    super(StoreKind.GRAPH, handle);
    this.sessions = Objects.requireNonNull(sessions, "sessions");
  }

  private static Supplier<GraphSession> sessionsFor(Driver driver, SessionConfig config) {
    return () -> {
      Session session = driver.session(config);
      return new GraphSession() {
        @Override
        public List<Record> run(String cypher) {
          return session.run(cypher).list();
        }

        @Override
        public void close() {
          session.close();
        }
      };
    };
  }

  @Override
  protected List<Row> doExecute(StoreQuery query) {
    String cypher = ((TextQuery) query).text();
    try (GraphSession session = sessions.get()) {
      List<Record> records = session.run(cypher);
      List<Row> out = new ArrayList<>(records.size());
      for (Record r : records) out.add(Neo4jValues.toRow(r));
      return out;
    } catch (Neo4jException e) {
      throw new StoreExecutionException(StoreKind.GRAPH, e.getMessage(), e);
    }
  }
}
