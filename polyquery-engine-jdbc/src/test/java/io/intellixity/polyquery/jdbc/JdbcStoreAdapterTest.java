package io.intellixity.polyquery.jdbc;

import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.TextQuery;
import io.intellixity.polyquery.row.Row;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcStoreAdapterTest {
  private JdbcDataSource ds;
  private JdbcStoreAdapter adapter;

  @BeforeEach
  void setUp() throws SQLException {
    ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE");
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute("CREATE TABLE movies (id BIGINT PRIMARY KEY, title VARCHAR(100), gross DECIMAL(12,2), released DATE)");
      st.execute("INSERT INTO movies VALUES (1, 'Heat', 187436818.50, DATE '1995-12-15')");
      st.execute("INSERT INTO movies VALUES (2, 'Ran', NULL, DATE '1985-06-01')");
      st.execute("INSERT INTO movies VALUES (3, 'Schindler''s List', 322161245.00, DATE '1993-12-15')");
    }
    adapter = new JdbcStoreAdapter(new JdbcHandle("test", ds, null));
  }

  @Test
  void returnsRowsKeyedByColumnLabelInOrder() {
    List<Row> rows = adapter.execute(new TextQuery("SELECT id, title AS name FROM movies WHERE id IN (1, 3) ORDER BY id"));
    assertEquals(List.of(Row.of("id", 1L, "name", "Heat"), Row.of("id", 3L, "name", "Schindler's List")), rows);
    assertEquals(List.of("id", "name"), List.copyOf(rows.get(0).fieldNames()));
  }

  @Test
  void decimalsAndDatesAreNormalized() {
    List<Row> rows = adapter.execute(new TextQuery("SELECT gross, released FROM movies ORDER BY id"));
    assertEquals(187436818.5, rows.get(0).get("gross"));
    assertEquals("1995-12-15", rows.get(0).get("released"));
    assertTrue(rows.get(1).has("gross"));
    assertNull(rows.get(1).get("gross"));
  }

  @Test
  void emptyMembershipClauseSkipsTheDatabase() {
    // invalid SQL on purpose: reaching the database would fail
    assertEquals(List.of(), adapter.execute(new TextQuery("SELECT * FROM no_such_table WHERE id IN ()")));
    assertEquals(List.of(), adapter.execute(new TextQuery("select * from no_such_table where id in (  )")));
    assertEquals(List.of(), adapter.execute(new TextQuery("SELECT * FROM no_such_table WHERE id IN(\n)")));
  }

  @Test
  void nonEmptyMembershipIsExecuted() {
    assertEquals(1, adapter.execute(new TextQuery("SELECT id FROM movies WHERE title IN ('Ran')")).size());
    assertFalse(JdbcStoreAdapter.EMPTY_MEMBERSHIP.matcher("WHERE JOIN (SELECT 1)").find());
  }

  @Test
  void membershipTextInsideLiteralsOrCommentsIsExecuted() throws SQLException {
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute("CREATE TABLE notes (id BIGINT PRIMARY KEY, body VARCHAR(100))");
      st.execute("INSERT INTO notes VALUES (1, 'plug in ()')");
    }

    assertEquals(List.of(Row.of("id", 1L)), adapter.execute(new TextQuery("SELECT id FROM notes WHERE body = 'plug in ()'")));
    assertEquals(1, adapter.execute(new TextQuery("SELECT id FROM notes -- no ids IN ()\nWHERE id = 1")).size());
    assertEquals(1, adapter.execute(new TextQuery("SELECT id /* was: id IN ( ) */ FROM notes")).size());
    assertTrue(JdbcStoreAdapter.hasEmptyMembership("SELECT 'it''s' AS x FROM notes WHERE id IN ( )"));
  }

  @Test
  void sqlErrorsBecomeStoreExecutionException() {
    StoreExecutionException e = assertThrows(StoreExecutionException.class,
        () -> adapter.execute(new TextQuery("SELECT nope FROM movies")));
    assertEquals(StoreKind.RELATIONAL, e.storeKind());
    assertTrue(e.getMessage().startsWith("postgresql query failed: "));
  }

  @Test
  void emptyResultIsEmptyList() {
    assertEquals(List.of(), adapter.execute(new TextQuery("SELECT id FROM movies WHERE id > 100")));
  }
}
