package io.intellixity.polyquery.jdbc;

import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.plan.TextQuery;
import io.intellixity.polyquery.row.Row;
import io.intellixity.polyquery.spi.AbstractStoreAdapter;
import io.intellixity.polyquery.spi.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Relational adapter: runs SQL text on a connection borrowed from the handle's DataSource.\n
 *
 * A query containing an empty membership clause ({@code IN ()}) returns no rows without
 * touching the database; an earlier stage produced nothing to match against. Quoted text and
 * comments are not searched.
 */
public final class JdbcStoreAdapter extends AbstractStoreAdapter<JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcStoreAdapter.class);

  static final Pattern EMPTY_MEMBERSHIP = Pattern.compile("\\bIN\\s*\\(\\s*\\)", Pattern.CASE_INSENSITIVE);

  /** String literals, quoted identifiers, line and block comments. */
  private static final Pattern NOT_CODE = Pattern.compile("'(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"|--[^\\r\\n]*|/\\*.*?\\*/", Pattern.DOTALL);

  private final DataSource ds;

  public JdbcStoreAdapter(JdbcHandle handle) {
    super(StoreKind.RELATIONAL, handle);
    this.ds = handle.client();
  }

  /** Convenience constructor: wraps a raw DataSource into a handle. */
  public JdbcStoreAdapter(DataSource ds) {
    this(new JdbcHandle("jdbc", ds, null));
  }

  @Override
  protected List<Row> doExecute(StoreQuery query) {
    String sql = ((TextQuery) query).text();
    if (hasEmptyMembership(sql)) {
      if (log.isDebugEnabled()) {
        log.debug("polyquery.jdbc op=SKIP reason=empty_membership handleId={} sql={}", handle().id(), sql);
      }
      return List.of();
    }

    try (Connection c = ds.getConnection();
         Statement st = c.createStatement();
         ResultSet rs = st.executeQuery(sql)) {
      ResultSetMetaData md = rs.getMetaData();
      int n = md.getColumnCount();
      String[] labels = new String[n];
      for (int i = 1; i <= n; i++) labels[i - 1] = md.getColumnLabel(i);

      List<Row> out = new ArrayList<>();
      while (rs.next()) {
        LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
        for (int i = 1; i <= n; i++) fields.put(labels[i - 1], read(rs.getObject(i)));
        out.add(Row.of(fields));
      }
      return out;
    } catch (SQLException e) {
      throw new StoreExecutionException(StoreKind.RELATIONAL, e.getMessage(), e);
    }
  }

  static boolean hasEmptyMembership(String sql) {
    return EMPTY_MEMBERSHIP.matcher(NOT_CODE.matcher(sql).replaceAll(" ")).find();
  }

  private static Object read(Object v) throws SQLException {
    if (v instanceof Array a) {
      try {
        return Values.normalize(a.getArray());
      } finally {
        a.free();
      }
    }
    if (v instanceof Clob clob) return clob.getSubString(1, (int) clob.length());
    if (v instanceof Timestamp ts) return ts.toLocalDateTime().toString();
    if (v instanceof java.sql.Date d) return d.toLocalDate().toString();
    if (v instanceof java.sql.Time t) return t.toLocalTime().toString();
    return Values.normalize(v);
  }
}
