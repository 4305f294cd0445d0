package io.intellixity.polyquery.substitution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polyquery.plan.StoreKind;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Renders values as literals of a store's query language. Pure and deterministic.\n
 *
 * - numbers render bare, every other scalar renders quoted\n
 * - relational sequences render bare and comma-separated, for use inside {@code IN (...)}\n
 * - graph sequences render as a bracketed list\n
 * - document-store values render as JSON literals\n
 */
public final class ValueFormatter {
  private static final ObjectMapper JSON = new ObjectMapper();

  private ValueFormatter() {}

  /** Renders a scalar or a collection of scalars for {@code kind}. */
  public static String format(Object value, StoreKind kind) {
    Objects.requireNonNull(kind, "kind");
    if (kind == StoreKind.DOCUMENT) return json(value);
    if (value instanceof Collection<?> c) {
      List<String> parts = new ArrayList<>(c.size());
      for (Object v : c) parts.add(scalar(v, kind));
      String joined = String.join(", ", parts);
      return kind == StoreKind.GRAPH ? "[" + joined + "]" : joined;
    }
    return scalar(value, kind);
  }

  /** Plain, unquoted rendering used when a placeholder sits inside a longer string. */
  public static String plain(Object value) {
    if (value instanceof Collection<?> c) {
      List<String> parts = new ArrayList<>(c.size());
      for (Object v : c) parts.add(plainScalar(v));
      return String.join(", ", parts);
    }
    return plainScalar(value);
  }

  static String scalar(Object v, StoreKind kind) {
    if (v == null) return kind == StoreKind.RELATIONAL ? "NULL" : "null";
    if (v instanceof Number n) return number(n);
    String s = String.valueOf(v);
    if (kind == StoreKind.GRAPH) {
      return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
    return "'" + s.replace("'", "''") + "'";
  }

  private static String plainScalar(Object v) {
    if (v instanceof Number n) return number(n);
    return String.valueOf(v);
  }

  private static String number(Number n) {
    if (n instanceof BigDecimal bd) return bd.toPlainString();
    return String.valueOf(n);
  }

  private static String json(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON-renderable: " + value.getClass().getName(), e);
    }
  }
}
