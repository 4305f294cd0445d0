package io.intellixity.polyquery.row;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, insertion-ordered record returned by a store adapter.\n
 *
 * Values are store-normalized scalars (Long/Integer, Double, String, Boolean, null); graph and
 * document stores may also produce nested List/Map values. Null values are allowed.
 */
public final class Row {
  private static final Row EMPTY = new Row(Map.of());

  private final Map<String, Object> fields;

  private Row(Map<String, Object> fields) {
    this.fields = fields;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Row of(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    if (fields.isEmpty()) return EMPTY;
    LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
    for (var e : fields.entrySet()) {
      copy.put(Objects.requireNonNull(e.getKey(), "field name"), e.getValue());
    }
    return new Row(Collections.unmodifiableMap(copy));
  }

  /** Alternating name/value pairs: {@code Row.of("id", 1, "title", "Heat")}. */
  public static Row of(Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0) throw new IllegalArgumentException("Expected name/value pairs");
    LinkedHashMap<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      m.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
    }
    return of(m);
  }

  public boolean has(String field) { return fields.containsKey(field); }

  public Object get(String field) { return fields.get(field); }

  public Set<String> fieldNames() { return fields.keySet(); }

  public int size() { return fields.size(); }

  @JsonValue
  public Map<String, Object> asMap() { return fields; }

  /** Field-wise union; fields of {@code other} win on name clashes. */
  public Row union(Row other) {
    Objects.requireNonNull(other, "other");
    LinkedHashMap<String, Object> m = new LinkedHashMap<>(fields);
    m.putAll(other.fields);
    return of(m);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Row r && fields.equals(r.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}
