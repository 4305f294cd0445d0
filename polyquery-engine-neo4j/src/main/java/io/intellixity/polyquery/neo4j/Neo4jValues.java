package io.intellixity.polyquery.neo4j;

import io.intellixity.polyquery.row.Row;
import io.intellixity.polyquery.spi.Values;
import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Entity;
import org.neo4j.driver.types.Path;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record-to-row rendering.\n
 *
 * - nodes and relationships become their property maps\n
 * - paths become the list of their nodes' property maps\n
 * - temporal values, points and durations render via {@code toString()}\n
 */
final class Neo4jValues {
  private Neo4jValues() {}

  static Row toRow(Record record) {
    LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
    for (String key : record.keys()) fields.put(key, normalize(record.get(key)));
    return Row.of(fields);
  }

  static Object normalize(Object v) {
    if (v instanceof Value value) return value.isNull() ? null : normalize(value.asObject());
    if (v instanceof Entity entity) return normalize(entity.asMap());
    if (v instanceof Path path) {
      List<Object> nodes = new ArrayList<>();
      path.nodes().forEach(n -> nodes.add(normalize(n.asMap())));
      return nodes;
    }
    if (v instanceof Map<?, ?> m) {
      LinkedHashMap<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), normalize(e.getValue()));
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(normalize(o));
      return out;
    }
    return Values.normalize(v);
  }
}
