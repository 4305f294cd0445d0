package io.intellixity.polyquery.merge;

import io.intellixity.polyquery.row.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inner-joins named result sets on caller-supplied merge keys.\n
 *
 * - the first set is the accumulator; each later set is joined into it in map order\n
 * - keys compare by {@code String.valueOf}, so {@code 2} (Long) matches {@code 2} (Integer) but not {@code 2.0}\n
 * - fields of the later set override same-named fields of the accumulator\n
 * - output order follows the accumulator\n
 * - if any non-empty set lacks a merge key in its first row, the result is empty\n
 */
public final class ResultMerger {
  private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

  public List<Row> merge(Map<String, List<Row>> named, List<String> mergeKeys) {
    Objects.requireNonNull(named, "named");
    Objects.requireNonNull(mergeKeys, "mergeKeys");
    if (mergeKeys.isEmpty()) throw new IllegalArgumentException("mergeKeys is empty");
    if (named.isEmpty()) return List.of();

    for (var e : named.entrySet()) {
      List<Row> rows = e.getValue();
      if (rows == null || rows.isEmpty()) continue;
      List<String> missing = new ArrayList<>();
      for (String k : mergeKeys) {
        if (!rows.get(0).has(k)) missing.add(k);
      }
      if (!missing.isEmpty()) {
        log.warn("polyquery.merge result={} missing merge keys {}; returning empty result", e.getKey(), missing);
        return List.of();
      }
    }

    Iterator<List<Row>> it = named.values().iterator();
    List<Row> merged = nullToEmpty(it.next());
    while (it.hasNext()) {
      merged = mergeTwo(merged, nullToEmpty(it.next()), mergeKeys);
    }
    return List.copyOf(merged);
  }

  private static List<Row> mergeTwo(List<Row> left, List<Row> right, List<String> mergeKeys) {
    Map<List<String>, Row> lookup = new HashMap<>();
    for (Row r : right) lookup.put(keyOf(r, mergeKeys), r);

    List<Row> out = new ArrayList<>();
    for (Row l : left) {
      Row match = lookup.get(keyOf(l, mergeKeys));
      if (match != null) out.add(l.union(match));
    }
    return out;
  }

  private static List<String> keyOf(Row r, List<String> mergeKeys) {
    List<String> k = new ArrayList<>(mergeKeys.size());
    for (String key : mergeKeys) k.add(String.valueOf(r.get(key)));
    return k;
  }

  private static List<Row> nullToEmpty(List<Row> rows) {
    return rows == null ? List.of() : rows;
  }
}
