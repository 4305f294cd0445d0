package io.intellixity.polyquery.mongo;

import io.intellixity.polyquery.row.Row;
import io.intellixity.polyquery.spi.Values;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** BSON-to-row value rendering: ObjectId as hex, Decimal128 as Double, Date as ISO-8601 instant. */
final class MongoValues {
  private MongoValues() {}

  static Row toRow(Document d) {
    LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
    for (var e : d.entrySet()) fields.put(e.getKey(), normalize(e.getValue()));
    return Row.of(fields);
  }

  static Object normalize(Object v) {
    if (v instanceof ObjectId oid) return oid.toHexString();
    if (v instanceof Decimal128 dec) return toDouble(dec);
    if (v instanceof Date date) return date.toInstant().toString();
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

  private static double toDouble(Decimal128 dec) {
    if (dec.isNaN()) return Double.NaN;
    if (dec.isInfinite()) return dec.isNegative() ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    return dec.bigDecimalValue().doubleValue();
  }
}
