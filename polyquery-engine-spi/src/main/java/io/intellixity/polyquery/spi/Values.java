package io.intellixity.polyquery.spi;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Normalizes driver values into the scalar set carried by rows.\n
 *
 * - exact decimals become Double\n
 * - Long, Integer, Double, String, Boolean and null pass through\n
 * - other numbers widen to Long or Double\n
 * - arrays and collections become lists, maps become insertion-ordered maps, recursively\n
 * - anything else (UUID, temporal values, driver ids) renders via {@code toString()}\n
 */
public final class Values {
  private Values() {}

  public static Object normalize(Object v) {
    if (v == null) return null;
    if (v instanceof String || v instanceof Boolean || v instanceof Long
        || v instanceof Integer || v instanceof Double) {
      return v;
    }
    if (v instanceof BigDecimal bd) return bd.doubleValue();
    if (v instanceof BigInteger bi) return bi.bitLength() < 64 ? (Object) bi.longValue() : (Object) bi.doubleValue();
    if (v instanceof Short || v instanceof Byte) return ((Number) v).intValue();
    if (v instanceof Float f) return Double.valueOf(f.toString());
    if (v instanceof Number n) return n.doubleValue();
    if (v instanceof Character c) return c.toString();
    if (v instanceof UUID u) return u.toString();
    if (v instanceof byte[] bytes) return java.util.Base64.getEncoder().encodeToString(bytes);
    if (v instanceof Map<?, ?> m) {
      LinkedHashMap<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), normalize(e.getValue()));
      return out;
    }
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(normalize(o));
      return out;
    }
    if (v.getClass().isArray()) {
      int n = Array.getLength(v);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(normalize(Array.get(v, i)));
      return out;
    }
    return v.toString();
  }
}
