package io.intellixity.polyquery.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reference to an earlier stage's output column, written {@code {previous_stage<N>.<key>}} inside a
 * later stage's query.
 */
public record Placeholder(int stage, String key) {
  /** Group 1 = stage number, group 2 = output key. */
  public static final Pattern PATTERN = Pattern.compile("\\{previous_stage(\\d+)\\.([^{}\\s\"]+)}");

  public Placeholder {
    if (stage < 1) throw new IllegalArgumentException("stage must be >= 1");
    Objects.requireNonNull(key, "key");
    if (key.isBlank()) throw new IllegalArgumentException("key is blank");
  }

  public String token() {
    return "{previous_stage" + stage + "." + key + "}";
  }

  static Placeholder of(Matcher m) {
    int stage = stageNumber(m.group(1));
    if (stage < 1) throw new PlanValidationException("Placeholder stage out of range: " + m.group());
    return new Placeholder(stage, m.group(2));
  }

  /** Stage number for the digits of a matched token, or -1 past nine digits. */
  public static int stageNumber(String digits) {
    return digits.length() > 9 ? -1 : Integer.parseInt(digits);
  }

  /** All placeholders in {@code text}, in order of appearance (duplicates kept). */
  public static List<Placeholder> findIn(String text) {
    if (text == null || text.isEmpty()) return List.of();
    List<Placeholder> out = new ArrayList<>();
    Matcher m = PATTERN.matcher(text);
    while (m.find()) out.add(of(m));
    return out;
  }

  /** All placeholders referenced anywhere in the query, including nested filter keys and values. */
  public static List<Placeholder> findIn(StoreQuery query) {
    Objects.requireNonNull(query, "query");
    if (query instanceof TextQuery t) return findIn(t.text());
    FilterQuery f = (FilterQuery) query;
    List<Placeholder> out = new ArrayList<>(findIn(f.collection()));
    collect(f.predicate(), out);
    return out;
  }

  private static void collect(Object v, List<Placeholder> out) {
    if (v instanceof CharSequence cs) {
      out.addAll(findIn(cs.toString()));
    } else if (v instanceof Map<?, ?> m) {
      for (var e : m.entrySet()) {
        collect(e.getKey(), out);
        collect(e.getValue(), out);
      }
    } else if (v instanceof Iterable<?> it) {
      for (Object x : it) collect(x, out);
    }
  }

  @Override
  public String toString() {
    return token();
  }
}
