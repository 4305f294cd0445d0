package io.intellixity.polyquery.substitution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polyquery.plan.FilterQuery;
import io.intellixity.polyquery.plan.Placeholder;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.plan.TextQuery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a stage query by replacing placeholders with literals rendered from the stage result table.\n
 *
 * Replacement is a single scan over the original query, so rendered values are never rescanned.
 * Placeholders with no entry in the table are left as written. A placeholder that is a whole
 * collection name or field name must resolve to exactly one value.
 */
public final class Substitutions {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

  /** A placeholder, optionally wrapped in JSON string quotes (groups 1 and 4). */
  private static final Pattern JSON_TOKEN = Pattern.compile("(\"?)" + Placeholder.PATTERN.pattern() + "(\"?)");

  /** Offset of the collection value in the serialized envelope. */
  private static final int COLLECTION_AT = "{\"collection\":".length();

  private Substitutions() {}

  /** Returns a query of the same shape with every resolvable placeholder substituted. */
  public static StoreQuery substitute(StoreQuery query, StageResultTable table, StoreKind kind) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(kind, "kind");
    if (table.isEmpty()) return query;
    return switch (query.kind()) {
      case TEXT -> new TextQuery(substituteText(((TextQuery) query).text(), table, kind));
      case FILTER -> substituteFilter((FilterQuery) query, table);
    };
  }

  static String substituteText(String text, StageResultTable table, StoreKind kind) {
    Matcher m = Placeholder.PATTERN.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    while (m.find()) {
      Optional<List<Object>> values = lookup(table, m.group(1), m.group(2));
      String replacement = values.map(v -> ValueFormatter.format(v, kind)).orElse(m.group());
      m.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(out);
    return out.toString();
  }

  static FilterQuery substituteFilter(FilterQuery query, StageResultTable table) {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("collection", query.collection());
    envelope.put("filter", query.predicate());

    String json;
    try {
      json = JSON.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      throw new SubstitutionException("Filter for collection '" + query.collection() + "' is not serializable", e);
    }

    Matcher m = JSON_TOKEN.matcher(json);
    StringBuilder out = new StringBuilder(json.length());
    while (m.find()) {
      Optional<List<Object>> values = lookup(table, m.group(2), m.group(3));
      String replacement;
      if (values.isEmpty()) {
        replacement = m.group();
      } else if (!m.group(1).isEmpty() && !m.group(4).isEmpty() && isName(json, m)) {
        List<Object> v = values.get();
        if (v.size() != 1) {
          throw new SubstitutionException("{previous_stage" + m.group(2) + "." + m.group(3) + "}"
              + " names a collection or field but has " + v.size() + " values", null);
        }
        replacement = "\"" + escapeJsonString(ValueFormatter.plain(v)) + "\"";
      } else if (!m.group(1).isEmpty() && !m.group(4).isEmpty()) {
        // whole JSON string is the placeholder: splice in a JSON literal
        replacement = ValueFormatter.format(values.get(), StoreKind.DOCUMENT);
      } else {
        replacement = m.group(1) + escapeJsonString(ValueFormatter.plain(values.get())) + m.group(4);
      }
      m.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(out);

    try {
      Map<String, Object> back = JSON.readValue(out.toString(), MAP);
      Object collection = back.get("collection");
      if (!(collection instanceof String c)) {
        throw new SubstitutionException("Substituted collection is not a string: " + collection, null);
      }
      @SuppressWarnings("unchecked")
      Map<String, Object> predicate = (back.get("filter") instanceof Map<?, ?> f) ? (Map<String, Object>) f : Map.of();
      return new FilterQuery(c, predicate);
    } catch (JsonProcessingException e) {
      throw new SubstitutionException("Substituted filter for collection '" + query.collection() + "' is not valid JSON", e);
    }
  }

  /** True when the quoted token is the collection value or an object key. */
  private static boolean isName(String json, Matcher m) {
    return m.start() == COLLECTION_AT || (m.end() < json.length() && json.charAt(m.end()) == ':');
  }

  private static Optional<List<Object>> lookup(StageResultTable table, String stage, String key) {
    int n = Placeholder.stageNumber(stage);
    return n < 1 ? Optional.empty() : table.values(n, key);
  }

  private static String escapeJsonString(String s) {
    try {
      String quoted = JSON.writeValueAsString(s);
      return quoted.substring(1, quoted.length() - 1);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }
}
