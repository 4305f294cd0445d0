package io.intellixity.polyquery.plan;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON deserializer for {@link QueryPlan}.\n
 *
 * Accepts {@code {"pipeline":[...]}} or a bare stage array. The query object is keyed by the
 * store's wire name; a plain string is also accepted for text stores.
 */
public final class QueryPlanJsonDeserializer extends JsonDeserializer<QueryPlan> {
  @Override
  public QueryPlan deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;

    JsonNode pipeline = root.isArray() ? root : root.get("pipeline");
    if (pipeline == null || !pipeline.isArray()) {
      throw new PlanValidationException("Plan JSON must contain a 'pipeline' array");
    }

    List<Stage> stages = new ArrayList<>();
    for (JsonNode s : pipeline) {
      if (!s.isObject()) throw new PlanValidationException("Pipeline entries must be objects: " + s);
      stages.add(parseStage(s, codec));
    }
    return new QueryPlan(stages);
  }

  private static Stage parseStage(JsonNode s, ObjectCodec codec) throws IOException {
    JsonNode num = s.get("stage");
    if (num == null || !num.canConvertToInt()) throw new PlanValidationException("Stage requires an integer 'stage'");
    int number = num.intValue();

    String db = textOrNull(s.get("database"));
    StoreKind kind;
    try {
      kind = StoreKind.fromWire(db);
    } catch (IllegalArgumentException e) {
      throw new PlanValidationException("Stage " + number + ": " + e.getMessage());
    }

    StoreQuery query = parseQuery(number, kind, db, s.get("query"), codec);

    List<String> outputKeys = new ArrayList<>();
    JsonNode keys = s.get("output_keys");
    if (keys != null && keys.isArray()) {
      for (JsonNode k : keys) if (k.isTextual()) outputKeys.add(k.asText());
    }

    return new Stage(number, kind, query, outputKeys, textOrNull(s.get("description")));
  }

  private static StoreQuery parseQuery(int number, StoreKind kind, String db, JsonNode q, ObjectCodec codec)
      throws IOException {
    if (q == null || q.isNull()) throw new PlanValidationException("Stage " + number + " has no query");

    JsonNode body = q;
    if (q.isObject()) {
      // {"query": {"neo4j": "..."}} is the canonical form; fall back to the enum name.
      JsonNode keyed = q.get(db);
      if (keyed == null) keyed = q.get(kind.wireName());
      if (keyed != null) body = keyed;
    }

    if (kind.textual()) {
      if (!body.isTextual()) throw new PlanValidationException("Stage " + number + " needs query text for " + kind.wireName());
      return new TextQuery(body.asText());
    }

    if (!body.isObject()) throw new PlanValidationException("Stage " + number + " needs a filter object for " + kind.wireName());
    String collection = textOrNull(body.get("collection"));
    if (collection == null || collection.isBlank()) {
      throw new PlanValidationException("Stage " + number + " filter requires 'collection'");
    }
    JsonNode filter = body.get("filter");
    Map<String, Object> predicate = Map.of();
    if (filter != null && !filter.isNull()) {
      if (!filter.isObject()) throw new PlanValidationException("Stage " + number + " 'filter' must be an object");
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(filter, Map.class);
      predicate = m;
    }
    return new FilterQuery(collection, predicate);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
