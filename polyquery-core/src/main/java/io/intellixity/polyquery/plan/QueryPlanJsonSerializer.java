package io.intellixity.polyquery.plan;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link QueryPlan} (the planner wire format). */
public final class QueryPlanJsonSerializer extends JsonSerializer<QueryPlan> {
  @Override
  public void serialize(QueryPlan plan, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (plan == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeArrayFieldStart("pipeline");
    for (Stage s : plan.stages()) {
      g.writeStartObject();
      g.writeNumberField("stage", s.number());
      String db = s.storeKind().wireName();
      g.writeStringField("database", db);

      g.writeObjectFieldStart("query");
      if (s.query() instanceof TextQuery t) {
        g.writeStringField(db, t.text());
      } else {
        FilterQuery f = (FilterQuery) s.query();
        g.writeObjectFieldStart(db);
        g.writeStringField("collection", f.collection());
        g.writeFieldName("filter");
        serializers.defaultSerializeValue(f.predicate(), g);
        g.writeEndObject();
      }
      g.writeEndObject();

      g.writeArrayFieldStart("output_keys");
      for (String k : s.outputKeys()) g.writeString(k);
      g.writeEndArray();
      if (!s.description().isEmpty()) g.writeStringField("description", s.description());
      g.writeEndObject();
    }
    g.writeEndArray();
    g.writeEndObject();
  }
}
