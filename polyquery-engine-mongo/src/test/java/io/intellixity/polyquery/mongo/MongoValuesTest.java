package io.intellixity.polyquery.mongo;

import io.intellixity.polyquery.row.Row;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoValuesTest {

  @Test
  void documentBecomesRowInFieldOrder() {
    ObjectId id = new ObjectId("65a1f0c2e4b0a1b2c3d4e5f6");
    Document d = new Document("_id", id).append("title", "Heat").append("year", 1995).append("rating", 8.3);

    Row r = MongoValues.toRow(d);

    assertEquals(List.of("_id", "title", "year", "rating"), List.copyOf(r.fieldNames()));
    assertEquals("65a1f0c2e4b0a1b2c3d4e5f6", r.get("_id"));
    assertEquals(1995, r.get("year"));
    assertEquals(8.3, r.get("rating"));
  }

  @Test
  void decimal128BecomesDouble() {
    assertEquals(187436818.5, MongoValues.normalize(new Decimal128(new BigDecimal("187436818.50"))));
    assertEquals(Double.NaN, MongoValues.normalize(Decimal128.NaN));
  }

  @Test
  void datesRenderAsIsoInstants() {
    assertEquals("1970-01-01T00:00:01Z", MongoValues.normalize(new Date(1000)));
  }

  @Test
  void nestedDocumentsAndArraysNormalize() {
    Document d = new Document("cast", List.of(new Document("name", "Pacino").append("fee", new Decimal128(new BigDecimal("1.5")))))
        .append("meta", new Document("ref", new ObjectId("65a1f0c2e4b0a1b2c3d4e5f6")));

    Row r = MongoValues.toRow(d);

    assertEquals(List.of(Map.of("name", "Pacino", "fee", 1.5)), r.get("cast"));
    assertEquals(Map.of("ref", "65a1f0c2e4b0a1b2c3d4e5f6"), r.get("meta"));
  }

  @Test
  void nullFieldsAreKept() {
    Row r = MongoValues.toRow(new Document("gross", null));
    assertTrue(r.has("gross"));
    assertNull(r.get("gross"));
  }
}
