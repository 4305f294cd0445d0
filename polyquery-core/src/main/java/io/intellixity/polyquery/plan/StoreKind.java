package io.intellixity.polyquery.plan;

import java.util.Locale;

/** Backing-store categories a stage can target. */
public enum StoreKind {
  RELATIONAL("postgresql"),
  GRAPH("neo4j"),
  DOCUMENT("mongodb");

  private final String wireName;

  StoreKind(String wireName) {
    this.wireName = wireName;
  }

  /** Name used for this kind in plan JSON and log lines. */
  public String wireName() { return wireName; }

  /** True if stages of this kind carry a {@link TextQuery}; false for {@link FilterQuery}. */
  public boolean textual() { return this != DOCUMENT; }

  /** Accepts the wire name or the enum name, case-insensitively. */
  public static StoreKind fromWire(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("Store kind is blank");
    String n = name.trim().toLowerCase(Locale.ROOT);
    for (StoreKind k : values()) {
      if (k.wireName.equals(n) || k.name().toLowerCase(Locale.ROOT).equals(n)) return k;
    }
    throw new IllegalArgumentException("Unknown store kind: " + name);
  }
}
