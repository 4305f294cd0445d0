package io.intellixity.polyquery.neo4j;

import io.intellixity.polyquery.spi.StoreHandle;
import org.neo4j.driver.Driver;

import java.util.Objects;

/** Neo4j store handle; database defaults to {@code neo4j}. */
public final class Neo4jHandle implements StoreHandle<Driver> {
  public static final String DEFAULT_DATABASE = "neo4j";

  private final String id;
  private final Driver client;
  private final String database;

  public Neo4jHandle(String id, Driver client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = (database == null || database.isBlank()) ? DEFAULT_DATABASE : database;
  }

  @Override public String id() { return id; }
  @Override public Driver client() { return client; }
  @Override public String namespace() { return database; }

  public String database() { return database; }
}
