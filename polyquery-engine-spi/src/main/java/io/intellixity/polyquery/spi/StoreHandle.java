package io.intellixity.polyquery.spi;

/**
 * Resolved runtime handle for a backing store.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema (may be null)\n
 * - Mongo: client() is MongoClient, namespace() is database\n
 * - Neo4j: client() is Driver, namespace() is database\n
 */
public interface StoreHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by an adapter (DataSource, MongoClient, Driver). */
  TClient client();

  /** Namespace (schema/database) for this handle. */
  String namespace();
}
