package io.intellixity.polyquery.examples.config;

import io.intellixity.polyquery.cache.ResultCache;
import io.intellixity.polyquery.controller.QueryController;
import io.intellixity.polyquery.neo4j.Neo4jHandle;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Store connections and pipeline tuning. A store whose address is unset gets no adapter. */
@ConfigurationProperties(prefix = "polyquery")
public class PolyQueryProperties {
  private final Relational relational = new Relational();
  private final Document document = new Document();
  private final Graph graph = new Graph();
  private final Cache cache = new Cache();
  private final Retry retry = new Retry();
  private final Planner planner = new Planner();

  public Relational getRelational() { return relational; }
  public Document getDocument() { return document; }
  public Graph getGraph() { return graph; }
  public Cache getCache() { return cache; }
  public Retry getRetry() { return retry; }
  public Planner getPlanner() { return planner; }

  public static class Relational {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Document {
    private String uri;
    private String database;

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Graph {
    private String uri;
    private String username;
    private String password;
    private String database = Neo4jHandle.DEFAULT_DATABASE;

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Cache {
    private Duration ttl = ResultCache.DEFAULT_TTL;
    private int maxEntries = ResultCache.DEFAULT_MAX_ENTRIES;

    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
  }

  public static class Retry {
    private int maxRetries = QueryController.DEFAULT_MAX_RETRIES;

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
  }

  public static class Planner {
    /** Directory of pre-written plan JSON files, one per request. */
    private String plansDir;

    public String getPlansDir() { return plansDir; }
    public void setPlansDir(String plansDir) { this.plansDir = plansDir; }
  }
}
