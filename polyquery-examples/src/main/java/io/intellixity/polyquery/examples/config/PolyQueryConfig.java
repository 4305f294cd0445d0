package io.intellixity.polyquery.examples.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.polyquery.cache.ResultCache;
import io.intellixity.polyquery.controller.PlanTextGenerator;
import io.intellixity.polyquery.controller.QueryController;
import io.intellixity.polyquery.controller.QueryPlanner;
import io.intellixity.polyquery.controller.ResultSummarizer;
import io.intellixity.polyquery.controller.TextQueryPlanner;
import io.intellixity.polyquery.examples.offline.DirectoryPlanTextGenerator;
import io.intellixity.polyquery.examples.offline.TabularSummarizer;
import io.intellixity.polyquery.jdbc.JdbcHandle;
import io.intellixity.polyquery.jdbc.JdbcStoreAdapter;
import io.intellixity.polyquery.merge.ResultMerger;
import io.intellixity.polyquery.mongo.MongoHandle;
import io.intellixity.polyquery.mongo.MongoStoreAdapter;
import io.intellixity.polyquery.neo4j.Neo4jHandle;
import io.intellixity.polyquery.neo4j.Neo4jStoreAdapter;
import io.intellixity.polyquery.pipeline.PipelineExecutor;
import io.intellixity.polyquery.pipeline.StoreAdapterRegistry;
import io.intellixity.polyquery.plan.PlanAcquisitionException;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.spi.StoreAdapter;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(PolyQueryProperties.class)
public class PolyQueryConfig {
  private static final Logger log = LoggerFactory.getLogger(PolyQueryConfig.class);

  // --- Relational ---

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "polyquery.relational", name = "jdbc-url")
  public HikariDataSource relationalDataSource(PolyQueryProperties props) {
    PolyQueryProperties.Relational r = props.getRelational();
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(r.getJdbcUrl());
    hc.setUsername(r.getUsername());
    hc.setPassword(r.getPassword());
    if (r.getSchema() != null && !r.getSchema().isBlank()) hc.setSchema(r.getSchema());
    hc.setMaximumPoolSize(r.getMaximumPoolSize());
    hc.setReadOnly(true);
    return new HikariDataSource(hc);
  }

  @Bean
  @ConditionalOnProperty(prefix = "polyquery.relational", name = "jdbc-url")
  public JdbcStoreAdapter jdbcStoreAdapter(HikariDataSource relationalDataSource, PolyQueryProperties props) {
    return new JdbcStoreAdapter(new JdbcHandle("postgresql", relationalDataSource, props.getRelational().getSchema()));
  }

  // --- Document ---

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "polyquery.document", name = "uri")
  public MongoClient documentClient(PolyQueryProperties props) {
    return MongoClients.create(props.getDocument().getUri());
  }

  @Bean
  @ConditionalOnProperty(prefix = "polyquery.document", name = "uri")
  public MongoStoreAdapter mongoStoreAdapter(MongoClient documentClient, PolyQueryProperties props) {
    String db = props.getDocument().getDatabase();
    if (db == null || db.isBlank()) throw new IllegalArgumentException("polyquery.document.database is required");
    return new MongoStoreAdapter(new MongoHandle("mongodb", documentClient, db));
  }

  // --- Graph ---

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "polyquery.graph", name = "uri")
  public Driver graphDriver(PolyQueryProperties props) {
    PolyQueryProperties.Graph g = props.getGraph();
    AuthToken auth = (g.getUsername() == null || g.getUsername().isBlank())
        ? AuthTokens.none()
        : AuthTokens.basic(g.getUsername(), g.getPassword());
    return GraphDatabase.driver(g.getUri(), auth);
  }

  @Bean
  @ConditionalOnProperty(prefix = "polyquery.graph", name = "uri")
  public Neo4jStoreAdapter neo4jStoreAdapter(Driver graphDriver, PolyQueryProperties props) {
    return new Neo4jStoreAdapter(new Neo4jHandle("neo4j", graphDriver, props.getGraph().getDatabase()));
  }

  // --- Pipeline ---

  @Bean
  public StoreAdapterRegistry storeAdapterRegistry(ObjectProvider<StoreAdapter> adapters) {
    StoreAdapterRegistry registry = new StoreAdapterRegistry(adapters.orderedStream().toList());
    log.info("polyquery.config adapters relational={} document={} graph={}",
        registry.supports(StoreKind.RELATIONAL),
        registry.supports(StoreKind.DOCUMENT),
        registry.supports(StoreKind.GRAPH));
    return registry;
  }

  @Bean
  public PipelineExecutor pipelineExecutor(StoreAdapterRegistry registry) {
    return new PipelineExecutor(registry);
  }

  @Bean
  public ResultCache resultCache(PolyQueryProperties props) {
    return new ResultCache(props.getCache().getMaxEntries(), props.getCache().getTtl());
  }

  @Bean
  public PlanTextGenerator planTextGenerator(PolyQueryProperties props) {
    String dir = props.getPlanner().getPlansDir();
    if (dir == null || dir.isBlank()) {
      return (text, feedback) -> { throw new PlanAcquisitionException("polyquery.planner.plans-dir is not set"); };
    }
    return new DirectoryPlanTextGenerator(Path.of(dir));
  }

  @Bean
  public QueryPlanner queryPlanner(PlanTextGenerator planTextGenerator) {
    return new TextQueryPlanner(planTextGenerator);
  }

  @Bean
  public ResultSummarizer resultSummarizer() {
    return new TabularSummarizer(20);
  }

  @Bean
  public QueryController queryController(QueryPlanner queryPlanner,
                                         PipelineExecutor pipelineExecutor,
                                         ResultCache resultCache,
                                         ResultSummarizer resultSummarizer,
                                         PolyQueryProperties props) {
    return new QueryController(queryPlanner, pipelineExecutor, resultCache, new ResultMerger(),
        resultSummarizer, props.getRetry().getMaxRetries());
  }
}
