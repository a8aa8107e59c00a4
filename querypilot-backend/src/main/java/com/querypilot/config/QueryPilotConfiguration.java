package com.querypilot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.querypilot.cache.ResponseCache;
import com.querypilot.execution.CircuitBreaker;
import com.querypilot.execution.ExecutionGuard;
import com.querypilot.execution.HikariSqlExceptionOverride;
import com.querypilot.execution.JdbcStatementExecutor;
import com.querypilot.execution.StatementExecutor;
import com.querypilot.generation.GenerationController;
import com.querypilot.generation.GenerativeBackend;
import com.querypilot.generation.OllamaGenerativeBackend;
import com.querypilot.generation.PromptBuilder;
import com.querypilot.generation.RateLimiter;
import com.querypilot.generation.StatementExtractor;
import com.querypilot.intent.ClarificationBuilder;
import com.querypilot.intent.ComparatorExtractor;
import com.querypilot.intent.DateExtractor;
import com.querypilot.intent.IntentAnalyzer;
import com.querypilot.intent.MetricExtractor;
import com.querypilot.intent.NumberExtractor;
import com.querypilot.intent.TableHintExtractor;
import com.querypilot.orchestration.AnswerSynthesizer;
import com.querypilot.orchestration.QueryOrchestrator;
import com.querypilot.retrieval.CachingEmbeddingService;
import com.querypilot.retrieval.ContextRetriever;
import com.querypilot.retrieval.EmbeddingService;
import com.querypilot.retrieval.HashingEmbeddingService;
import com.querypilot.retrieval.InMemoryVectorStore;
import com.querypilot.retrieval.SchemaIndexer;
import com.querypilot.retrieval.TokenEstimator;
import com.querypilot.retrieval.VectorStore;
import com.querypilot.schema.JdbcSchemaProvider;
import com.querypilot.schema.SchemaProvider;
import com.querypilot.session.ConversationStore;
import com.querypilot.sql.StatementAnalyzer;
import com.querypilot.util.MdcTaskDecorator;
import com.querypilot.validation.ComplexityCheck;
import com.querypilot.validation.CostCheck;
import com.querypilot.validation.CostEstimator;
import com.querypilot.validation.InjectionCheck;
import com.querypilot.validation.OperationAllowListCheck;
import com.querypilot.validation.SchemaExistenceCheck;
import com.querypilot.validation.StatementValidator;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;

/**
 * Wires the pipeline. Stateful services (circuit breaker, caches, sessions) are singletons created here.
 */
@Configuration
public class QueryPilotConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Stage tasks: intent analysis, embedding prefetch and the concurrent validation layers. Tasks here never wait
     * on other tasks of this pool.
     */
    @Bean
    public AsyncTaskExecutor pipelineExecutor(QueryPilotProperties properties) {
        QueryPilotProperties.Pipeline pipeline = properties.getPipeline();
        return executor("pipeline-", pipeline.getThreads(), pipeline.getQueueCapacity());
    }

    /**
     * External calls made under a {@link com.querypilot.util.Deadline}: embedding, vector search and generation.
     */
    @Bean
    public AsyncTaskExecutor externalCallExecutor(QueryPilotProperties properties) {
        QueryPilotProperties.Pipeline pipeline = properties.getPipeline();
        return executor("external-call-", pipeline.getCallThreads(), pipeline.getCallQueueCapacity());
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DataSource dataSource(QueryPilotProperties properties) {
        QueryPilotProperties.Datasource ds = properties.getDatasource();
        HikariConfig config = new HikariConfig();
        config.setPoolName("querypilot-target");
        config.setJdbcUrl(ds.getUrl());
        config.setUsername(ds.getUsername());
        config.setPassword(ds.getPassword());
        config.setMaximumPoolSize(ds.getMaximumPoolSize());
        config.setMinimumIdle(0);
        config.setConnectionTimeout(ds.getConnectionTimeout().toMillis());
        config.setReadOnly(ds.isReadOnly());
        config.setAutoCommit(false);
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        // fail on first use, not at startup, so the service can report itself as degraded
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }

    @Bean
    public SchemaProvider schemaProvider(DataSource dataSource, QueryPilotProperties properties, Clock clock) {
        QueryPilotProperties.Datasource ds = properties.getDatasource();
        return new JdbcSchemaProvider(dataSource, ds.getSchema(), ds.getRowCountHints(),
                properties.getValidation().getSchemaTtl(), clock);
    }

    @Bean
    public StatementAnalyzer statementAnalyzer() {
        return new StatementAnalyzer();
    }

    @Bean
    public IntentAnalyzer intentAnalyzer(SchemaProvider schemaProvider, Clock clock) {
        return new IntentAnalyzer(List.of(
                new DateExtractor(),
                new NumberExtractor(),
                new ComparatorExtractor(),
                new TableHintExtractor(() -> schemaProvider.snapshot().tableNames()),
                new MetricExtractor()), clock);
    }

    @Bean
    public ClarificationBuilder clarificationBuilder(SchemaProvider schemaProvider) {
        return new ClarificationBuilder(() -> schemaProvider.snapshot().tableNames());
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingService embeddingService(QueryPilotProperties properties) {
        QueryPilotProperties.Retrieval retrieval = properties.getRetrieval();
        return new CachingEmbeddingService(new HashingEmbeddingService(retrieval.getEmbeddingDimensions()),
                retrieval.getEmbeddingCacheSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public VectorStore vectorStore() {
        return new InMemoryVectorStore();
    }

    @Bean
    public SchemaIndexer schemaIndexer(EmbeddingService embeddingService, VectorStore vectorStore,
                                       QueryPilotProperties properties, ResourceLoader resourceLoader,
                                       ObjectMapper objectMapper) {
        String location = properties.getRetrieval().getKnowledgeLocation();
        return new SchemaIndexer(embeddingService, vectorStore,
                SchemaIndexer.loadKnowledge(resourceLoader.getResource(location), objectMapper));
    }

    @Bean
    public ContextRetriever contextRetriever(EmbeddingService embeddingService, VectorStore vectorStore,
                                             SchemaProvider schemaProvider, SchemaIndexer schemaIndexer,
                                             QueryPilotProperties properties,
                                             @Qualifier("externalCallExecutor") AsyncTaskExecutor externalCallExecutor) {
        QueryPilotProperties.Retrieval retrieval = properties.getRetrieval();
        return new ContextRetriever(embeddingService, vectorStore, schemaProvider, schemaIndexer,
                new TokenEstimator(retrieval.getTokenizerEncoding(), retrieval.getCharsPerToken()), retrieval,
                externalCallExecutor, properties.getPipeline().getEmbeddingTimeout(),
                properties.getPipeline().getVectorSearchTimeout());
    }

    @Bean
    public StatementValidator statementValidator(SchemaProvider schemaProvider, StatementAnalyzer statementAnalyzer,
                                                 QueryPilotProperties properties,
                                                 @Qualifier("pipelineExecutor") AsyncTaskExecutor pipelineExecutor) {
        QueryPilotProperties.Validation validation = properties.getValidation();
        return new StatementValidator(schemaProvider, statementAnalyzer,
                List.of(new InjectionCheck(), new OperationAllowListCheck()),
                List.of(new SchemaExistenceCheck(),
                        new ComplexityCheck(validation.getMaxJoins(), validation.getMaxSubqueryDepth(),
                                validation.getMaxUnions()),
                        new CostCheck(new CostEstimator(validation.getLargeTableRows()))),
                pipelineExecutor, validation.getCacheSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerativeBackend generativeBackend(ObjectMapper objectMapper, Environment environment) {
        return new OllamaGenerativeBackend(objectMapper, environment);
    }

    @Bean
    public GenerationController generationController(GenerativeBackend generativeBackend,
                                                     StatementAnalyzer statementAnalyzer,
                                                     StatementValidator statementValidator,
                                                     SchemaProvider schemaProvider, QueryPilotProperties properties,
                                                     @Qualifier("externalCallExecutor")
                                                     AsyncTaskExecutor externalCallExecutor) {
        QueryPilotProperties.Generation generation = properties.getGeneration();
        return new GenerationController(generativeBackend, new PromptBuilder(generation.getDialect()),
                new StatementExtractor(), statementAnalyzer, statementValidator, schemaProvider,
                new RateLimiter(generation.getRateLimitRequests(), generation.getRateLimitPeriod()), generation,
                externalCallExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public StatementExecutor statementExecutor(DataSource dataSource, QueryPilotProperties properties) {
        QueryPilotProperties.Execution execution = properties.getExecution();
        return new JdbcStatementExecutor(dataSource, execution.getBatchSize(), execution.getHardCap(),
                execution.getLockTimeout());
    }

    @Bean
    public CircuitBreaker circuitBreaker(QueryPilotProperties properties, Clock clock) {
        QueryPilotProperties.Execution execution = properties.getExecution();
        return new CircuitBreaker(execution.getFailureThreshold(), execution.getCoolDown(),
                execution.getHalfOpenSuccesses(), clock);
    }

    @Bean
    public ExecutionGuard executionGuard(StatementExecutor statementExecutor, CircuitBreaker circuitBreaker,
                                         QueryPilotProperties properties) {
        QueryPilotProperties.Execution execution = properties.getExecution();
        return new ExecutionGuard(statementExecutor, circuitBreaker, new ExecutionGuard.FetchPolicy(
                execution.getMaxRetries(), execution.getInitialBackoff(), execution.getMaxBackoff(),
                execution.getStatementTimeout(), execution.getCountTimeout(), execution.getBatchSize(),
                execution.getHardCap(), execution.getLargeResultCeiling()));
    }

    @Bean
    public ResponseCache responseCache(SchemaProvider schemaProvider, QueryPilotProperties properties) {
        QueryPilotProperties.Cache cache = properties.getCache();
        return new ResponseCache(cache.getTtl(), cache.getMaxEntries(), Ticker.systemTicker()).bindTo(schemaProvider);
    }

    @Bean(destroyMethod = "close")
    public ConversationStore conversationStore(QueryPilotProperties properties, Clock clock) {
        QueryPilotProperties.Session session = properties.getSession();
        return new ConversationStore(session.getMaxHistory(), session.getIdleTimeout(), session.getCleanupInterval(),
                clock);
    }

    @Bean
    public QueryOrchestrator queryOrchestrator(IntentAnalyzer intentAnalyzer, ClarificationBuilder clarificationBuilder,
                                               ContextRetriever contextRetriever,
                                               GenerationController generationController,
                                               ExecutionGuard executionGuard, ResponseCache responseCache,
                                               ConversationStore conversationStore, SchemaProvider schemaProvider,
                                               @Qualifier("pipelineExecutor") AsyncTaskExecutor pipelineExecutor,
                                               QueryPilotProperties properties,
                                               Clock clock) {
        return new QueryOrchestrator(intentAnalyzer, clarificationBuilder, contextRetriever, generationController,
                executionGuard, new AnswerSynthesizer(), responseCache, conversationStore, schemaProvider,
                pipelineExecutor, properties, clock);
    }
}
