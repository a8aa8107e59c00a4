package com.querypilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for every pipeline stage, bound from {@code querypilot.*}.
 */
@Data
@ConfigurationProperties(prefix = "querypilot")
public class QueryPilotProperties {

    private Pipeline pipeline = new Pipeline();
    private Intent intent = new Intent();
    private Retrieval retrieval = new Retrieval();
    private Generation generation = new Generation();
    private Validation validation = new Validation();
    private Execution execution = new Execution();
    private Cache cache = new Cache();
    private Session session = new Session();
    private Datasource datasource = new Datasource();

    @Data
    public static class Pipeline {
        private Duration requestTimeout = Duration.ofSeconds(60);
        private Duration embeddingTimeout = Duration.ofSeconds(5);
        private Duration vectorSearchTimeout = Duration.ofSeconds(5);
        private int threads = 8;
        private int queueCapacity = 100;
        /** Threads for embedding, vector search and generation calls; separate from the stage threads. */
        private int callThreads = 16;
        private int callQueueCapacity = 200;
    }

    @Data
    public static class Intent {
        private double confidenceThreshold = 0.7d;
        private int maxQueryLength = 1000;
    }

    @Data
    public static class Retrieval {
        private int simpleTopK = 5;
        private int defaultTopK = 10;
        private int complexTopK = 15;
        private double similarityThreshold = 0.2d;
        private int maxTables = 5;
        private int maxExamples = 2;
        private int maxRules = 3;
        private int tokenBudget = 2000;
        private int promptOverheadTokens = 400;
        private String tokenizerEncoding = "cl100k_base";
        private int charsPerToken = 4;
        private int embeddingDimensions = 384;
        private long embeddingCacheSize = 1000;
        private String knowledgeLocation = "classpath:querypilot/knowledge.json";
    }

    @Data
    public static class Generation {
        private int maxAttempts = 2;
        private int maxOutputTokens = 512;
        private double temperature = 0.0d;
        private List<String> stopSequences = new ArrayList<>(List.of("\n\n\n", "```\n\n", "Question:"));
        private String dialect = "postgresql";
        private int historyTurns = 3;
        private int rateLimitRequests = 30;
        private Duration rateLimitPeriod = Duration.ofMinutes(1);
    }

    @Data
    public static class Validation {
        private int maxJoins = 4;
        private int maxSubqueryDepth = 3;
        private int maxUnions = 3;
        private long largeTableRows = 1_000_000L;
        private long cacheSize = 500;
        private Duration schemaTtl = Duration.ofHours(1);
    }

    @Data
    public static class Execution {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);
        private int halfOpenSuccesses = 2;
        private int maxRetries = 2;
        private Duration initialBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private Duration statementTimeout = Duration.ofSeconds(30);
        private Duration countTimeout = Duration.ofSeconds(5);
        private Duration lockTimeout = Duration.ofSeconds(5);
        private int batchSize = 100;
        private int hardCap = 1000;
        private long largeResultCeiling = 10_000L;
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofMinutes(10);
        private long maxEntries = 500;
    }

    @Data
    public static class Session {
        private int maxHistory = 10;
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Datasource {
        private String url;
        private String username;
        private String password;
        private String schema;
        private int maximumPoolSize = 5;
        private Duration connectionTimeout = Duration.ofSeconds(2);
        private boolean readOnly = true;
        /**
         * Row counts for tables whose statistics the driver does not expose.
         */
        private Map<String, Long> rowCountHints = new HashMap<>();
    }
}
