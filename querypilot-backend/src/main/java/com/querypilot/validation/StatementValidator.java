package com.querypilot.validation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.querypilot.model.RetrievalContext;
import com.querypilot.model.RiskLevel;
import com.querypilot.model.Severity;
import com.querypilot.model.ValidationIssue;
import com.querypilot.model.ValidationResult;
import com.querypilot.schema.SchemaProvider;
import com.querypilot.schema.SchemaSnapshot;
import com.querypilot.sql.StatementAnalyzer;
import com.querypilot.util.Digests;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the validation layers in order.
 *
 * <p>Security layers run first, one after another, and stop validation at the first critical finding.
 * The remaining layers are independent and run concurrently on the stage executor. Results are cached by
 * statement hash and schema version.
 */
@Slf4j
public class StatementValidator {

    private final SchemaProvider schemaProvider;
    private final StatementAnalyzer analyzer;
    private final List<ValidationLayer> securityLayers;
    private final List<ValidationLayer> analysisLayers;
    private final Executor executor;
    private final Cache<String, ValidationResult> cache;

    public StatementValidator(SchemaProvider schemaProvider, StatementAnalyzer analyzer,
                              List<ValidationLayer> securityLayers, List<ValidationLayer> analysisLayers,
                              Executor executor, long cacheSize) {
        this.schemaProvider = schemaProvider;
        this.analyzer = analyzer;
        this.securityLayers = List.copyOf(securityLayers);
        this.analysisLayers = List.copyOf(analysisLayers);
        this.executor = executor;
        this.cache = Caffeine.newBuilder().maximumSize(cacheSize).build();
        schemaProvider.onVersionChange(snapshot -> {
            log.info("Schema version changed, clearing validation cache (version={})", snapshot.version());
            cache.invalidateAll();
        });
    }

    public ValidationResult validate(String statement, RetrievalContext context) {
        String adjusted = adjust(statement);
        SchemaSnapshot schema = schemaProvider.snapshot();
        String key = Digests.sha256Hex(adjusted) + ":" + schema.version();
        ValidationResult cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Validation cache hit (key={})", key);
            return cached;
        }

        ValidationResult result = runLayers(adjusted, schema, context);
        cache.put(key, result);
        if (!result.passed()) {
            log.info("Statement failed validation (rules={}, critical={})",
                    result.issues().stream().filter(i -> i.severity().isBlocking()).map(ValidationIssue::ruleId).distinct().toList(),
                    result.hasCritical());
        }
        return result;
    }

    private ValidationResult runLayers(String statement, SchemaSnapshot schema, RetrievalContext context) {
        ValidationInput input = new ValidationInput(statement, analyzer.analyze(statement), schema, context);
        List<ValidationIssue> issues = new ArrayList<>();

        for (ValidationLayer layer : securityLayers) {
            issues.addAll(layer.check(input).issues());
            if (issues.stream().anyMatch(i -> i.severity() == Severity.CRITICAL)) {
                return new ValidationResult(issues, statement, RiskLevel.LOW);
            }
        }

        List<CompletableFuture<LayerResult>> futures = analysisLayers.stream()
                .map(layer -> CompletableFuture.supplyAsync(() -> layer.check(input), executor))
                .toList();
        RiskLevel risk = RiskLevel.LOW;
        for (CompletableFuture<LayerResult> future : futures) {
            LayerResult layerResult;
            try {
                layerResult = future.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw e;
            }
            issues.addAll(layerResult.issues());
            if (layerResult.risk() != null && layerResult.risk().atLeast(risk)) {
                risk = layerResult.risk();
            }
        }
        return new ValidationResult(issues, statement, risk);
    }

    /**
     * Trim whitespace and trailing semicolons. Anything after an inner semicolon is left for the injection layer.
     */
    static String adjust(String statement) {
        String s = statement == null ? "" : statement.strip();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).stripTrailing();
        }
        return s;
    }
}
