package com.querypilot.generation;

import com.querypilot.config.QueryPilotProperties;
import com.querypilot.error.ErrorKind;
import com.querypilot.error.QueryPilotException;
import com.querypilot.model.ComplexityTier;
import com.querypilot.model.GeneratedStatement;
import com.querypilot.model.Query;
import com.querypilot.model.RetrievalContext;
import com.querypilot.model.Severity;
import com.querypilot.model.ValidationIssue;
import com.querypilot.model.ValidationResult;
import com.querypilot.schema.SchemaProvider;
import com.querypilot.session.ConversationTurn;
import com.querypilot.sql.StatementAnalyzer;
import com.querypilot.sql.StatementStructure;
import com.querypilot.util.Deadline;
import com.querypilot.validation.SchemaExistenceCheck;
import com.querypilot.validation.StatementValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Drives prompt, completion, extraction and validation for one query.
 *
 * <p>The loop is sequential and bounded by the configured maximum attempts. Only unknown tables or columns
 * lead to another attempt, with a correction section describing the problem. Security findings end the loop
 * immediately.
 */
@Slf4j
public class GenerationController {

    private static final List<String> REPHRASE = List.of(
            "Rephrase the question using table or column names", "Ask about one subject at a time");

    private final GenerativeBackend backend;
    private final PromptBuilder promptBuilder;
    private final StatementExtractor extractor;
    private final StatementAnalyzer analyzer;
    private final StatementValidator validator;
    private final SchemaProvider schemaProvider;
    private final RateLimiter rateLimiter;
    private final QueryPilotProperties.Generation settings;
    private final AsyncTaskExecutor executor;

    public GenerationController(GenerativeBackend backend, PromptBuilder promptBuilder, StatementExtractor extractor,
                                StatementAnalyzer analyzer, StatementValidator validator, SchemaProvider schemaProvider,
                                RateLimiter rateLimiter, QueryPilotProperties.Generation settings,
                                AsyncTaskExecutor executor) {
        if (settings.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.backend = backend;
        this.promptBuilder = promptBuilder;
        this.extractor = extractor;
        this.analyzer = analyzer;
        this.validator = validator;
        this.schemaProvider = schemaProvider;
        this.rateLimiter = rateLimiter;
        this.settings = settings;
        this.executor = executor;
    }

    public GenerationOutcome generate(Query query, RetrievalContext context, List<ConversationTurn> recentTurns,
                                      Deadline deadline) {
        GenerationAttemptState state = GenerationAttemptState.initial();
        while (state.attempt() < settings.getMaxAttempts()) {
            state = state.nextAttempt();
            int attempt = state.attempt();
            boolean canRetry = attempt < settings.getMaxAttempts();

            String completion;
            try {
                if (!rateLimiter.tryAcquire(deadline.remaining())) {
                    return GenerationOutcome.failure(ErrorKind.RATE_LIMITED, "Too many generation requests",
                            List.of("Retry in a moment"), attempt);
                }
                String prompt = promptBuilder.build(query.rawText(), context, recentTurns, state.lastError());
                completion = deadline.call("generation", executor,
                        () -> backend.generate(prompt, settings.getStopSequences(), settings.getMaxOutputTokens(),
                                settings.getTemperature()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return GenerationOutcome.failure(ErrorKind.TIMEOUT, "Generation was interrupted", List.of(), attempt);
            } catch (QueryPilotException e) {
                log.warn("Generation attempt failed (query_id={}, attempt={}, kind={}, reason={})",
                        query.id(), attempt, e.getKind(), e.getMessage());
                return GenerationOutcome.failure(e.getKind(), e.getMessage(), e.getSuggestions(), attempt);
            }

            StatementExtractor.Extraction extraction = extractor.extract(completion);
            if (extraction.noSql()) {
                return GenerationOutcome.failure(ErrorKind.GENERATION_FAILED,
                        "The question cannot be answered from the available schema", REPHRASE, attempt);
            }
            if (extraction.statement().isEmpty()) {
                log.info("Completion contained no statement (query_id={}, attempt={})", query.id(), attempt);
                return GenerationOutcome.failure(ErrorKind.GENERATION_FAILED,
                        "No statement could be generated for this question", REPHRASE, attempt);
            }

            String statement = extraction.statement().get();
            StatementStructure structure = analyzer.analyze(statement);

            List<String> missing = structure.tables().stream()
                    .filter(table -> !schemaProvider.tableExists(table))
                    .toList();
            if (!missing.isEmpty()) {
                String problem = missing.stream()
                        .map(t -> "table " + t + " not found; valid candidates: " + candidates(t, context))
                        .collect(Collectors.joining("; "));
                log.info("Generated statement references unknown tables (query_id={}, attempt={}, tables={})",
                        query.id(), attempt, missing);
                state = state.rejected(problem);
                if (!canRetry) {
                    return GenerationOutcome.failure(ErrorKind.GENERATION_FAILED,
                            "The generated query kept referring to unknown tables: " + String.join(", ", missing),
                            suggestionsFor(missing, context), attempt);
                }
                continue;
            }

            ValidationResult validation = validator.validate(statement, context);
            if (validation.hasCritical()) {
                return GenerationOutcome.failure(ErrorKind.SECURITY_VIOLATION,
                        "The generated query was blocked by security checks",
                        List.of("Ask a read-only question"), attempt);
            }
            if (!validation.passed()) {
                if (validation.onlyBlockedBy(SchemaExistenceCheck.RULE_ID)) {
                    state = state.rejected(describe(validation));
                    if (canRetry) {
                        continue;
                    }
                    return GenerationOutcome.failure(ErrorKind.GENERATION_FAILED,
                            "The generated query kept referring to unknown schema objects: " + describe(validation),
                            blockingSuggestions(validation), attempt);
                }
                return GenerationOutcome.failure(ErrorKind.VALIDATION_FAILED, describe(validation),
                        blockingSuggestions(validation), attempt);
            }

            ComplexityTier tier = complexity(structure);
            GeneratedStatement generated = new GeneratedStatement(validation.statement(), settings.getDialect(), tier,
                    structure.tables(), attempt, confidence(structure, context, tier));
            log.info("Statement generated (query_id={}, attempt={}, complexity={}, confidence={})",
                    query.id(), attempt, tier, String.format("%.2f", generated.confidence()));
            return GenerationOutcome.success(generated, validation);
        }
        // unreachable while maxAttempts >= 1: every path in the last attempt returns
        return GenerationOutcome.failure(ErrorKind.GENERATION_FAILED, "Generation attempts exhausted", REPHRASE,
                state.attempt());
    }

    static ComplexityTier complexity(StatementStructure s) {
        if (s.joinCount() >= 3 || s.subqueryCount() >= 2 || s.maxSubqueryDepth() >= 2 || s.hasWindow()) {
            return ComplexityTier.COMPLEX;
        }
        if (s.joinCount() >= 1 || s.subqueryCount() == 1 || s.unionCount() >= 1) {
            return ComplexityTier.MODERATE;
        }
        return ComplexityTier.SIMPLE;
    }

    /**
     * Weighted blend of schema-match ratio, average context similarity and a complexity factor.
     */
    double confidence(StatementStructure structure, RetrievalContext context, ComplexityTier tier) {
        List<String> tables = structure.tables();
        double matchRatio = tables.isEmpty() ? 1.0d
                : tables.stream().filter(schemaProvider::tableExists).count() / (double) tables.size();
        double similarity = Math.max(0.0d, Math.min(1.0d, context.averageScore()));
        double simplicity = switch (tier) {
            case SIMPLE -> 1.0d;
            case MODERATE -> 0.7d;
            case COMPLEX -> 0.4d;
        };
        return Math.min(1.0d, 0.5d * matchRatio + 0.3d * similarity + 0.2d * simplicity);
    }

    /**
     * Similar table names, or the tables retrieved for the question when nothing looks alike.
     */
    private List<String> similarTables(String table, RetrievalContext context) {
        List<String> similar = schemaProvider.suggestSimilar(table);
        return similar.isEmpty() ? context.tableNames() : similar;
    }

    private String candidates(String table, RetrievalContext context) {
        List<String> similar = similarTables(table, context);
        return similar.isEmpty() ? "none" : String.join(", ", similar);
    }

    private List<String> suggestionsFor(List<String> missing, RetrievalContext context) {
        List<String> suggestions = new ArrayList<>();
        for (String table : missing) {
            similarTables(table, context).forEach(s -> suggestions.add("Did you mean " + s + "?"));
        }
        suggestions.addAll(REPHRASE);
        return suggestions;
    }

    private static String describe(ValidationResult validation) {
        return validation.issues().stream()
                .filter(issue -> issue.severity().isBlocking())
                .map(issue -> issue.suggestions().isEmpty()
                        ? issue.message()
                        : issue.message() + "; valid candidates: " + String.join(", ", issue.suggestions()))
                .collect(Collectors.joining("; "));
    }

    private static List<String> blockingSuggestions(ValidationResult validation) {
        return validation.issues().stream()
                .filter(issue -> issue.severity() == Severity.ERROR)
                .map(ValidationIssue::suggestions)
                .flatMap(List::stream)
                .distinct()
                .map(s -> "Did you mean " + s + "?")
                .toList();
    }
}
