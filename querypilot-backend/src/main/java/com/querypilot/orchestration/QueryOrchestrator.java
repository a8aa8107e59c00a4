package com.querypilot.orchestration;

import com.querypilot.cache.Fingerprint;
import com.querypilot.cache.ResponseCache;
import com.querypilot.config.QueryPilotProperties;
import com.querypilot.error.ErrorKind;
import com.querypilot.error.QueryPilotException;
import com.querypilot.execution.ExecutionGuard;
import com.querypilot.generation.GenerationController;
import com.querypilot.generation.GenerationOutcome;
import com.querypilot.intent.ClarificationBuilder;
import com.querypilot.intent.IntentAnalysis;
import com.querypilot.intent.IntentAnalyzer;
import com.querypilot.model.ErrorClass;
import com.querypilot.model.ExecutionResult;
import com.querypilot.model.GeneratedStatement;
import com.querypilot.model.Query;
import com.querypilot.model.QueryResponse;
import com.querypilot.model.RetrievalContext;
import com.querypilot.model.Severity;
import com.querypilot.retrieval.ContextRetriever;
import com.querypilot.schema.SchemaProvider;
import com.querypilot.session.ConversationStore;
import com.querypilot.session.ConversationTurn;
import com.querypilot.session.Session;
import com.querypilot.util.Deadline;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one question through intent analysis, retrieval, generation, validation and execution.
 *
 * <p>Every request is independent. Shared state (cache, sessions, circuit) lives in the injected services.
 * The session history is appended only once an answer is final.
 */
@Slf4j
public class QueryOrchestrator {

    private final IntentAnalyzer intentAnalyzer;
    private final ClarificationBuilder clarificationBuilder;
    private final ContextRetriever contextRetriever;
    private final GenerationController generationController;
    private final ExecutionGuard executionGuard;
    private final AnswerSynthesizer answerSynthesizer;
    private final ResponseCache responseCache;
    private final ConversationStore conversationStore;
    private final SchemaProvider schemaProvider;
    private final AsyncTaskExecutor executor;
    private final QueryPilotProperties properties;
    private final Clock clock;

    public QueryOrchestrator(IntentAnalyzer intentAnalyzer, ClarificationBuilder clarificationBuilder,
                             ContextRetriever contextRetriever, GenerationController generationController,
                             ExecutionGuard executionGuard, AnswerSynthesizer answerSynthesizer,
                             ResponseCache responseCache, ConversationStore conversationStore,
                             SchemaProvider schemaProvider, AsyncTaskExecutor executor,
                             QueryPilotProperties properties, Clock clock) {
        this.intentAnalyzer = intentAnalyzer;
        this.clarificationBuilder = clarificationBuilder;
        this.contextRetriever = contextRetriever;
        this.generationController = generationController;
        this.executionGuard = executionGuard;
        this.answerSynthesizer = answerSynthesizer;
        this.responseCache = responseCache;
        this.conversationStore = conversationStore;
        this.schemaProvider = schemaProvider;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Process one question.
     *
     * @param queryText question as typed
     * @param sessionId conversation id, or null to start a new one
     * @return answer, clarification or failure
     * @throws QueryPilotException with {@link ErrorKind#INVALID_INPUT} for empty or oversized text
     */
    public PipelineOutcome process(String queryText, String sessionId) {
        validateInput(queryText);

        String queryId = UUID.randomUUID().toString();
        String effectiveSession = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        long start = System.nanoTime();
        Deadline deadline = Deadline.after(properties.getPipeline().getRequestTimeout());
        Map<String, Long> timings = new LinkedHashMap<>();

        try {
            return run(queryId, effectiveSession, queryText, deadline, start, timings);
        } catch (QueryPilotException e) {
            log.warn("Request failed (query_id={}, kind={}, reason={})", queryId, e.getKind(), e.getMessage());
            return new PipelineOutcome.Failed(queryId, effectiveSession, e.getKind(), e.getMessage(),
                    e.getSuggestions());
        } catch (RuntimeException e) {
            log.error("Unexpected pipeline error (query_id={}, trace_id={})", queryId, MDC.get("trace_id"), e);
            return new PipelineOutcome.Failed(queryId, effectiveSession, ErrorKind.INTERNAL_ERROR,
                    "An internal error occurred", List.of("Retry the request", "Contact support with the trace id"));
        }
    }

    private PipelineOutcome run(String queryId, String sessionId, String queryText, Deadline deadline, long start,
                                Map<String, Long> timings) {
        Session session = conversationStore.getOrCreate(sessionId);
        List<ConversationTurn> turns = session.history();
        List<Query> history = turns.stream().map(ConversationTurn::query).toList();

        long stage = System.nanoTime();
        CompletableFuture<Void> prefetch = CompletableFuture.runAsync(
                () -> contextRetriever.prefetch(queryText), executor);
        CompletableFuture<IntentAnalysis> intentFuture = CompletableFuture.supplyAsync(
                () -> intentAnalyzer.analyze(queryId, sessionId, queryText, history), executor);
        IntentAnalysis analysis = await(intentFuture, "intent analysis", deadline);
        Query query = analysis.query();
        timings.put("intent", elapsedMs(stage));

        // follow-ups depend on the conversation, so their text alone is not a valid cache key
        Fingerprint fingerprint = Fingerprint.of(queryText, schemaProvider.schemaVersion());
        if (!analysis.followUp()) {
            Optional<QueryResponse> cached = responseCache.get(fingerprint);
            if (cached.isPresent()) {
                prefetch.cancel(false);
                QueryResponse hit = cached.get().asCacheHit(queryId, elapsedMs(start));
                session.append(new ConversationTurn(query, hit), clock.instant());
                log.info("Answered from cache (query_id={}, session_id={})", queryId, sessionId);
                return new PipelineOutcome.Answered(queryId, sessionId, hit, hit.warnings());
            }
        }

        double threshold = properties.getIntent().getConfidenceThreshold();
        if (query.confidence() < threshold) {
            prefetch.cancel(false);
            List<String> questions = clarificationBuilder.questionsFor(query);
            log.info("Asking for clarification (query_id={}, intent={}, confidence={})",
                    queryId, query.intent(), String.format("%.2f", query.confidence()));
            return new PipelineOutcome.Clarification(queryId, sessionId, query.intent(), query.confidence(),
                    questions);
        }

        // runs on the request thread; only its external calls go to the call executor
        stage = System.nanoTime();
        RetrievalContext context = contextRetriever.retrieve(query, history, deadline);
        timings.put("retrieval", elapsedMs(stage));

        stage = System.nanoTime();
        int historyTurns = properties.getGeneration().getHistoryTurns();
        List<ConversationTurn> recent = turns.subList(Math.max(0, turns.size() - historyTurns), turns.size());
        GenerationOutcome generation = generationController.generate(query, context, recent, deadline);
        timings.put("generation", elapsedMs(stage));
        if (!generation.succeeded()) {
            log.info("Generation failed (query_id={}, kind={}, attempts={})",
                    queryId, generation.errorKind(), generation.attempts());
            return new PipelineOutcome.Failed(queryId, sessionId, generation.errorKind(), generation.message(),
                    generation.suggestions());
        }
        GeneratedStatement statement = generation.statement();

        stage = System.nanoTime();
        ExecutionResult result = executionGuard.execute(statement.text(), deadline);
        timings.put("execution", elapsedMs(stage));
        if (!result.success()) {
            return executionFailure(queryId, sessionId, result);
        }

        stage = System.nanoTime();
        String answer = answerSynthesizer.synthesize(result);
        timings.put("synthesis", elapsedMs(stage));

        List<String> warnings = new ArrayList<>(result.warnings());
        generation.validation().issues().stream()
                .filter(issue -> issue.severity() == Severity.WARNING)
                .forEach(issue -> warnings.add(issue.message()));
        QueryResponse response = new QueryResponse(queryId, statement.text(), result, answer, elapsedMs(start),
                false, timings, warnings);
        if (!analysis.followUp()) {
            responseCache.put(fingerprint, response);
        }
        session.append(new ConversationTurn(query, response), clock.instant());

        log.info("Answered (query_id={}, session_id={}, rows={}, latency_ms={})",
                queryId, sessionId, result.rowCount(), response.latencyMs());
        return new PipelineOutcome.Answered(queryId, sessionId, response, response.warnings());
    }

    private void validateInput(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            throw new QueryPilotException(ErrorKind.INVALID_INPUT, "Query text must not be empty",
                    List.of("Type a question about your data"));
        }
        int max = properties.getIntent().getMaxQueryLength();
        if (queryText.length() > max) {
            throw new QueryPilotException(ErrorKind.INVALID_INPUT,
                    "Query text exceeds " + max + " characters", List.of("Shorten the question"));
        }
    }

    private static PipelineOutcome executionFailure(String queryId, String sessionId, ExecutionResult result) {
        ErrorClass errorClass = result.errorClass();
        if (errorClass == ErrorClass.TRANSIENT) {
            return new PipelineOutcome.Failed(queryId, sessionId, ErrorKind.SERVICE_UNAVAILABLE, result.errorMessage(),
                    List.of("Retry in a moment"));
        }
        if (errorClass == ErrorClass.TIMEOUT) {
            return new PipelineOutcome.Failed(queryId, sessionId, ErrorKind.TIMEOUT, result.errorMessage(),
                    List.of("Add filters to narrow the result", "Retry in a moment"));
        }
        return new PipelineOutcome.Failed(queryId, sessionId, ErrorKind.EXECUTION_FAILED, result.errorMessage(),
                List.of("Rephrase the question"));
    }

    private static <T> T await(CompletableFuture<T> future, String operation, Deadline deadline) {
        try {
            return future.get(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new QueryPilotException(ErrorKind.TIMEOUT, operation + " did not finish in time",
                    List.of("Retry in a moment"));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryPilotException(ErrorKind.TIMEOUT, operation + " was interrupted", List.of(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException ? e.getCause().getCause() : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new QueryPilotException(ErrorKind.INTERNAL_ERROR, operation + " failed", List.of(), cause);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
