package com.querypilot.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;

import com.querypilot.config.QueryPilotProperties;
import com.querypilot.error.ErrorKind;
import com.querypilot.error.QueryPilotException;
import com.querypilot.model.ComplexityTier;
import com.querypilot.model.ContextElement;
import com.querypilot.model.ContextMetadata;
import com.querypilot.model.Query;
import com.querypilot.model.QueryIntent;
import com.querypilot.model.RetrievalContext;
import com.querypilot.schema.StaticSchemaProvider;
import com.querypilot.schema.TestSchemas;
import com.querypilot.sql.StatementAnalyzer;
import com.querypilot.util.Deadline;
import com.querypilot.validation.ComplexityCheck;
import com.querypilot.validation.CostCheck;
import com.querypilot.validation.CostEstimator;
import com.querypilot.validation.InjectionCheck;
import com.querypilot.validation.OperationAllowListCheck;
import com.querypilot.validation.SchemaExistenceCheck;
import com.querypilot.validation.StatementValidator;

class GenerationControllerTest {

    private static final String GOOD = "SELECT COUNT(*) FROM patients WHERE admitted_at = CURRENT_DATE - 1";

    private final StaticSchemaProvider schemaProvider = new StaticSchemaProvider(TestSchemas.hospital());
    private final StatementAnalyzer analyzer = new StatementAnalyzer();
    private final AsyncTaskExecutor executor = new TaskExecutorAdapter(Runnable::run);
    private final StatementValidator validator = new StatementValidator(schemaProvider, analyzer,
            List.of(new InjectionCheck(), new OperationAllowListCheck()),
            List.of(new SchemaExistenceCheck(), new ComplexityCheck(4, 3, 3), new CostCheck(new CostEstimator(1_000_000))),
            executor, 100);
    private final QueryPilotProperties.Generation settings = new QueryPilotProperties.Generation();

    private final Query query = new Query("q1", "s1", "How many patients were admitted yesterday?",
            "how many patients were admitted yesterday", Instant.now(), QueryIntent.COUNT, 0.9, Map.of());
    private final RetrievalContext context = new RetrievalContext(query, List.of(
            ContextElement.of("table:patients", "Table patients",
                    new ContextMetadata.TableMetadata("patients", 12_000L, "Registered patients"), 0.8),
            ContextElement.of("column:patients.admitted_at", "patients.admitted_at DATE",
                    new ContextMetadata.ColumnMetadata("patients", "admitted_at", "DATE"), 0.6)), 20, 500);

    private final List<String> prompts = new ArrayList<>();

    private GenerativeBackend scripted(String... completions) {
        Deque<String> queue = new ArrayDeque<>(List.of(completions));
        return (prompt, stop, maxTokens, temperature) -> {
            prompts.add(prompt);
            return queue.size() > 1 ? queue.poll() : queue.peek();
        };
    }

    private GenerationController controller(GenerativeBackend backend) {
        return controller(backend, new RateLimiter(100, Duration.ofMinutes(1)));
    }

    private GenerationController controller(GenerativeBackend backend, RateLimiter rateLimiter) {
        return new GenerationController(backend, new PromptBuilder("postgresql"), new StatementExtractor(), analyzer,
                validator, schemaProvider, rateLimiter, settings, executor);
    }

    private GenerationOutcome generate(GenerationController controller) {
        return controller.generate(query, context, List.of(), Deadline.after(Duration.ofSeconds(10)));
    }

    @Test
    void validStatementOnFirstAttempt() {
        GenerationOutcome outcome = generate(controller(scripted("```sql\n" + GOOD + ";\n```")));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.statement().text()).isEqualTo(GOOD);
        assertThat(outcome.statement().dialect()).isEqualTo("postgresql");
        assertThat(outcome.statement().complexity()).isEqualTo(ComplexityTier.SIMPLE);
        assertThat(outcome.statement().referencedTables()).containsExactly("patients");
        assertThat(outcome.statement().confidence()).isCloseTo(0.91, within(1e-9));
        assertThat(prompts).hasSize(1);
        assertThat(prompts.get(0)).doesNotContain("### Correction");
    }

    @Test
    void unknownTableIsCorrectedOnSecondAttempt() {
        GenerationOutcome outcome = generate(controller(scripted("SELECT * FROM foo", GOOD)));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(outcome.statement().attempt()).isEqualTo(2);
        assertThat(prompts).hasSize(2);
        assertThat(prompts.get(1)).contains("### Correction")
                .contains("table foo not found; valid candidates: patients");
    }

    @Test
    void attemptsNeverExceedTheMaximum() {
        GenerationOutcome outcome = generate(controller(scripted("SELECT * FROM foo")));

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.GENERATION_FAILED);
        assertThat(outcome.attempts()).isEqualTo(settings.getMaxAttempts());
        assertThat(prompts).hasSize(settings.getMaxAttempts());
        assertThat(outcome.suggestions()).contains("Did you mean patients?");
    }

    @Test
    void unknownColumnIsCorrectedOnSecondAttempt() {
        GenerationOutcome outcome = generate(controller(scripted(
                "SELECT COUNT(*) FROM patients p WHERE p.admit_date = CURRENT_DATE - 1", GOOD)));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(prompts.get(1)).contains("admit_date").contains("admitted_at");
    }

    @Test
    void noSqlSentinelEndsWithoutRetry() {
        GenerationOutcome outcome = generate(controller(scripted("NO_SQL")));

        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.GENERATION_FAILED);
        assertThat(outcome.message()).contains("cannot be answered");
        assertThat(prompts).hasSize(1);
    }

    @Test
    void completionWithoutStatementEndsGeneration() {
        GenerationOutcome outcome = generate(controller(scripted("I am not sure what you mean.", GOOD)));

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.GENERATION_FAILED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(prompts).hasSize(1);
    }

    @Test
    void prosePreambleMentioningWithIsSkipped() {
        GenerationOutcome outcome = generate(controller(scripted(
                "Here is the query with the count you asked for:\n" + GOOD)));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.statement().text()).isEqualTo(GOOD);
    }

    @Test
    void securityViolationIsNeverRetried() {
        GenerationOutcome outcome = generate(controller(scripted("SELECT * FROM patients WHERE name = '' OR 1=1", GOOD)));

        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.SECURITY_VIOLATION);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(prompts).hasSize(1);
    }

    @Test
    void backendFailureKeepsItsKind() {
        GenerativeBackend failing = (prompt, stop, maxTokens, temperature) -> {
            throw new QueryPilotException(ErrorKind.SERVICE_UNAVAILABLE, "backend down", List.of("Retry in a moment"));
        };

        GenerationOutcome outcome = generate(controller(failing));

        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.SERVICE_UNAVAILABLE);
        assertThat(outcome.suggestions()).containsExactly("Retry in a moment");
    }

    @Test
    void exhaustedRateLimitFailsFast() {
        RateLimiter limiter = new RateLimiter(1, Duration.ofHours(1));
        assertThat(limiter.tryAcquire()).isTrue();

        GenerationOutcome outcome = controller(scripted(GOOD), limiter)
                .generate(query, context, List.of(), Deadline.after(Duration.ofMillis(200)));

        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(prompts).isEmpty();
    }

    @Test
    void complexityTiers() {
        assertThat(GenerationController.complexity(analyzer.analyze("SELECT COUNT(*) FROM patients")))
                .isEqualTo(ComplexityTier.SIMPLE);
        assertThat(GenerationController.complexity(analyzer.analyze(
                "SELECT d.name FROM doctors d JOIN encounters e ON e.doctor_id = d.id")))
                .isEqualTo(ComplexityTier.MODERATE);
        assertThat(GenerationController.complexity(analyzer.analyze(
                "SELECT name, RANK() OVER (ORDER BY id) FROM doctors")))
                .isEqualTo(ComplexityTier.COMPLEX);
        assertThat(GenerationController.complexity(analyzer.analyze(
                "SELECT * FROM patients p JOIN admissions a ON a.patient_id = p.id "
                        + "JOIN encounters e ON e.patient_id = p.id JOIN doctors d ON d.id = e.doctor_id")))
                .isEqualTo(ComplexityTier.COMPLEX);
    }

    @Test
    void confidenceDropsWithComplexity() {
        GenerationController controller = controller(scripted(GOOD));

        double simple = controller.confidence(analyzer.analyze(GOOD), context, ComplexityTier.SIMPLE);
        double complex = controller.confidence(analyzer.analyze(GOOD), context, ComplexityTier.COMPLEX);

        assertThat(simple).isCloseTo(0.5 + 0.3 * 0.7 + 0.2, within(1e-9));
        assertThat(complex).isLessThan(simple);
    }
}
