package com.querypilot.execution;

import com.querypilot.model.ErrorClass;
import com.querypilot.model.ExecutionResult;
import com.querypilot.util.Deadline;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Resilient execution: circuit breaker, transient-error retry with capped exponential backoff and tiered
 * result fetching.
 *
 * <p>One guarded call counts once toward the breaker, however many retries it took. Statement errors
 * (syntax, permissions, unknown objects) are returned without counting.
 */
@Slf4j
public class ExecutionGuard {

    public static final String UNAVAILABLE_MESSAGE = "The database is temporarily unavailable, please retry shortly";

    private final StatementExecutor executor;
    private final CircuitBreaker circuitBreaker;
    private final FetchPolicy policy;

    public ExecutionGuard(StatementExecutor executor, CircuitBreaker circuitBreaker, FetchPolicy policy) {
        this.executor = executor;
        this.circuitBreaker = circuitBreaker;
        this.policy = policy;
    }

    public ExecutionResult execute(String statement, Deadline deadline) {
        if (!circuitBreaker.tryAcquire()) {
            log.warn("Circuit open, failing fast without contacting the datastore");
            return ExecutionResult.unavailable(UNAVAILABLE_MESSAGE);
        }

        long start = System.nanoTime();
        boolean settled = false;
        try {
            for (int attempt = 0; ; attempt++) {
                try {
                    ExecutionResult result = fetchTiered(statement, deadline, start);
                    circuitBreaker.recordSuccess();
                    settled = true;
                    return result;
                } catch (StatementExecutionException e) {
                    ErrorClass errorClass = e.getErrorClass();
                    Duration backoff = backoff(attempt);
                    boolean retry = errorClass.isRetryable() && attempt < policy.maxRetries()
                            && deadline.remaining().compareTo(backoff) > 0;
                    if (retry) {
                        log.info("Transient execution failure, retrying (attempt={}, backoff_ms={}, reason={})",
                                attempt + 1, backoff.toMillis(), e.getMessage());
                        Thread.sleep(backoff.toMillis());
                        continue;
                    }
                    if (errorClass.countsAgainstCircuit()) {
                        circuitBreaker.recordFailure();
                    } else {
                        circuitBreaker.release();
                    }
                    settled = true;
                    return ExecutionResult.failed(errorClass, e.getMessage(), elapsedMs(start));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.release();
            settled = true;
            return ExecutionResult.failed(ErrorClass.TIMEOUT, "Execution was cancelled", elapsedMs(start));
        } finally {
            if (!settled) {
                circuitBreaker.release();
            }
        }
    }

    private ExecutionResult fetchTiered(String statement, Deadline deadline, long start)
            throws StatementExecutionException {
        try (ResultCursor cursor = executor.open(statement, deadline.capped(policy.statementTimeout()))) {
            List<Map<String, Object>> rows = new ArrayList<>(cursor.next(policy.batchSize()));
            if (rows.size() < policy.batchSize()) {
                return ExecutionResult.complete(cursor.columns(), rows, elapsedMs(start));
            }

            OptionalLong estimate = executor.estimateRowCount(statement, deadline.capped(policy.countTimeout()));
            if (estimate.isPresent() && estimate.getAsLong() > policy.largeResultCeiling()) {
                String warning = "The result has about " + estimate.getAsLong() + " rows; showing the first "
                        + rows.size() + ". Add filters or export the data for the full result";
                return ExecutionResult.truncated(cursor.columns(), rows, elapsedMs(start), estimate.getAsLong(), warning);
            }

            rows.addAll(cursor.next(policy.hardCap() - rows.size()));
            boolean more = !cursor.next(1).isEmpty();
            if (!more) {
                return ExecutionResult.complete(cursor.columns(), rows, elapsedMs(start));
            }
            Long total = estimate.isPresent() ? estimate.getAsLong() : null;
            String warning = "The result was truncated to the first " + rows.size() + " rows"
                    + (total != null ? " of about " + total : "") + ". Add filters to see everything";
            return ExecutionResult.truncated(cursor.columns(), rows, elapsedMs(start), total, warning);
        }
    }

    Duration backoff(int attempt) {
        long millis = policy.initialBackoff().toMillis() << Math.min(attempt, 20);
        return Duration.ofMillis(Math.min(millis, policy.maxBackoff().toMillis()));
    }

    public CircuitSnapshot circuit() {
        return circuitBreaker.snapshot();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /**
     * Retry and fetch limits.
     */
    public record FetchPolicy(
            int maxRetries,
            Duration initialBackoff,
            Duration maxBackoff,
            Duration statementTimeout,
            Duration countTimeout,
            int batchSize,
            int hardCap,
            long largeResultCeiling
    ) {
        public FetchPolicy {
            if (batchSize < 1 || hardCap < batchSize) {
                throw new IllegalArgumentException("Hard cap must be at least one batch");
            }
        }
    }
}
