package com.querypilot.execution;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.querypilot.model.ErrorClass;
import com.querypilot.model.ExecutionResult;
import com.querypilot.util.Deadline;
import com.querypilot.util.MutableClock;

class ExecutionGuardTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final CircuitBreaker breaker = new CircuitBreaker(5, Duration.ofSeconds(30), 2, clock);

    private static ExecutionGuard.FetchPolicy policy(int maxRetries) {
        return new ExecutionGuard.FetchPolicy(maxRetries, Duration.ofMillis(1), Duration.ofMillis(4),
                Duration.ofSeconds(30), Duration.ofSeconds(5), 10, 50, 1_000);
    }

    private static Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(10));
    }

    private static List<Map<String, Object>> rows(int n) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(Map.of("id", i));
        }
        return rows;
    }

    @Test
    void circuitOpensAfterFiveTransientFailuresAndFailsFast() {
        FakeExecutor executor = new FakeExecutor();
        executor.failWith(ErrorClass.TRANSIENT, 100);
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(0));

        for (int i = 0; i < 5; i++) {
            ExecutionResult result = guard.execute("SELECT 1", deadline());
            assertThat(result.success()).isFalse();
            assertThat(result.errorClass()).isEqualTo(ErrorClass.TRANSIENT);
        }
        assertThat(executor.opens).hasValue(5);
        assertThat(guard.circuit().state()).isEqualTo(CircuitState.OPEN);

        ExecutionResult sixth = guard.execute("SELECT 1", deadline());

        assertThat(executor.opens).hasValue(5);
        assertThat(sixth.success()).isFalse();
        assertThat(sixth.errorClass()).isEqualTo(ErrorClass.TRANSIENT);
        assertThat(sixth.errorMessage()).isEqualTo(ExecutionGuard.UNAVAILABLE_MESSAGE);
    }

    @Test
    void recoversThroughHalfOpenTrials() {
        FakeExecutor executor = new FakeExecutor();
        executor.failWith(ErrorClass.TRANSIENT, 5);
        executor.result(rows(1));
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(0));
        for (int i = 0; i < 5; i++) {
            guard.execute("SELECT 1", deadline());
        }

        clock.advance(Duration.ofSeconds(30));
        assertThat(guard.execute("SELECT 1", deadline()).success()).isTrue();
        assertThat(guard.circuit().state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(guard.execute("SELECT 1", deadline()).success()).isTrue();
        assertThat(guard.circuit().state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void transientFailureIsRetriedAndCountsOnce() {
        FakeExecutor executor = new FakeExecutor();
        executor.failWith(ErrorClass.TRANSIENT, 2);
        executor.result(rows(3));
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(2));

        ExecutionResult result = guard.execute("SELECT id FROM patients", deadline());

        assertThat(result.success()).isTrue();
        assertThat(result.rowCount()).isEqualTo(3);
        assertThat(executor.opens).hasValue(3);
        assertThat(guard.circuit().consecutiveFailures()).isZero();
    }

    @Test
    void exhaustedRetriesRecordOneFailure() {
        FakeExecutor executor = new FakeExecutor();
        executor.failWith(ErrorClass.TRANSIENT, 10);
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(2));

        ExecutionResult result = guard.execute("SELECT 1", deadline());

        assertThat(result.success()).isFalse();
        assertThat(executor.opens).hasValue(3);
        assertThat(guard.circuit().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void statementErrorsAreNotRetriedAndDoNotCount() {
        FakeExecutor executor = new FakeExecutor();
        executor.failWith(ErrorClass.STATEMENT, 10);
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(2));

        for (int i = 0; i < 6; i++) {
            ExecutionResult result = guard.execute("SELECT nope FROM patients", deadline());
            assertThat(result.errorClass()).isEqualTo(ErrorClass.STATEMENT);
        }

        assertThat(executor.opens).hasValue(6);
        assertThat(guard.circuit().state()).isEqualTo(CircuitState.CLOSED);
        assertThat(guard.circuit().consecutiveFailures()).isZero();
    }

    @Test
    void smallResultIsCompleteWithoutCounting() {
        FakeExecutor executor = new FakeExecutor();
        executor.result(rows(7));
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(0));

        ExecutionResult result = guard.execute("SELECT id FROM doctors", deadline());

        assertThat(result.complete()).isTrue();
        assertThat(result.rows()).hasSize(7);
        assertThat(result.columns()).containsExactly("id");
        assertThat(result.warnings()).isEmpty();
        assertThat(executor.estimates).hasValue(0);
    }

    @Test
    void mediumResultIsFetchedUpToTheHardCap() {
        FakeExecutor executor = new FakeExecutor();
        executor.result(rows(40));
        executor.estimate = OptionalLong.of(40);
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(0));

        ExecutionResult result = guard.execute("SELECT id FROM encounters", deadline());

        assertThat(result.complete()).isTrue();
        assertThat(result.rowCount()).isEqualTo(40);
    }

    @Test
    void resultBeyondHardCapIsTruncatedWithWarning() {
        FakeExecutor executor = new FakeExecutor();
        executor.result(rows(80));
        executor.estimate = OptionalLong.of(80);
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(0));

        ExecutionResult result = guard.execute("SELECT id FROM encounters", deadline());

        assertThat(result.success()).isTrue();
        assertThat(result.complete()).isFalse();
        assertThat(result.rows()).hasSize(50);
        assertThat(result.estimatedTotalRows()).isEqualTo(80L);
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0)).contains("first 50 rows of about 80");
    }

    @Test
    void hugeResultStopsAfterFirstBatch() {
        FakeExecutor executor = new FakeExecutor();
        executor.result(rows(2_000));
        executor.estimate = OptionalLong.of(5_000_000);
        ExecutionGuard guard = new ExecutionGuard(executor, breaker, policy(0));

        ExecutionResult result = guard.execute("SELECT * FROM lab_results", deadline());

        assertThat(result.complete()).isFalse();
        assertThat(result.rows()).hasSize(10);
        assertThat(result.estimatedTotalRows()).isEqualTo(5_000_000L);
        assertThat(result.warnings()).isNotEmpty();
    }

    @Test
    void backoffDoublesUpToTheCeiling() {
        ExecutionGuard guard = new ExecutionGuard(new FakeExecutor(), breaker, policy(5));

        assertThat(guard.backoff(0)).isEqualTo(Duration.ofMillis(1));
        assertThat(guard.backoff(1)).isEqualTo(Duration.ofMillis(2));
        assertThat(guard.backoff(2)).isEqualTo(Duration.ofMillis(4));
        assertThat(guard.backoff(3)).isEqualTo(Duration.ofMillis(4));
    }

    /**
     * Scripted executor: fails a number of times, then serves rows from memory.
     */
    private static final class FakeExecutor implements StatementExecutor {

        private final AtomicInteger opens = new AtomicInteger();
        private final AtomicInteger estimates = new AtomicInteger();
        private final Deque<ErrorClass> failures = new ArrayDeque<>();
        private List<Map<String, Object>> rows = List.of();
        private OptionalLong estimate = OptionalLong.empty();

        void failWith(ErrorClass errorClass, int times) {
            for (int i = 0; i < times; i++) {
                failures.add(errorClass);
            }
        }

        void result(List<Map<String, Object>> rows) {
            this.rows = rows;
        }

        @Override
        public ResultCursor open(String statement, Duration timeout) throws StatementExecutionException {
            opens.incrementAndGet();
            ErrorClass failure = failures.poll();
            if (failure != null) {
                throw new StatementExecutionException(failure, failure + " failure", null);
            }
            return new ListCursor(rows);
        }

        @Override
        public OptionalLong estimateRowCount(String statement, Duration timeout) {
            estimates.incrementAndGet();
            return estimate;
        }
    }

    private static final class ListCursor implements ResultCursor {

        private final List<Map<String, Object>> rows;
        private int position;

        private ListCursor(List<Map<String, Object>> rows) {
            this.rows = rows;
        }

        @Override
        public List<String> columns() {
            return List.of("id");
        }

        @Override
        public List<Map<String, Object>> next(int maxRows) {
            int end = Math.min(rows.size(), position + Math.max(maxRows, 0));
            List<Map<String, Object>> batch = rows.subList(position, end);
            position = end;
            return batch;
        }

        @Override
        public boolean exhausted() {
            return position >= rows.size();
        }

        @Override
        public void close() {
        }
    }
}
