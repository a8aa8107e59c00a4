package com.querypilot.execution;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Closed / open / half-open breaker around the datastore.
 *
 * <p>Every read and transition happens under the instance lock, so two callers can never both open the circuit
 * or both hold the half-open trial permit. Callers must pair each granted {@link #tryAcquire()} with exactly one
 * {@link #recordSuccess()} or {@link #recordFailure()}.
 */
@Slf4j
public class CircuitBreaker {

    private final int failureThreshold;
    private final Duration coolDown;
    private final int halfOpenSuccessesToClose;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenSuccesses;
    private Instant lastFailureAt;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(int failureThreshold, Duration coolDown, int halfOpenSuccessesToClose, Clock clock) {
        if (failureThreshold < 1 || halfOpenSuccessesToClose < 1) {
            throw new IllegalArgumentException("Circuit thresholds must be positive");
        }
        this.failureThreshold = failureThreshold;
        this.coolDown = coolDown;
        this.halfOpenSuccessesToClose = halfOpenSuccessesToClose;
        this.clock = clock;
    }

    /**
     * Ask for permission to call the datastore.
     *
     * @return false while open, or while half-open and the trial permit is taken
     */
    public synchronized boolean tryAcquire() {
        if (state == CircuitState.OPEN) {
            if (clock.instant().isBefore(openedAt.plus(coolDown))) {
                return false;
            }
            transition(CircuitState.HALF_OPEN);
            halfOpenSuccesses = 0;
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                return false;
            }
            trialInFlight = true;
        }
        return true;
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            halfOpenSuccesses++;
            if (halfOpenSuccesses >= halfOpenSuccessesToClose) {
                consecutiveFailures = 0;
                halfOpenSuccesses = 0;
                transition(CircuitState.CLOSED);
            }
            return;
        }
        consecutiveFailures = 0;
    }

    public synchronized void recordFailure() {
        lastFailureAt = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            halfOpenSuccesses = 0;
            open();
            return;
        }
        if (state == CircuitState.CLOSED) {
            consecutiveFailures++;
            if (consecutiveFailures >= failureThreshold) {
                open();
            }
        }
    }

    /**
     * Give back a permit without an outcome, for calls abandoned before reaching the datastore.
     */
    public synchronized void release() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized CircuitSnapshot snapshot() {
        return new CircuitSnapshot(state, consecutiveFailures, lastFailureAt, halfOpenSuccesses);
    }

    private void open() {
        openedAt = clock.instant();
        transition(CircuitState.OPEN);
    }

    private void transition(CircuitState next) {
        if (state != next) {
            log.warn("Circuit breaker transition (from={}, to={}, consecutive_failures={})", state, next, consecutiveFailures);
            state = next;
        }
    }
}
