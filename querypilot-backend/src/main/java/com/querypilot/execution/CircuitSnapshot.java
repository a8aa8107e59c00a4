package com.querypilot.execution;

import java.time.Instant;

/**
 * Point-in-time view of the breaker for health reporting and tests.
 */
public record CircuitSnapshot(
        CircuitState state,
        int consecutiveFailures,
        Instant lastFailureAt,
        int halfOpenSuccesses
) {
}
