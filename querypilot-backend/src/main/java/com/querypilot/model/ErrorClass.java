package com.querypilot.model;

/**
 * Classification of a datastore failure, used to decide between retrying and propagating.
 */
public enum ErrorClass {
    /** Connection loss, deadlock, lock timeout, pool exhaustion. Safe to retry. */
    TRANSIENT,
    /** Statement or acquisition exceeded its deadline. */
    TIMEOUT,
    /** Problem with the statement itself: syntax, unknown object, permission. */
    STATEMENT,
    /** Anything else. */
    FATAL;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }

    /**
     * Whether this failure says something about datastore health.
     */
    public boolean countsAgainstCircuit() {
        return this != STATEMENT;
    }
}
