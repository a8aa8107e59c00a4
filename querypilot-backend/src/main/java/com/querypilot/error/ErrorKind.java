package com.querypilot.error;

/**
 * Stable error kinds surfaced to callers for every terminal failure.
 */
public enum ErrorKind {
    INVALID_INPUT,
    SECURITY_VIOLATION,
    VALIDATION_FAILED,
    GENERATION_FAILED,
    EXECUTION_FAILED,
    SERVICE_UNAVAILABLE,
    TIMEOUT,
    RATE_LIMITED,
    INTERNAL_ERROR
}
