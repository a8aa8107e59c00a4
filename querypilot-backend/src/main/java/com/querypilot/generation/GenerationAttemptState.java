package com.querypilot.generation;

/**
 * Retry-loop state: how many attempts were made and why the last one was rejected.
 */
record GenerationAttemptState(int attempt, String lastError) {

    static GenerationAttemptState initial() {
        return new GenerationAttemptState(0, null);
    }

    GenerationAttemptState rejected(String error) {
        return new GenerationAttemptState(attempt, error);
    }

    GenerationAttemptState nextAttempt() {
        return new GenerationAttemptState(attempt + 1, lastError);
    }
}
