package com.querypilot.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final answer for one question: the statement, its result and a synthesized answer text.
 *
 * <p>{@code warnings} holds everything the user should see alongside the answer: truncation warnings from
 * execution and warning-level validation issues.
 */
public record QueryResponse(
        String queryId,
        String statement,
        ExecutionResult result,
        String answer,
        long latencyMs,
        boolean cacheHit,
        Map<String, Long> stageTimingsMs,
        List<String> warnings
) {

    public QueryResponse {
        stageTimingsMs = stageTimingsMs == null ? Map.of() : Map.copyOf(stageTimingsMs);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Response whose only warnings are those of the execution result.
     */
    public QueryResponse(String queryId, String statement, ExecutionResult result, String answer, long latencyMs,
                         boolean cacheHit, Map<String, Long> stageTimingsMs) {
        this(queryId, statement, result, answer, latencyMs, cacheHit, stageTimingsMs,
                result == null ? List.of() : result.warnings());
    }

    /**
     * Copy of a cached response re-issued for a new question.
     */
    public QueryResponse asCacheHit(String newQueryId, long newLatencyMs) {
        Map<String, Long> timings = new LinkedHashMap<>();
        timings.put("cache_lookup", newLatencyMs);
        return new QueryResponse(newQueryId, statement, result, answer, newLatencyMs, true, timings, warnings);
    }
}
