package com.querypilot.model;

import java.util.List;
import java.util.Map;

/**
 * Result of running a statement through the execution guard.
 *
 * <p>An incomplete successful result always carries at least one warning explaining the truncation.
 */
public record ExecutionResult(
        boolean success,
        List<String> columns,
        List<Map<String, Object>> rows,
        long rowCount,
        long executionTimeMs,
        boolean complete,
        List<String> warnings,
        Long estimatedTotalRows,
        ErrorClass errorClass,
        String errorMessage
) {

    public ExecutionResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (success && !complete && warnings.isEmpty()) {
            throw new IllegalArgumentException("Truncated results must explain the truncation in a warning");
        }
    }

    public static ExecutionResult complete(List<String> columns, List<Map<String, Object>> rows, long executionTimeMs) {
        return new ExecutionResult(true, columns, rows, rows.size(), executionTimeMs, true, List.of(), null, null, null);
    }

    public static ExecutionResult truncated(List<String> columns, List<Map<String, Object>> rows, long executionTimeMs,
                                            Long estimatedTotalRows, String warning) {
        return new ExecutionResult(true, columns, rows, rows.size(), executionTimeMs, false, List.of(warning),
                estimatedTotalRows, null, null);
    }

    public static ExecutionResult failed(ErrorClass errorClass, String message, long executionTimeMs) {
        return new ExecutionResult(false, List.of(), List.of(), 0, executionTimeMs, false, List.of(), null,
                errorClass, message);
    }

    /**
     * Result returned without contacting the datastore while the circuit is open.
     */
    public static ExecutionResult unavailable(String message) {
        return new ExecutionResult(false, List.of(), List.of(), 0, 0, false, List.of(), null,
                ErrorClass.TRANSIENT, message);
    }
}
