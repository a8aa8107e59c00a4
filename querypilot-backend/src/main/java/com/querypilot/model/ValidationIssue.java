package com.querypilot.model;

import java.util.List;

public record ValidationIssue(
        Severity severity,
        String ruleId,
        String message,
        List<String> suggestions
) {

    public ValidationIssue {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ValidationIssue critical(String ruleId, String message) {
        return new ValidationIssue(Severity.CRITICAL, ruleId, message, List.of());
    }

    public static ValidationIssue error(String ruleId, String message, List<String> suggestions) {
        return new ValidationIssue(Severity.ERROR, ruleId, message, suggestions);
    }

    public static ValidationIssue warning(String ruleId, String message) {
        return new ValidationIssue(Severity.WARNING, ruleId, message, List.of());
    }

    public static ValidationIssue info(String ruleId, String message) {
        return new ValidationIssue(Severity.INFO, ruleId, message, List.of());
    }
}
