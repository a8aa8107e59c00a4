package com.querypilot.model;

import java.util.List;

/**
 * Outcome of running the validation layers over one statement.
 *
 * <p>{@link #passed()} is derived from the issues, so it can never disagree with them.
 */
public record ValidationResult(
        List<ValidationIssue> issues,
        String statement,
        RiskLevel risk
) {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        risk = risk == null ? RiskLevel.LOW : risk;
    }

    public boolean passed() {
        return issues.stream().noneMatch(issue -> issue.severity().isBlocking());
    }

    public boolean hasCritical() {
        return issues.stream().anyMatch(issue -> issue.severity() == Severity.CRITICAL);
    }

    public List<ValidationIssue> issuesForRule(String ruleId) {
        return issues.stream().filter(issue -> issue.ruleId().equals(ruleId)).toList();
    }

    /**
     * True when every blocking issue comes from the given rule.
     */
    public boolean onlyBlockedBy(String ruleId) {
        List<ValidationIssue> blocking = issues.stream().filter(issue -> issue.severity().isBlocking()).toList();
        return !blocking.isEmpty() && blocking.stream().allMatch(issue -> issue.ruleId().equals(ruleId));
    }
}
