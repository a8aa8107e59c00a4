package com.querypilot.validation;

import com.querypilot.model.RiskLevel;
import com.querypilot.model.ValidationIssue;

import java.util.List;

/**
 * Issues found by one layer. Only the cost layer sets {@code risk}.
 */
public record LayerResult(List<ValidationIssue> issues, RiskLevel risk) {

    public LayerResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static LayerResult of(List<ValidationIssue> issues) {
        return new LayerResult(issues, null);
    }
}
