package com.querypilot.validation;

import com.querypilot.model.RiskLevel;
import com.querypilot.model.Severity;
import com.querypilot.model.ValidationIssue;

import java.util.List;

/**
 * Layer 5: attaches a {@code large_result} warning to high-risk statements. Never blocks.
 */
public class CostCheck implements ValidationLayer {

    public static final String RULE_ID = "large_result";

    private final CostEstimator estimator;

    public CostCheck(CostEstimator estimator) {
        this.estimator = estimator;
    }

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public LayerResult check(ValidationInput input) {
        CostEstimate estimate = estimator.estimate(input.structure(), input.schema());
        if (!estimate.risk().atLeast(RiskLevel.HIGH)) {
            return new LayerResult(List.of(), estimate.risk());
        }
        ValidationIssue warning = new ValidationIssue(Severity.WARNING, RULE_ID,
                "Statement may return a large result (risk " + estimate.risk() + ": "
                        + String.join(", ", estimate.reasons()) + ")",
                List.of("Add a WHERE filter", "Add a LIMIT", "Aggregate instead of listing rows"));
        return new LayerResult(List.of(warning), estimate.risk());
    }
}
