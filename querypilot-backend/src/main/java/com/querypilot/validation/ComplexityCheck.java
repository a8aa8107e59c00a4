package com.querypilot.validation;

import com.querypilot.model.ValidationIssue;
import com.querypilot.sql.StatementStructure;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 4: structural ceilings. Violations warn, they never block.
 */
public class ComplexityCheck implements ValidationLayer {

    public static final String RULE_ID = "complexity";

    private final int maxJoins;
    private final int maxSubqueryDepth;
    private final int maxUnions;

    public ComplexityCheck(int maxJoins, int maxSubqueryDepth, int maxUnions) {
        this.maxJoins = maxJoins;
        this.maxSubqueryDepth = maxSubqueryDepth;
        this.maxUnions = maxUnions;
    }

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public LayerResult check(ValidationInput input) {
        StatementStructure s = input.structure();
        List<ValidationIssue> issues = new ArrayList<>();
        if (s.joinCount() > maxJoins) {
            issues.add(ValidationIssue.warning(RULE_ID,
                    "Statement joins " + s.joinCount() + " times (limit " + maxJoins + ")"));
        }
        if (s.maxSubqueryDepth() > maxSubqueryDepth) {
            issues.add(ValidationIssue.warning(RULE_ID,
                    "Subqueries nest " + s.maxSubqueryDepth() + " levels deep (limit " + maxSubqueryDepth + ")"));
        }
        if (s.unionCount() > maxUnions) {
            issues.add(ValidationIssue.warning(RULE_ID,
                    "Statement combines " + (s.unionCount() + 1) + " result sets (limit " + (maxUnions + 1) + ")"));
        }
        return LayerResult.of(issues);
    }
}
