package com.querypilot.validation;

import com.querypilot.model.RiskLevel;
import com.querypilot.schema.SchemaSnapshot;
import com.querypilot.schema.TableInfo;
import com.querypilot.sql.StatementStructure;

import java.util.ArrayList;
import java.util.List;

/**
 * Heuristic cost score from row-count metadata and statement shape.
 *
 * <p>Score contributions: large table 3, medium table 1, each join 1, each subquery 1, window 1,
 * no filter 2, no row bound 1, no aggregation 1. A large table read without any filter, bound or aggregation
 * is at least {@link RiskLevel#HIGH}.
 */
public class CostEstimator {

    private final long largeTableRows;

    public CostEstimator(long largeTableRows) {
        this.largeTableRows = largeTableRows;
    }

    public CostEstimate estimate(StatementStructure structure, SchemaSnapshot schema) {
        int score = 0;
        long largest = 0;
        List<String> reasons = new ArrayList<>();

        for (String name : structure.tables()) {
            long rows = schema.table(name).map(TableInfo::rowCount).orElse(-1L);
            largest = Math.max(largest, rows);
            if (rows >= largeTableRows) {
                score += 3;
                reasons.add("table " + name + " has about " + rows + " rows");
            } else if (rows >= largeTableRows / 10) {
                score += 1;
            }
        }

        score += structure.joinCount() + structure.subqueryCount();
        if (structure.joinCount() > 0) {
            reasons.add(structure.joinCount() + " join(s)");
        }
        if (structure.subqueryCount() > 0) {
            reasons.add(structure.subqueryCount() + " subquery(ies)");
        }
        if (structure.hasWindow()) {
            score += 1;
        }

        boolean singleRowAggregate = structure.hasAggregate() && !structure.hasGroupBy();
        if (!structure.hasWhere()) {
            score += 2;
            reasons.add("no filter");
        }
        if (!structure.hasLimit() && !singleRowAggregate) {
            score += 1;
            reasons.add("no row limit");
        }
        if (!structure.hasAggregate()) {
            score += 1;
        }

        RiskLevel risk = classify(score);
        boolean unboundedLargeRead = largest >= largeTableRows
                && !structure.hasWhere() && !structure.hasLimit() && !structure.hasAggregate();
        if (unboundedLargeRead && !risk.atLeast(RiskLevel.HIGH)) {
            risk = RiskLevel.HIGH;
        }
        return new CostEstimate(score, risk, largest, reasons);
    }

    static RiskLevel classify(int score) {
        if (score <= 2) {
            return RiskLevel.LOW;
        }
        if (score <= 4) {
            return RiskLevel.MEDIUM;
        }
        if (score <= 6) {
            return RiskLevel.HIGH;
        }
        return RiskLevel.VERY_HIGH;
    }
}
