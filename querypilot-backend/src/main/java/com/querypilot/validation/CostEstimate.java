package com.querypilot.validation;

import com.querypilot.model.RiskLevel;

import java.util.List;

public record CostEstimate(int score, RiskLevel risk, long largestTableRows, List<String> reasons) {

    public CostEstimate {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
