package com.querypilot.model;

/**
 * Estimated execution cost class of a statement.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    public boolean atLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
