package com.querypilot.model;

/**
 * Closed set of question shapes the intent analyzer recognizes.
 */
public enum QueryIntent {
    COUNT,
    AGGREGATE,
    LIST,
    COMPARISON,
    TREND,
    TOP_N,
    LOOKUP,
    UNKNOWN
}
