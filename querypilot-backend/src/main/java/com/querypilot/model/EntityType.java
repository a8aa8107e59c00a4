package com.querypilot.model;

/**
 * Kinds of entities extracted from a natural-language question.
 */
public enum EntityType {
    DATE,
    NUMBER,
    COMPARATOR,
    TABLE_HINT,
    METRIC
}
