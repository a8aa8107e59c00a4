package com.querypilot.model;

/**
 * Kinds of schema facts that can be retrieved as generation context.
 */
public enum ContextKind {
    TABLE,
    COLUMN,
    RELATIONSHIP,
    EXAMPLE,
    RULE
}
