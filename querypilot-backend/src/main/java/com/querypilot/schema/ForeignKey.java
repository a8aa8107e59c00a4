package com.querypilot.schema;

/**
 * Declared foreign key from {@code fromTable.fromColumn} to {@code toTable.toColumn}.
 */
public record ForeignKey(String fromTable, String fromColumn, String toTable, String toColumn) {
}
