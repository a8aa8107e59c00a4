package com.querypilot.sql;

/**
 * A qualified column reference such as {@code p.admitted_at}.
 */
public record ColumnRef(String qualifier, String column) {
}
