package com.querypilot.schema;

public record ColumnInfo(String name, String dataType) {
}
