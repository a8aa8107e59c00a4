package com.querypilot.schema;

import java.util.List;
import java.util.Optional;

/**
 * Table metadata in a schema snapshot. {@code rowCount} is negative when unknown.
 */
public record TableInfo(String name, List<ColumnInfo> columns, long rowCount, String remarks) {

    public TableInfo {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public Optional<ColumnInfo> column(String columnName) {
        return columns.stream().filter(c -> c.name().equalsIgnoreCase(columnName)).findFirst();
    }

    public boolean hasColumn(String columnName) {
        return column(columnName).isPresent();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnInfo::name).toList();
    }
}
