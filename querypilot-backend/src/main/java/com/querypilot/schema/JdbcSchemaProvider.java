package com.querypilot.schema;

import com.querypilot.error.ErrorKind;
import com.querypilot.error.QueryPilotException;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Loads the schema through JDBC {@link DatabaseMetaData} and keeps it for a TTL.
 */
@Slf4j
public class JdbcSchemaProvider implements SchemaProvider {

    private static final Set<String> TABLE_TYPES = Set.of("TABLE", "BASE TABLE", "VIEW");
    private static final Set<String> SYSTEM_SCHEMAS = Set.of("INFORMATION_SCHEMA", "PG_CATALOG", "SYS", "SYSTEM");

    private final DataSource dataSource;
    private final String schemaPattern;
    private final Map<String, Long> rowCountHints;
    private final Duration ttl;
    private final Clock clock;
    private final List<Consumer<SchemaSnapshot>> listeners = new CopyOnWriteArrayList<>();

    private volatile SchemaSnapshot current;
    private volatile Instant loadedAt = Instant.EPOCH;

    /**
     * Create a schema provider.
     *
     * @param dataSource pooled datasource
     * @param schemaPattern schema to introspect, or {@code null} for every non-system schema
     * @param rowCountHints row counts keyed by table name (case-insensitive)
     * @param ttl snapshot time-to-live
     * @param clock clock used for TTL checks
     */
    public JdbcSchemaProvider(DataSource dataSource, String schemaPattern, Map<String, Long> rowCountHints,
                              Duration ttl, Clock clock) {
        this.dataSource = dataSource;
        this.schemaPattern = schemaPattern == null || schemaPattern.isBlank() ? null : schemaPattern.trim();
        this.rowCountHints = lowerKeys(rowCountHints);
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public SchemaSnapshot snapshot() {
        SchemaSnapshot snapshot = current;
        if (snapshot != null && clock.instant().isBefore(loadedAt.plus(ttl))) {
            return snapshot;
        }
        return reload();
    }

    @Override
    public void refresh() {
        loadedAt = Instant.EPOCH;
    }

    @Override
    public void onVersionChange(Consumer<SchemaSnapshot> listener) {
        listeners.add(listener);
    }

    private synchronized SchemaSnapshot reload() {
        SchemaSnapshot previous = current;
        if (previous != null && clock.instant().isBefore(loadedAt.plus(ttl))) {
            return previous;
        }
        SchemaSnapshot loaded;
        try {
            loaded = load();
        } catch (SQLException e) {
            if (previous != null) {
                log.warn("Schema reload failed, keeping previous snapshot (version={}, sql_state={}): {}",
                        previous.version(), e.getSQLState(), e.getMessage());
                loadedAt = clock.instant();
                return previous;
            }
            throw new QueryPilotException(ErrorKind.SERVICE_UNAVAILABLE, "Database schema could not be loaded",
                    List.of("Check that the database is reachable"), e);
        }
        current = loaded;
        loadedAt = clock.instant();
        if (previous == null || !previous.version().equals(loaded.version())) {
            log.info("Schema loaded (version={}, tables={}, foreign_keys={})",
                    loaded.version(), loaded.tables().size(), loaded.foreignKeys().size());
            for (Consumer<SchemaSnapshot> listener : listeners) {
                try {
                    listener.accept(loaded);
                } catch (RuntimeException e) {
                    log.error("Schema change listener failed (version={})", loaded.version(), e);
                }
            }
        }
        return loaded;
    }

    private SchemaSnapshot load() throws SQLException {
        List<TableInfo> tables = new ArrayList<>();
        List<ForeignKey> foreignKeys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            List<String[]> tableRefs = new ArrayList<>();
            try (ResultSet rs = meta.getTables(null, schemaPattern, "%", null)) {
                while (rs.next()) {
                    String schema = rs.getString("TABLE_SCHEM");
                    String type = rs.getString("TABLE_TYPE");
                    if (type == null || !TABLE_TYPES.contains(type.toUpperCase(Locale.ROOT))) {
                        continue;
                    }
                    if (schema != null && SYSTEM_SCHEMAS.contains(schema.toUpperCase(Locale.ROOT))) {
                        continue;
                    }
                    tableRefs.add(new String[]{schema, rs.getString("TABLE_NAME"), rs.getString("REMARKS")});
                }
            }
            for (String[] ref : tableRefs) {
                String schema = ref[0];
                String table = ref[1];
                tables.add(new TableInfo(table, loadColumns(meta, schema, table), rowCount(meta, schema, table), ref[2]));
                foreignKeys.addAll(loadForeignKeys(meta, schema, table));
            }
        }
        return SchemaSnapshot.of(tables, foreignKeys);
    }

    private List<ColumnInfo> loadColumns(DatabaseMetaData meta, String schema, String table) throws SQLException {
        List<ColumnInfo> columns = new ArrayList<>();
        try (ResultSet rs = meta.getColumns(null, schema, table, "%")) {
            while (rs.next()) {
                columns.add(new ColumnInfo(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME")));
            }
        }
        return columns;
    }

    private List<ForeignKey> loadForeignKeys(DatabaseMetaData meta, String schema, String table) throws SQLException {
        List<ForeignKey> keys = new ArrayList<>();
        try (ResultSet rs = meta.getImportedKeys(null, schema, table)) {
            while (rs.next()) {
                keys.add(new ForeignKey(
                        rs.getString("FKTABLE_NAME"),
                        rs.getString("FKCOLUMN_NAME"),
                        rs.getString("PKTABLE_NAME"),
                        rs.getString("PKCOLUMN_NAME")));
            }
        }
        return keys;
    }

    private long rowCount(DatabaseMetaData meta, String schema, String table) {
        Long hint = rowCountHints.get(table.toLowerCase(Locale.ROOT));
        if (hint != null) {
            return hint;
        }
        try (ResultSet rs = meta.getIndexInfo(null, schema, table, false, true)) {
            while (rs.next()) {
                if (rs.getShort("TYPE") == DatabaseMetaData.tableIndexStatistic) {
                    return rs.getLong("CARDINALITY");
                }
            }
        } catch (SQLException e) {
            log.debug("Table statistics unavailable (table={}): {}", table, e.getMessage());
        }
        return -1L;
    }

    private static Map<String, Long> lowerKeys(Map<String, Long> hints) {
        if (hints == null || hints.isEmpty()) {
            return Map.of();
        }
        Map<String, Long> out = new HashMap<>();
        hints.forEach((k, v) -> out.put(k.toLowerCase(Locale.ROOT), v));
        return Map.copyOf(out);
    }
}
