package com.querypilot.schema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the datastore schema. The version token is a content hash, so any DDL change yields a new token.
 */
public final class SchemaSnapshot {

    private final Map<String, TableInfo> tables;
    private final List<ForeignKey> foreignKeys;
    private final String version;
    private final Instant loadedAt;

    private SchemaSnapshot(Map<String, TableInfo> tables, List<ForeignKey> foreignKeys, String version, Instant loadedAt) {
        this.tables = tables;
        this.foreignKeys = foreignKeys;
        this.version = version;
        this.loadedAt = loadedAt;
    }

    public static SchemaSnapshot of(Collection<TableInfo> tables, Collection<ForeignKey> foreignKeys) {
        Map<String, TableInfo> byName = new LinkedHashMap<>();
        tables.stream()
                .sorted(Comparator.comparing(t -> key(t.name())))
                .forEach(t -> byName.put(key(t.name()), t));
        List<ForeignKey> fks = foreignKeys.stream()
                .sorted(Comparator.comparing((ForeignKey fk) -> key(fk.fromTable()))
                        .thenComparing(fk -> key(fk.fromColumn()))
                        .thenComparing(fk -> key(fk.toTable())))
                .toList();
        return new SchemaSnapshot(Map.copyOf(byName), fks, computeVersion(byName.values(), fks), Instant.now());
    }

    public static SchemaSnapshot empty() {
        return of(List.of(), List.of());
    }

    public String version() {
        return version;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public Collection<TableInfo> tables() {
        return tables.values();
    }

    public List<String> tableNames() {
        return tables.values().stream().map(TableInfo::name).sorted(String.CASE_INSENSITIVE_ORDER).toList();
    }

    public List<ForeignKey> foreignKeys() {
        return foreignKeys;
    }

    public Optional<TableInfo> table(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(key(stripQualifier(name))));
    }

    public boolean hasTable(String name) {
        return table(name).isPresent();
    }

    public boolean hasColumn(String table, String column) {
        return table(table).map(t -> t.hasColumn(column)).orElse(false);
    }

    /**
     * Drops schema/catalog qualifiers and identifier quotes: {@code "public"."Patients"} becomes {@code Patients}.
     */
    public static String stripQualifier(String name) {
        String s = name.trim();
        int dot = s.lastIndexOf('.');
        if (dot >= 0) {
            s = s.substring(dot + 1);
        }
        return s.replace("\"", "").replace("`", "").replace("[", "").replace("]", "");
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static String computeVersion(Collection<TableInfo> tables, List<ForeignKey> fks) {
        StringBuilder sb = new StringBuilder();
        for (TableInfo table : tables) {
            sb.append(key(table.name())).append('(');
            for (ColumnInfo column : table.columns()) {
                sb.append(key(column.name())).append(':').append(column.dataType()).append(',');
            }
            sb.append(");");
        }
        for (ForeignKey fk : fks) {
            sb.append(key(fk.fromTable())).append('.').append(key(fk.fromColumn()))
                    .append("->").append(key(fk.toTable())).append('.').append(key(fk.toColumn())).append(';');
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
