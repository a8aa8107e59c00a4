package com.querypilot.schema;

import java.util.List;
import java.util.function.Consumer;

/**
 * Read access to the datastore schema, cached as a {@link SchemaSnapshot}.
 */
public interface SchemaProvider {

    /**
     * Current snapshot, reloaded when older than the configured TTL.
     */
    SchemaSnapshot snapshot();

    default boolean tableExists(String name) {
        return snapshot().hasTable(name);
    }

    default List<String> suggestSimilar(String name) {
        return NameSimilarity.rank(SchemaSnapshot.stripQualifier(name), snapshot().tableNames(), 5);
    }

    default String schemaVersion() {
        return snapshot().version();
    }

    /**
     * Force a reload on the next access.
     */
    void refresh();

    /**
     * Register a callback invoked with the new snapshot whenever the version token changes.
     */
    void onVersionChange(Consumer<SchemaSnapshot> listener);
}
