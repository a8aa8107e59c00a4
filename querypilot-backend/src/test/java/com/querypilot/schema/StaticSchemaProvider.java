package com.querypilot.schema;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory schema provider whose snapshot tests can swap to simulate DDL changes.
 */
public class StaticSchemaProvider implements SchemaProvider {

    private final List<Consumer<SchemaSnapshot>> listeners = new CopyOnWriteArrayList<>();
    private volatile SchemaSnapshot snapshot;

    public StaticSchemaProvider(SchemaSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    @Override
    public SchemaSnapshot snapshot() {
        return snapshot;
    }

    @Override
    public void refresh() {
    }

    @Override
    public void onVersionChange(Consumer<SchemaSnapshot> listener) {
        listeners.add(listener);
    }

    public void replace(SchemaSnapshot replacement) {
        boolean changed = !replacement.version().equals(snapshot.version());
        snapshot = replacement;
        if (changed) {
            listeners.forEach(listener -> listener.accept(replacement));
        }
    }
}
