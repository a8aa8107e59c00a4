package com.querypilot.model;

import java.util.Objects;

/**
 * One retrieved schema fact with its relevance score.
 */
public record ContextElement(
        String id,
        ContextKind kind,
        String content,
        ContextMetadata metadata,
        double score
) {

    public ContextElement {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(metadata, "metadata");
        if (kind != metadata.kind()) {
            throw new IllegalArgumentException("Metadata kind " + metadata.kind() + " does not match element kind " + kind);
        }
        content = content == null ? "" : content;
    }

    public static ContextElement of(String id, String content, ContextMetadata metadata, double score) {
        return new ContextElement(id, metadata.kind(), content, metadata, score);
    }

    public ContextElement withScore(double newScore) {
        return new ContextElement(id, kind, content, metadata, newScore);
    }

    /**
     * Table this element belongs to, or {@code null} for examples and rules.
     */
    public String owningTable() {
        if (metadata instanceof ContextMetadata.TableMetadata table) {
            return table.table();
        }
        if (metadata instanceof ContextMetadata.ColumnMetadata column) {
            return column.table();
        }
        return null;
    }
}
