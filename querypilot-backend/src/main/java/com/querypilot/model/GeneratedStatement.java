package com.querypilot.model;

import java.util.List;
import java.util.Objects;

/**
 * A statement produced by the generative backend and parsed out of its completion.
 */
public record GeneratedStatement(
        String text,
        String dialect,
        ComplexityTier complexity,
        List<String> referencedTables,
        int attempt,
        double confidence
) {

    public GeneratedStatement {
        Objects.requireNonNull(text, "text");
        referencedTables = referencedTables == null ? List.of() : List.copyOf(referencedTables);
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
    }
}
