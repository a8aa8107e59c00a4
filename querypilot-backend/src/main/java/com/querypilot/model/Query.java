package com.querypilot.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single user question after intent analysis. Immutable once entities are extracted.
 */
public record Query(
        String id,
        String sessionId,
        String rawText,
        String normalizedText,
        Instant timestamp,
        QueryIntent intent,
        double confidence,
        Map<EntityType, List<String>> entities
) {

    public Query {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(intent, "intent");
        EnumMap<EntityType, List<String>> copy = new EnumMap<>(EntityType.class);
        if (entities != null) {
            entities.forEach((type, values) -> copy.put(type, List.copyOf(values)));
        }
        entities = Map.copyOf(copy);
    }

    public List<String> entities(EntityType type) {
        return entities.getOrDefault(type, List.of());
    }

    public boolean hasEntity(EntityType type) {
        return !entities(type).isEmpty();
    }
}
