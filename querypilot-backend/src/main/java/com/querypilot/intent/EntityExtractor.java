package com.querypilot.intent;

import com.querypilot.model.EntityType;

import java.util.List;

/**
 * Extracts one kind of entity from normalized question text. Implementations are stateless.
 */
public interface EntityExtractor {

    EntityType type();

    /**
     * Matches in order of appearance, without duplicates.
     */
    List<String> extract(String normalizedText);
}
