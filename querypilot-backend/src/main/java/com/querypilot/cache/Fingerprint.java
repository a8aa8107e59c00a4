package com.querypilot.cache;

import com.querypilot.util.TextNormalizer;

/**
 * Cache key: normalized question text plus the schema version it was answered against.
 */
public record Fingerprint(String normalizedText, String schemaVersion) {

    public static Fingerprint of(String rawText, String schemaVersion) {
        return new Fingerprint(TextNormalizer.normalize(rawText), schemaVersion);
    }
}
