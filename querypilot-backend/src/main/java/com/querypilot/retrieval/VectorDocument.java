package com.querypilot.retrieval;

import com.querypilot.model.ContextMetadata;

/**
 * Indexed document: text, its typed metadata and its embedding.
 */
public record VectorDocument(String id, String content, ContextMetadata metadata, float[] vector) {
}
