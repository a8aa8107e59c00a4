package com.querypilot.retrieval;

/**
 * Computes fixed-dimension embedding vectors for text.
 */
public interface EmbeddingService {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return unit-length vector of {@link #dimensions()} entries
     */
    float[] embed(String text);

    int dimensions();
}
