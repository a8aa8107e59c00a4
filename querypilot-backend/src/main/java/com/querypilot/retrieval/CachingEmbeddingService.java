package com.querypilot.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.querypilot.util.TextNormalizer;

/**
 * Caches another {@link EmbeddingService} by normalized text.
 */
public class CachingEmbeddingService implements EmbeddingService {

    private final EmbeddingService delegate;
    private final Cache<String, float[]> cache;

    public CachingEmbeddingService(EmbeddingService delegate, long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder().maximumSize(maximumSize).build();
    }

    @Override
    public float[] embed(String text) {
        return cache.get(TextNormalizer.normalize(text), key -> delegate.embed(text)).clone();
    }

    @Override
    public int dimensions() {
        return delegate.dimensions();
    }
}
