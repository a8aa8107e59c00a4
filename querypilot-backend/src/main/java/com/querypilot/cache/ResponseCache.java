package com.querypilot.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.querypilot.model.QueryResponse;
import com.querypilot.schema.SchemaProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Complete responses keyed by {@link Fingerprint}, expiring after a fixed TTL.
 *
 * <p>All entries are dropped when the schema version changes.
 */
@Slf4j
public class ResponseCache {

    private final Cache<Fingerprint, QueryResponse> cache;

    public ResponseCache(Duration ttl, long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .build();
    }

    /**
     * Register for schema version changes on {@code schemaProvider}.
     */
    public ResponseCache bindTo(SchemaProvider schemaProvider) {
        schemaProvider.onVersionChange(snapshot -> invalidateAll());
        return this;
    }

    public Optional<QueryResponse> get(Fingerprint fingerprint) {
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    /**
     * Failed executions are never stored.
     */
    public void put(Fingerprint fingerprint, QueryResponse response) {
        if (response.result() != null && response.result().success()) {
            cache.put(fingerprint, response);
        }
    }

    public void invalidateAll() {
        log.info("Clearing response cache (entries={})", cache.estimatedSize());
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
