package com.querypilot.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import com.querypilot.model.ErrorClass;
import com.querypilot.model.ExecutionResult;
import com.querypilot.model.QueryResponse;
import com.querypilot.schema.ColumnInfo;
import com.querypilot.schema.SchemaSnapshot;
import com.querypilot.schema.StaticSchemaProvider;
import com.querypilot.schema.TableInfo;
import com.querypilot.schema.TestSchemas;

class ResponseCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final StaticSchemaProvider schemaProvider = new StaticSchemaProvider(TestSchemas.hospital());
    private final ResponseCache cache = new ResponseCache(Duration.ofMinutes(10), 100, nanos::get).bindTo(schemaProvider);

    private static QueryResponse answered(String queryId) {
        ExecutionResult result = ExecutionResult.complete(List.of("admitted"), List.of(Map.of("admitted", 14L)), 4);
        return new QueryResponse(queryId, "SELECT COUNT(*) AS admitted FROM patients", result,
                "The answer is 14 (admitted).", 120, false, Map.of("generation", 80L));
    }

    private Fingerprint fingerprint(String text) {
        return Fingerprint.of(text, schemaProvider.schemaVersion());
    }

    @Test
    void identicalQuestionHitsAfterNormalization() {
        cache.put(fingerprint("How many patients were admitted yesterday?"), answered("q1"));

        assertThat(cache.get(fingerprint("  how many PATIENTS were admitted yesterday ")))
                .get()
                .extracting(QueryResponse::queryId)
                .isEqualTo("q1");
    }

    @Test
    void entriesExpireAfterTtl() {
        cache.put(fingerprint("How many doctors are there?"), answered("q1"));

        nanos.addAndGet(Duration.ofMinutes(9).toNanos());
        assertThat(cache.get(fingerprint("How many doctors are there?"))).isPresent();

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(cache.get(fingerprint("How many doctors are there?"))).isEmpty();
    }

    @Test
    void schemaVersionChangeDropsEverything() {
        Fingerprint before = fingerprint("How many doctors are there?");
        cache.put(before, answered("q1"));

        schemaProvider.replace(SchemaSnapshot.of(List.of(new TableInfo("doctors",
                List.of(new ColumnInfo("id", "INTEGER")), 300L, null)), List.of()));

        assertThat(cache.get(before)).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(fingerprint("How many doctors are there?")).isNotEqualTo(before);
    }

    @Test
    void failedResultsAreNotStored() {
        QueryResponse failed = new QueryResponse("q1", "SELECT 1",
                ExecutionResult.failed(ErrorClass.TRANSIENT, "connection lost", 3), "", 10, false, Map.of());

        cache.put(fingerprint("How many doctors are there?"), failed);

        assertThat(cache.get(fingerprint("How many doctors are there?"))).isEmpty();
    }

    @Test
    void cacheHitCopyKeepsAnswerWithNewIdentity() {
        QueryResponse hit = answered("q1").asCacheHit("q2", 1);

        assertThat(hit.queryId()).isEqualTo("q2");
        assertThat(hit.cacheHit()).isTrue();
        assertThat(hit.latencyMs()).isEqualTo(1);
        assertThat(hit.answer()).isEqualTo("The answer is 14 (admitted).");
        assertThat(hit.stageTimingsMs()).containsOnlyKeys("cache_lookup");
    }
}
