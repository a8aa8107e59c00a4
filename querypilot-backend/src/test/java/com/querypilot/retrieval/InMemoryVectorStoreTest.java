package com.querypilot.retrieval;

import com.querypilot.model.ContextKind;
import com.querypilot.model.ContextMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryVectorStoreTest {

    private final InMemoryVectorStore store = new InMemoryVectorStore();

    @Test
    void ranksByCosineAndHonoursTopK() {
        store.replaceAll(List.of(
                table("table:patients", new float[]{1, 0}),
                table("table:wards", new float[]{0, 1}),
                table("table:encounters", new float[]{0.6f, 0.8f})));

        List<VectorHit> hits = store.search(new float[]{1, 0}, 2, Set.of());

        assertThat(hits).extracting(VectorHit::id).containsExactly("table:patients", "table:encounters");
        assertThat(hits.get(1).score()).isCloseTo(0.6d, within(1e-6));
    }

    @Test
    void filtersByKind() {
        store.replaceAll(List.of(
                table("table:patients", new float[]{1, 0}),
                new VectorDocument("column:patients.ward", "ward",
                        new ContextMetadata.ColumnMetadata("patients", "ward", "VARCHAR"), new float[]{1, 0})));

        assertThat(store.search(new float[]{1, 0}, 5, Set.of(ContextKind.COLUMN)))
                .extracting(VectorHit::id)
                .containsExactly("column:patients.ward");
    }

    @Test
    void replaceAllSwapsTheWholeIndex() {
        store.replaceAll(List.of(table("table:patients", new float[]{1, 0})));
        store.replaceAll(List.of(table("table:wards", new float[]{0, 1})));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.search(new float[]{1, 0}, 0, Set.of())).isEmpty();
    }

    @Test
    void zeroVectorScoresZeroAndMismatchedDimensionsFail() {
        assertThat(InMemoryVectorStore.cosine(new float[]{0, 0}, new float[]{1, 0})).isZero();
        assertThatThrownBy(() -> InMemoryVectorStore.cosine(new float[]{1}, new float[]{1, 0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static VectorDocument table(String id, float[] vector) {
        String name = id.substring(id.indexOf(':') + 1);
        return new VectorDocument(id, name, new ContextMetadata.TableMetadata(name, 10, null), vector);
    }
}
