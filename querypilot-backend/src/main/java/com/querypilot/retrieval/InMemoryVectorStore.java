package com.querypilot.retrieval;

import com.querypilot.model.ContextKind;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Exact cosine search over an in-memory list. Documents are expected to carry unit-length vectors.
 */
public class InMemoryVectorStore implements VectorStore {

    private volatile List<VectorDocument> documents = List.of();

    @Override
    public List<VectorHit> search(float[] vector, int topK, Set<ContextKind> kinds) {
        if (topK <= 0) {
            return List.of();
        }
        return documents.stream()
                .filter(doc -> kinds == null || kinds.isEmpty() || kinds.contains(doc.metadata().kind()))
                .map(doc -> new VectorHit(doc.id(), doc.content(), doc.metadata(), cosine(vector, doc.vector())))
                .sorted(Comparator.comparingDouble(VectorHit::score).reversed().thenComparing(VectorHit::id))
                .limit(topK)
                .toList();
    }

    @Override
    public void replaceAll(List<VectorDocument> replacement) {
        documents = List.copyOf(replacement);
    }

    @Override
    public int size() {
        return documents.size();
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0d;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
