package com.querypilot.retrieval;

import com.querypilot.model.ContextKind;

import java.util.List;
import java.util.Set;

/**
 * Similarity index over schema documents.
 */
public interface VectorStore {

    /**
     * Rank documents by similarity to {@code vector}.
     *
     * @param vector query embedding
     * @param topK maximum number of hits
     * @param kinds kinds to include, all kinds when empty
     * @return hits in descending score order
     */
    List<VectorHit> search(float[] vector, int topK, Set<ContextKind> kinds);

    /**
     * Atomically replace the whole index.
     */
    void replaceAll(List<VectorDocument> documents);

    int size();
}
