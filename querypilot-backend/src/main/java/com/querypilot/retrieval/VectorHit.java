package com.querypilot.retrieval;

import com.querypilot.model.ContextElement;
import com.querypilot.model.ContextMetadata;

public record VectorHit(String id, String content, ContextMetadata metadata, double score) {

    public ContextElement toElement() {
        return ContextElement.of(id, content, metadata, score);
    }
}
