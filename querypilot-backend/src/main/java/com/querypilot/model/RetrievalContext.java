package com.querypilot.model;

import java.util.List;
import java.util.Objects;

/**
 * Ranked, token-bounded set of schema facts assembled for one query.
 */
public record RetrievalContext(
        Query query,
        List<ContextElement> elements,
        int totalTokens,
        int tokenBudget
) {

    public RetrievalContext {
        Objects.requireNonNull(query, "query");
        elements = elements == null ? List.of() : List.copyOf(elements);
        if (totalTokens > tokenBudget) {
            throw new IllegalArgumentException(
                    "Context uses " + totalTokens + " tokens, exceeding the budget of " + tokenBudget);
        }
    }

    public static RetrievalContext empty(Query query, int tokenBudget) {
        return new RetrievalContext(query, List.of(), 0, tokenBudget);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public List<ContextElement> ofKind(ContextKind kind) {
        return elements.stream().filter(e -> e.kind() == kind).toList();
    }

    public List<String> tableNames() {
        return ofKind(ContextKind.TABLE).stream()
                .map(ContextElement::owningTable)
                .toList();
    }

    public double averageScore() {
        return elements.stream().mapToDouble(ContextElement::score).average().orElse(0.0d);
    }
}
