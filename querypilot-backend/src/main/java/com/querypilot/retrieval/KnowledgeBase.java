package com.querypilot.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.querypilot.model.QueryIntent;

import java.util.List;
import java.util.Set;

/**
 * Curated question/statement examples and generation rules, loaded from JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KnowledgeBase(List<Example> examples, List<Rule> rules) {

    public KnowledgeBase {
        examples = examples == null ? List.of() : List.copyOf(examples);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static KnowledgeBase empty() {
        return new KnowledgeBase(List.of(), List.of());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Example(String question, String sql, QueryIntent intent) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Rule(String name, String text, Set<QueryIntent> intents) {
    }
}
